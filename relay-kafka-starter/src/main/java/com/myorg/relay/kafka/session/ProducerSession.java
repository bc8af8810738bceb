package com.myorg.relay.kafka.session;

import com.myorg.relay.contracts.core.exception.TransportException;
import com.myorg.relay.contracts.core.message.BrokerEndpoint;
import com.myorg.relay.contracts.core.message.OutboundMessage;

import java.util.List;

/**
 * One live connection cycle to the cluster.
 *
 * <p>Records handed to {@link #submit} are buffered and batched by the underlying producer;
 * delivery failures arrive later on the session's error stream. Once a session has reported an
 * error or been closed, {@link #isUsable()} stays false for good.
 */
public interface ProducerSession {

    String id();

    List<BrokerEndpoint> endpoints();

    /**
     * @throws TransportException when the producer refuses the record outright
     */
    void submit(OutboundMessage message);

    boolean isUsable();

    /**
     * Flushes and releases the transport. Idempotent.
     */
    void close();
}
