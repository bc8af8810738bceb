package com.myorg.relay.kafka.session;

import com.myorg.relay.contracts.core.exception.SessionConnectException;
import com.myorg.relay.contracts.core.message.BrokerEndpoint;

import java.util.List;

public interface SessionManager {

    /**
     * @throws SessionConnectException when the transport cannot be established
     */
    ProducerSession open(List<BrokerEndpoint> endpoints);

    /**
     * Closes the session; failures are logged, never thrown.
     */
    void close(ProducerSession session);
}
