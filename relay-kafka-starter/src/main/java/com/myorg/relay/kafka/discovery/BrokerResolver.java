package com.myorg.relay.kafka.discovery;

import com.myorg.relay.contracts.core.message.BrokerEndpoint;
import com.myorg.relay.kafka.RelayKafkaConfig;

import java.util.List;

//Called before every session open; implementations must not cache.
public interface BrokerResolver {

    /**
     * @throws com.myorg.relay.contracts.core.exception.RelayConfigException      unusable explicit list
     * @throws com.myorg.relay.contracts.core.exception.BrokerDiscoveryException  lookup or fetch failed
     * @throws com.myorg.relay.contracts.core.exception.DiscoveryParseException   malformed connection document
     */
    List<BrokerEndpoint> resolve(RelayKafkaConfig config);
}
