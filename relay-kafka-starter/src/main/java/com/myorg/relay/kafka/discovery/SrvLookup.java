package com.myorg.relay.kafka.discovery;

import com.myorg.relay.contracts.core.exception.BrokerDiscoveryException;

import java.util.List;

public interface SrvLookup {

    /**
     * Looks up {@code _<service>._tcp.<domain>}.
     *
     * @return records ordered by {@link SrvRecord#PREFERRED_FIRST}; empty when the name does not exist
     * @throws BrokerDiscoveryException when the lookup itself fails
     */
    List<SrvRecord> lookup(String service, String domain);
}
