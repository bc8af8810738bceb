package com.myorg.relay.kafka;

import com.myorg.relay.contracts.core.exception.RelayConfigException;
import com.myorg.relay.contracts.core.message.BrokerEndpoint;

import java.util.ArrayList;
import java.util.List;

public final class BrokerLists {
    private BrokerLists() {}

    /**
     * Splits a comma separated {@code host:port} list, keeping order. Blank entries are skipped.
     */
    public static List<BrokerEndpoint> parseExplicit(String brokers) {
        List<BrokerEndpoint> out = new ArrayList<>();
        if (brokers != null) {
            for (String part : brokers.split(",")) {
                if (part.isBlank()) continue;
                try {
                    out.add(BrokerEndpoint.parse(part));
                } catch (IllegalArgumentException e) {
                    throw new RelayConfigException("Invalid entry in relay.kafka.brokers: " + e.getMessage(), e);
                }
            }
        }
        if (out.isEmpty()) {
            throw new RelayConfigException("relay.kafka.brokers must be non-empty");
        }
        return out;
    }
}
