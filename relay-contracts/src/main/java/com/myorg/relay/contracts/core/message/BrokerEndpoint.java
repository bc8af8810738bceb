package com.myorg.relay.contracts.core.message;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Network address of one cluster member, rendered as {@code host:port}.
 */
public record BrokerEndpoint(String host, int port) {

    public BrokerEndpoint {
        if (host == null || host.isBlank()) throw new IllegalArgumentException("host must not be blank");
        if (port < 1 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
    }

    /**
     * Parses {@code host:port}; the port follows the last colon.
     */
    public static BrokerEndpoint parse(String value) {
        if (value == null) throw new IllegalArgumentException("broker address must not be null");
        String v = value.trim();
        int idx = v.lastIndexOf(':');
        if (idx <= 0 || idx == v.length() - 1) {
            throw new IllegalArgumentException("broker address must be host:port, got '" + value + "'");
        }
        int port;
        try {
            port = Integer.parseInt(v.substring(idx + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("broker port is not a number in '" + value + "'", e);
        }
        return new BrokerEndpoint(v.substring(0, idx), port);
    }

    public static String join(List<BrokerEndpoint> endpoints) {
        return endpoints.stream().map(BrokerEndpoint::toString).collect(Collectors.joining(","));
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
