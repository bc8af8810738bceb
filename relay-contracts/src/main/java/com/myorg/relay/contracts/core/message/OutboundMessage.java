package com.myorg.relay.contracts.core.message;

import java.util.Arrays;
import java.util.Objects;

/**
 * One record headed for the cluster. Immutable once built: the payload is copied on the way in
 * and on the way out.
 */
public final class OutboundMessage {

    private final String destination;
    private final byte[] payload;

    private OutboundMessage(String destination, byte[] payload) {
        this.destination = destination;
        this.payload = payload;
    }

    public static OutboundMessage of(String destination, byte[] payload) {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination must not be blank");
        }
        if (payload == null) throw new IllegalArgumentException("payload must not be null");
        return new OutboundMessage(destination, payload.clone());
    }

    public String destination() {
        return destination;
    }

    public byte[] payload() {
        return payload.clone();
    }

    public int size() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutboundMessage other)) return false;
        return destination.equals(other.destination) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(destination) * 31 + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "OutboundMessage{destination=" + destination + ", bytes=" + payload.length + "}";
    }
}
