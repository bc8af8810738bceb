package com.myorg.relay.contracts.core.stats;

public record StatsEvent(StatsEventKind kind, String detail) {

    public StatsEvent {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (detail == null) detail = "";
    }

    public static StatsEvent connectionFailed(String reason) {
        return new StatsEvent(StatsEventKind.CONNECTION_FAILED, reason);
    }

    public static StatsEvent discoveryFailed(String framework) {
        return new StatsEvent(StatsEventKind.DISCOVERY_FAILED, framework);
    }

    public static StatsEvent sessionOpened(String brokers) {
        return new StatsEvent(StatsEventKind.SESSION_OPENED, brokers);
    }

    public static StatsEvent sessionClosed(String sessionId) {
        return new StatsEvent(StatsEventKind.SESSION_CLOSED, sessionId);
    }

    public static StatsEvent messageSent(String topic) {
        return new StatsEvent(StatsEventKind.MESSAGE_SENT, topic);
    }

    public static StatsEvent messageFailed(String topic) {
        return new StatsEvent(StatsEventKind.MESSAGE_FAILED, topic);
    }
}
