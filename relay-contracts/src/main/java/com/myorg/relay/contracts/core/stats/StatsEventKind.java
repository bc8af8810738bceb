package com.myorg.relay.contracts.core.stats;

//Lifecycle tags emitted by the publisher loop and by each session's error drain.
public enum StatsEventKind {
    CONNECTION_FAILED("relay.connection_failed"),
    DISCOVERY_FAILED("relay.discovery_failed"),
    SESSION_OPENED("relay.session_opened"),
    SESSION_CLOSED("relay.session_closed"),
    MESSAGE_SENT("relay.message_sent"),
    MESSAGE_FAILED("relay.message_failed");

    private final String code;

    StatsEventKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
