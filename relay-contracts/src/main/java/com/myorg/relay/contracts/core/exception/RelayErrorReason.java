package com.myorg.relay.contracts.core.exception;

public enum RelayErrorReason {
    CONFIG("CONFIG"),
    DISCOVERY("DISCOVERY"),
    PARSE("PARSE"),
    CONNECTION("CONNECTION"),
    TRANSPORT("TRANSPORT");

    private final String code;

    RelayErrorReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
