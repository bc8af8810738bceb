package com.myorg.relay.contracts.core.exception;

public class RelayNonRetryableException extends RuntimeException {

    private final String reason;

    public RelayNonRetryableException(String reason, String message) {
        this(reason, message, null);
    }

    public RelayNonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
