package com.myorg.relay.contracts.core.exception;

public class RelayRetryableException extends RuntimeException {

    private final String reason;

    public RelayRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
