package com.myorg.relay.contracts.core.exception;

public class SessionConnectException extends RelayRetryableException {
    public SessionConnectException(String message, Throwable cause) {
        super(RelayErrorReason.CONNECTION.code(), message, cause);
    }
}
