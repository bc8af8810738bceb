package com.myorg.relay.contracts.core.exception;

//Bad or missing configuration. Fatal: the relay refuses to start, or the loop stops.
public class RelayConfigException extends RelayNonRetryableException {
    public RelayConfigException(String message) {
        super(RelayErrorReason.CONFIG.code(), message);
    }

    public RelayConfigException(String message, Throwable cause) {
        super(RelayErrorReason.CONFIG.code(), message, cause);
    }
}
