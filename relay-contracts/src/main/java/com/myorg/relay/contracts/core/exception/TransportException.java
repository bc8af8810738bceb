package com.myorg.relay.contracts.core.exception;

/**
 * A record was rejected by, or failed inside, an open producer session.
 */
public class TransportException extends RelayRetryableException {

    private final String topic;

    public TransportException(String topic, String message, Throwable cause) {
        super(RelayErrorReason.TRANSPORT.code(), message, cause);
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
