package com.myorg.relay.contracts.core.exception;

/**
 * Broker lookup against a named framework failed: SRV lookup, coordinator fetch, or an unusable
 * broker list. Retried by the publisher loop.
 */
public class BrokerDiscoveryException extends RelayRetryableException {

    private final String framework;

    public BrokerDiscoveryException(String framework, String message) {
        this(framework, message, null);
    }

    public BrokerDiscoveryException(String framework, String message, Throwable cause) {
        this(RelayErrorReason.DISCOVERY, framework, message, cause);
    }

    protected BrokerDiscoveryException(RelayErrorReason reason, String framework, String message, Throwable cause) {
        super(reason.code(), message, cause);
        this.framework = framework;
    }

    public String getFramework() {
        return framework;
    }
}
