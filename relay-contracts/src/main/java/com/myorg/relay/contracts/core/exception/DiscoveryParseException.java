package com.myorg.relay.contracts.core.exception;

//Coordinator answered, but the document does not hold a usable broker list.
public class DiscoveryParseException extends BrokerDiscoveryException {
    public DiscoveryParseException(String framework, String message) {
        this(framework, message, null);
    }

    public DiscoveryParseException(String framework, String message, Throwable cause) {
        super(RelayErrorReason.PARSE, framework, message, cause);
    }
}
