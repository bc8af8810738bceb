package com.myorg.relay.publisher;

public enum PublisherState {
    DISCONNECTED,
    CONNECTING,
    ACTIVE,
    STOPPED
}
