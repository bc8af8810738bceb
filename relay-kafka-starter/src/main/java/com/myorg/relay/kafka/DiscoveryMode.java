package com.myorg.relay.kafka;

public enum DiscoveryMode {
    EXPLICIT,
    FRAMEWORK
}
