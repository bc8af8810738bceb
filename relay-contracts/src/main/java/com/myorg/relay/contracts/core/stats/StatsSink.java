package com.myorg.relay.contracts.core.stats;

/**
 * One-way telemetry channel. Implementations must never block the caller: the publish path
 * emits on every message.
 */
@FunctionalInterface
public interface StatsSink {

    void emit(StatsEvent event);

    static StatsSink noop() {
        return event -> { };
    }
}
