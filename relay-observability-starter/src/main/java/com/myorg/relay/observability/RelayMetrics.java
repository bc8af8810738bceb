package com.myorg.relay.observability;

import com.myorg.relay.contracts.core.stats.StatsEventKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@RequiredArgsConstructor
public class RelayMetrics {

    private final MeterRegistry registry;
    private final String serviceName;
    private final StatsChannel channel;

    private final Map<StatsEventKind, Counter> counters = new EnumMap<>(StatsEventKind.class);

    /** Call once on startup. */
    public void preRegister() {
        for (StatsEventKind kind : StatsEventKind.values()) {
            counters.put(kind, Counter.builder("relay.stats.events")
                    .tag("service", serviceName)
                    .tag("kind", kind.code())
                    .register(registry));
        }

        Gauge.builder("relay.stats.backlog", channel, StatsChannel::size)
                .tag("service", serviceName)
                .register(registry);
        FunctionCounter.builder("relay.stats.dropped", channel, StatsChannel::droppedCount)
                .tag("service", serviceName)
                .register(registry);
    }

    public void record(StatsEventKind kind) {
        Counter c = counters.get(kind);
        if (c != null) c.increment();
    }
}
