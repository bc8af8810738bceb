package com.myorg.relay.publisher;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class PublisherMetrics {

    private final MeterRegistry registry;
    private final String serviceName;
    private final InboundQueue queue;
    private final RelayPublisherLoop loop;

    public void preRegister() {
        Gauge.builder("relay.inbound.depth", queue, InboundQueue::size)
                .tag("service", serviceName)
                .register(registry);

        Gauge.builder("relay.publisher.active", loop, l -> l.getState() == PublisherState.ACTIVE ? 1 : 0)
                .tag("service", serviceName)
                .register(registry);
    }
}
