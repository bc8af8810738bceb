package com.myorg.relay.observability;

import com.myorg.relay.contracts.core.stats.StatsEvent;
import com.myorg.relay.contracts.core.stats.StatsSink;
import lombok.RequiredArgsConstructor;

//Counts every event, then hands it on. Counting happens even if the delegate drops it.
@RequiredArgsConstructor
public class MeteredStatsSink implements StatsSink {

    private final StatsSink delegate;
    private final RelayMetrics metrics;

    @Override
    public void emit(StatsEvent event) {
        metrics.record(event.kind());
        delegate.emit(event);
    }
}
