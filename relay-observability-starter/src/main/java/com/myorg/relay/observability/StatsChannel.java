package com.myorg.relay.observability;

import com.myorg.relay.contracts.core.stats.StatsEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded hand-off between the relay (writers) and a single external reader.
 *
 * <p>Writers never wait: when the buffer is full the incoming event is dropped and counted.
 * The reader decides how fast it wants to drain.
 */
@Slf4j
public class StatsChannel {

    private final BlockingQueue<StatsEvent> events;
    private final AtomicLong dropped = new AtomicLong();

    public StatsChannel(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.events = new ArrayBlockingQueue<>(capacity);
    }

    public boolean offer(StatsEvent event) {
        if (events.offer(event)) return true;

        long n = dropped.incrementAndGet();
        if (n == 1) {
            log.warn("Stats channel full, dropping events (first dropped kind={})", event.kind());
        } else {
            log.debug("Stats channel full, dropped={} kind={}", n, event.kind());
        }
        return false;
    }

    public StatsEvent poll(Duration timeout) throws InterruptedException {
        return events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public StatsEvent poll() {
        return events.poll();
    }

    public int drainTo(Collection<? super StatsEvent> target) {
        return events.drainTo(target);
    }

    public int size() {
        return events.size();
    }

    public long droppedCount() {
        return dropped.get();
    }
}
