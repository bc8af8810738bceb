package com.myorg.relay.publisher;

import java.time.Duration;

/**
 * Capped exponential delay between connection attempts. Used from the loop thread only.
 *
 * <p>failures=1 =&gt; initial, failures=2 =&gt; initial*multiplier, ... never above max.
 */
public class ReconnectPolicy {

    private final long initialMs;
    private final double multiplier;
    private final long maxMs;

    private int failures;

    public ReconnectPolicy(Duration initial, double multiplier, Duration max) {
        if (initial.isNegative()) throw new IllegalArgumentException("initial backoff must not be negative");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
        this.initialMs = initial.toMillis();
        this.multiplier = multiplier;
        this.maxMs = Math.max(initialMs, max.toMillis());
    }

    public static ReconnectPolicy from(RelayPublisherProperties.Reconnect props) {
        return new ReconnectPolicy(props.getInitialBackoff(), props.getMultiplier(), props.getMaxBackoff());
    }

    /** Records a failed attempt and returns how long to wait before the next one. */
    public Duration onFailure() {
        failures++;
        return delay(failures);
    }

    public void reset() {
        failures = 0;
    }

    public int failures() {
        return failures;
    }

    Duration delay(int failureCount) {
        if (initialMs == 0) return Duration.ZERO;

        int pow = Math.max(0, failureCount - 1);
        double ms = initialMs * Math.pow(multiplier, Math.min(pow, 62));
        return Duration.ofMillis((long) Math.min(ms, maxMs));
    }
}
