package com.myorg.relay.kafka.session;

import java.time.Duration;
import java.util.Map;

@FunctionalInterface
public interface ClusterProbe {

    /**
     * Returns once at least one broker answered, or throws.
     */
    void verify(Map<String, Object> adminConfig, Duration timeout) throws Exception;
}
