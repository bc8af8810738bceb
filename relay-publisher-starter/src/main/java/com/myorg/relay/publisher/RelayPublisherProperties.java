package com.myorg.relay.publisher;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "relay.publisher")
public class RelayPublisherProperties {
    private boolean enabled = true;
    //Start the loop with the application context
    private boolean autoStartup = true;
    //<=0 means unbounded
    private int queueCapacity = 0;
    //How long the loop waits on an empty queue before re-checking the session
    private Duration pollInterval = Duration.ofMillis(200);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private final Reconnect reconnect = new Reconnect();

    @Data
    public static class Reconnect {
        //0 retries immediately
        private Duration initialBackoff = Duration.ofMillis(100);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);
    }
}
