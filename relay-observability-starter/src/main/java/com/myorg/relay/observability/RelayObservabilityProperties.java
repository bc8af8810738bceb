package com.myorg.relay.observability;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "relay.observability")
public class RelayObservabilityProperties {
    private boolean enabled = true;
    private boolean metricsEnabled = true;
    //Max events held for the external consumer; newer events are dropped once full.
    private int statsCapacity = 10_000;
}
