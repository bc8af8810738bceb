package com.myorg.relay.observability;

import com.myorg.relay.contracts.core.stats.StatsSink;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@AutoConfiguration
@ConditionalOnProperty(prefix = "relay.observability", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RelayObservabilityProperties.class)
public class RelayObservabilityAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public StatsChannel relayStatsChannel(RelayObservabilityProperties props) {
        return new StatsChannel(props.getStatsCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public StatsSink relayStatsSink(StatsChannel channel,
                                    RelayObservabilityProperties props,
                                    ObjectProvider<MeterRegistry> registryProvider,
                                    Environment env) {
        StatsSink base = channel::offer;

        MeterRegistry registry = registryProvider.getIfAvailable();
        if (registry == null || !props.isMetricsEnabled()) return base;

        String app = env.getProperty("spring.application.name", "unknown-service");
        RelayMetrics metrics = new RelayMetrics(registry, app, channel);
        metrics.preRegister(); // meters exist before the first event
        return new MeteredStatsSink(base, metrics);
    }
}
