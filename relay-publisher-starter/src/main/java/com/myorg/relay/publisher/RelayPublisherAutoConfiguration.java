package com.myorg.relay.publisher;

import com.myorg.relay.contracts.core.stats.StatsSink;
import com.myorg.relay.kafka.RelayKafkaAutoConfiguration;
import com.myorg.relay.kafka.RelayKafkaConfig;
import com.myorg.relay.kafka.discovery.BrokerResolver;
import com.myorg.relay.kafka.session.SessionManager;
import com.myorg.relay.observability.RelayObservabilityAutoConfiguration;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@AutoConfiguration(after = { RelayObservabilityAutoConfiguration.class, RelayKafkaAutoConfiguration.class })
@ConditionalOnProperty(prefix = "relay.publisher", name = "enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnBean({ BrokerResolver.class, SessionManager.class })
@EnableConfigurationProperties(RelayPublisherProperties.class)
public class RelayPublisherAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public InboundQueue relayInboundQueue(RelayPublisherProperties props) {
        return new InboundQueue(props.getQueueCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public RelayPublisher relayPublisher(InboundQueue queue) {
        return new DefaultRelayPublisher(queue);
    }

    @Bean
    @ConditionalOnMissingBean
    public RelayPublisherLoop relayPublisherLoop(RelayKafkaConfig config,
                                                 BrokerResolver resolver,
                                                 SessionManager sessionManager,
                                                 InboundQueue queue,
                                                 ObjectProvider<StatsSink> statsProvider,
                                                 RelayPublisherProperties props) {
        StatsSink stats = statsProvider.getIfAvailable(StatsSink::noop);
        return new RelayPublisherLoop(
                config, resolver, sessionManager, queue, stats,
                ReconnectPolicy.from(props.getReconnect()), props
        );
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "relay.observability", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public PublisherMetrics relayPublisherMetrics(MeterRegistry registry,
                                                  InboundQueue queue,
                                                  RelayPublisherLoop loop,
                                                  Environment env) {
        String app = env.getProperty("spring.application.name", "unknown-service");
        PublisherMetrics m = new PublisherMetrics(registry, app, queue, loop);
        m.preRegister();
        return m;
    }
}
