package com.myorg.relay.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.relay.contracts.core.stats.StatsSink;
import com.myorg.relay.kafka.discovery.BrokerResolver;
import com.myorg.relay.kafka.discovery.DefaultBrokerResolver;
import com.myorg.relay.kafka.discovery.DiscoveryResponseParser;
import com.myorg.relay.kafka.discovery.JndiSrvLookup;
import com.myorg.relay.kafka.discovery.SrvLookup;
import com.myorg.relay.kafka.session.AdminClientClusterProbe;
import com.myorg.relay.kafka.session.ClusterProbe;
import com.myorg.relay.kafka.session.KafkaSessionManager;
import com.myorg.relay.kafka.session.SessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.web.client.RestTemplate;

//Wires the broker resolver and the session manager from relay.kafka.*.
@Slf4j
@AutoConfiguration(afterName = "com.myorg.relay.observability.RelayObservabilityAutoConfiguration")
@ConditionalOnClass(KafkaTemplate.class)
@EnableConfigurationProperties(RelayKafkaProperties.class)
public class RelayKafkaAutoConfiguration {

    /**
     * Frozen configuration. Fails the context (and so the process) when neither or both of
     * relay.kafka.brokers / relay.kafka.framework are set.
     */
    @Bean
    @ConditionalOnMissingBean
    public RelayKafkaConfig relayKafkaConfig(RelayKafkaProperties props) {
        RelayKafkaConfig config = props.toConfig();
        if (config.verbose()) {
            LoggingSystem.get(RelayKafkaAutoConfiguration.class.getClassLoader())
                    .setLogLevel("org.apache.kafka", LogLevel.DEBUG);
            log.info("Verbose Kafka client logging enabled");
        }
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public SrvLookup relaySrvLookup(RelayKafkaConfig config) {
        return new JndiSrvLookup(config.discoveryTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(name = "relayDiscoveryRestTemplate")
    public RestTemplate relayDiscoveryRestTemplate(RelayKafkaConfig config) {
        SimpleClientHttpRequestFactory rf = new SimpleClientHttpRequestFactory();
        rf.setConnectTimeout(config.discoveryTimeout());
        rf.setReadTimeout(config.discoveryTimeout());
        return new RestTemplate(rf);
    }

    @Bean
    @ConditionalOnMissingBean
    public BrokerResolver brokerResolver(SrvLookup srvLookup,
                                         RestTemplate relayDiscoveryRestTemplate,
                                         ObjectProvider<ObjectMapper> mapperProvider,
                                         RelayKafkaConfig config) {
        ObjectMapper mapper = mapperProvider.getIfAvailable(ObjectMapper::new);
        return new DefaultBrokerResolver(
                srvLookup,
                relayDiscoveryRestTemplate,
                new DiscoveryResponseParser(mapper, config.brokersField())
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public ProducerConfigFactory relayProducerConfigFactory(RelayKafkaConfig config) {
        return new ProducerConfigFactory(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public ClusterProbe relayClusterProbe() {
        return new AdminClientClusterProbe();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionManager relaySessionManager(RelayKafkaConfig config,
                                              ProducerConfigFactory configFactory,
                                              ClusterProbe probe,
                                              ObjectProvider<StatsSink> statsProvider) {
        return new KafkaSessionManager(config, configFactory, probe, statsProvider.getIfAvailable(StatsSink::noop));
    }
}
