package com.myorg.relay.kafka.discovery;

import com.myorg.relay.contracts.core.exception.BrokerDiscoveryException;
import com.myorg.relay.contracts.core.exception.RelayConfigException;
import com.myorg.relay.contracts.core.message.BrokerEndpoint;
import com.myorg.relay.kafka.BrokerLists;
import com.myorg.relay.kafka.DiscoveryMode;
import com.myorg.relay.kafka.RelayKafkaConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriTemplate;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RequiredArgsConstructor
public class DefaultBrokerResolver implements BrokerResolver {

    private final SrvLookup srvLookup;
    private final RestTemplate restTemplate;
    private final DiscoveryResponseParser parser;

    @Override
    public List<BrokerEndpoint> resolve(RelayKafkaConfig config) {
        List<BrokerEndpoint> brokers = config.mode() == DiscoveryMode.FRAMEWORK
                ? lookupBrokers(config)
                : BrokerLists.parseExplicit(config.brokers());

        log.info("Kafka brokers: {}", brokers.stream().map(BrokerEndpoint::toString).collect(Collectors.joining(", ")));
        return brokers;
    }

    private List<BrokerEndpoint> lookupBrokers(RelayKafkaConfig config) {
        String framework = config.framework();
        if (!StringUtils.hasText(framework)) {
            throw new RelayConfigException("relay.kafka.framework must be set for framework discovery");
        }

        URI url = connectionEndpoint(config);
        log.info("Fetching broker list from Kafka framework at: {}", url);

        String body;
        try {
            body = restTemplate.getForObject(url, String.class);
        } catch (RestClientException e) {
            throw new BrokerDiscoveryException(framework,
                    "Broker lookup against framework " + framework + " failed: " + e.getMessage(), e);
        }
        return parser.parse(framework, body);
    }

    URI connectionEndpoint(RelayKafkaConfig config) {
        String framework = config.framework();
        List<SrvRecord> records = srvLookup.lookup(framework, config.discoveryDomain());
        if (records.isEmpty()) {
            throw new BrokerDiscoveryException(framework, "Framework '" + framework + "' not found");
        }

        SrvRecord coordinator = records.get(0);
        try {
            return new UriTemplate(config.connectionUrlTemplate()).expand(Map.of(
                    "framework", framework,
                    "host", coordinator.host(),
                    "port", coordinator.port()
            ));
        } catch (IllegalArgumentException e) {
            throw new RelayConfigException("Invalid relay.kafka.discovery.connection-url-template: " + e.getMessage(), e);
        }
    }
}
