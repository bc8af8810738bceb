package com.myorg.relay.kafka;

import com.myorg.relay.contracts.core.exception.RelayConfigException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Set;

//Binds relay.kafka.* from application.yml / env. Read once, then frozen into RelayKafkaConfig.
@Data
@ConfigurationProperties(prefix = "relay.kafka")
public class RelayKafkaProperties {

    private static final Set<String> URL_TEMPLATE_VARIABLES = Set.of("framework", "host", "port");

    //Explicit brokers, comma separated host:port list.
    private String brokers;
    //Framework name to look up brokers for. Exactly one of brokers/framework must be set.
    private String framework;
    //Extra logging from the Kafka client.
    private boolean verbose = false;
    private final Discovery discovery = new Discovery();
    private final Producer producer = new Producer();
    private final Session session = new Session();

    @Data
    public static class Discovery {
        //SRV lookup is _<framework>._tcp.<domain>
        private String domain = "marathon.mesos";
        /**
         * Coordinator URL; {framework}, {host} and {port} come from the SRV answer.
         */
        private String connectionUrlTemplate = "http://{framework}.mesos:{port}/v1/connection";
        //JSON field holding the list of "host:port" strings
        private String brokersField = "dns";
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Producer {
        //true: wait for all in-sync replicas, false: leader only
        private boolean requireAllAcks = false;
        private boolean snappyCompression = true;
        //How long records are buffered before a batch is flushed
        private long flushMs = 5000;
        private int batchSize = 1_048_576;
        //Upper bound for a send() blocked on metadata or a full buffer
        private Duration maxBlock = Duration.ofSeconds(10);
        private String clientId = "relay-producer";
        //Only honoured together with requireAllAcks
        private boolean idempotence = false;
    }

    @Data
    public static class Session {
        //Probe the cluster with an admin client before creating the producer
        private boolean verifyConnect = true;
        private Duration connectTimeout = Duration.ofSeconds(10);
        //Async send failures in a row that retire a session; <=0 never retires
        private int maxConsecutiveSendErrors = 1;
    }

    /**
     * Validates and freezes the bound values.
     *
     * @throws RelayConfigException when neither or both of brokers/framework are set, or the
     *                              explicit list holds no usable address
     */
    public RelayKafkaConfig toConfig() {
        boolean hasBrokers = StringUtils.hasText(brokers);
        boolean hasFramework = StringUtils.hasText(framework);

        if (!hasBrokers && !hasFramework) {
            throw new RelayConfigException("Either relay.kafka.framework or relay.kafka.brokers must be specified");
        }
        if (hasBrokers && hasFramework) {
            throw new RelayConfigException("relay.kafka.framework and relay.kafka.brokers are mutually exclusive");
        }
        if (producer.getFlushMs() < 0 || producer.getFlushMs() > Integer.MAX_VALUE) {
            throw new RelayConfigException("relay.kafka.producer.flush-ms must be between 0 and " + Integer.MAX_VALUE);
        }

        DiscoveryMode mode = hasFramework ? DiscoveryMode.FRAMEWORK : DiscoveryMode.EXPLICIT;
        if (mode == DiscoveryMode.EXPLICIT) {
            // fail at startup rather than on the first connect
            BrokerLists.parseExplicit(brokers);
        } else {
            checkConnectionUrlTemplate(discovery.getConnectionUrlTemplate());
        }

        return RelayKafkaConfig.builder()
                .mode(mode)
                .brokers(hasBrokers ? brokers.trim() : null)
                .framework(hasFramework ? framework.trim() : null)
                .discoveryDomain(discovery.getDomain())
                .connectionUrlTemplate(discovery.getConnectionUrlTemplate())
                .brokersField(discovery.getBrokersField())
                .discoveryTimeout(discovery.getTimeout())
                .requireAllAcks(producer.isRequireAllAcks())
                .snappyCompression(producer.isSnappyCompression())
                .flushInterval(Duration.ofMillis(producer.getFlushMs()))
                .batchSize(producer.getBatchSize())
                .maxBlock(producer.getMaxBlock())
                .clientId(producer.getClientId())
                .idempotence(producer.isIdempotence())
                .verbose(verbose)
                .verifyConnect(session.isVerifyConnect())
                .connectTimeout(session.getConnectTimeout())
                .maxConsecutiveSendErrors(session.getMaxConsecutiveSendErrors())
                .build();
    }

    private static void checkConnectionUrlTemplate(String template) {
        if (!StringUtils.hasText(template)) {
            throw new RelayConfigException("relay.kafka.discovery.connection-url-template must be set");
        }
        List<String> names;
        try {
            names = new UriTemplate(template).getVariableNames();
        } catch (IllegalArgumentException e) {
            throw new RelayConfigException("Invalid relay.kafka.discovery.connection-url-template: " + e.getMessage(), e);
        }
        for (String name : names) {
            if (!URL_TEMPLATE_VARIABLES.contains(name)) {
                throw new RelayConfigException("Unknown placeholder {" + name
                        + "} in relay.kafka.discovery.connection-url-template, expected one of " + URL_TEMPLATE_VARIABLES);
            }
        }
    }
}
