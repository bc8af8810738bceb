package com.myorg.relay.kafka;

import lombok.Builder;

import java.time.Duration;

/**
 * Immutable view of {@link RelayKafkaProperties}, taken once at startup and handed to the
 * resolver and the session manager.
 */
@Builder(toBuilder = true)
public record RelayKafkaConfig(
        DiscoveryMode mode,
        String brokers,
        String framework,
        String discoveryDomain,
        String connectionUrlTemplate,
        String brokersField,
        Duration discoveryTimeout,
        boolean requireAllAcks,
        boolean snappyCompression,
        Duration flushInterval,
        int batchSize,
        Duration maxBlock,
        String clientId,
        boolean idempotence,
        boolean verbose,
        boolean verifyConnect,
        Duration connectTimeout,
        int maxConsecutiveSendErrors
) {
    public static RelayKafkaConfig explicit(String brokers) {
        return defaults().mode(DiscoveryMode.EXPLICIT).brokers(brokers).build();
    }

    public static RelayKafkaConfig framework(String framework) {
        return defaults().mode(DiscoveryMode.FRAMEWORK).framework(framework).build();
    }

    private static RelayKafkaConfigBuilder defaults() {
        RelayKafkaProperties p = new RelayKafkaProperties();
        return builder()
                .discoveryDomain(p.getDiscovery().getDomain())
                .connectionUrlTemplate(p.getDiscovery().getConnectionUrlTemplate())
                .brokersField(p.getDiscovery().getBrokersField())
                .discoveryTimeout(p.getDiscovery().getTimeout())
                .requireAllAcks(p.getProducer().isRequireAllAcks())
                .snappyCompression(p.getProducer().isSnappyCompression())
                .flushInterval(Duration.ofMillis(p.getProducer().getFlushMs()))
                .batchSize(p.getProducer().getBatchSize())
                .maxBlock(p.getProducer().getMaxBlock())
                .clientId(p.getProducer().getClientId())
                .idempotence(p.getProducer().isIdempotence())
                .verbose(p.isVerbose())
                .verifyConnect(p.getSession().isVerifyConnect())
                .connectTimeout(p.getSession().getConnectTimeout())
                .maxConsecutiveSendErrors(p.getSession().getMaxConsecutiveSendErrors());
    }
}
