package com.myorg.relay.kafka.session;

import com.myorg.relay.contracts.core.exception.SessionConnectException;
import com.myorg.relay.contracts.core.message.BrokerEndpoint;
import com.myorg.relay.contracts.core.stats.StatsSink;
import com.myorg.relay.kafka.ProducerConfigFactory;
import com.myorg.relay.kafka.RelayKafkaConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@RequiredArgsConstructor
public class KafkaSessionManager implements SessionManager {

    private final RelayKafkaConfig config;
    private final ProducerConfigFactory configFactory;
    private final ClusterProbe probe;
    private final StatsSink stats;

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public ProducerSession open(List<BrokerEndpoint> endpoints) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new SessionConnectException("No brokers to connect to", null);
        }
        String bootstrap = BrokerEndpoint.join(endpoints);

        if (config.verifyConnect()) {
            try {
                probe.verify(configFactory.adminConfig(bootstrap), config.connectTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SessionConnectException("Interrupted while connecting to [" + bootstrap + "]", e);
            } catch (Exception e) {
                throw new SessionConnectException(
                        "Producer creation against brokers [" + bootstrap + "] failed: " + rootMessage(e), e);
            }
        }

        DefaultKafkaProducerFactory<String, byte[]> pf = producerFactory(configFactory.producerConfig(bootstrap));
        KafkaTemplate<String, byte[]> template = new KafkaTemplate<>(pf);
        try {
            // create the producer now so bad addresses fail here and not on the first send
            template.execute(producer -> null);
        } catch (RuntimeException e) {
            pf.reset();
            throw new SessionConnectException(
                    "Producer creation against brokers [" + bootstrap + "] failed: " + rootMessage(e), e);
        }

        KafkaProducerSession session = new KafkaProducerSession(
                "s" + sequence.incrementAndGet(),
                endpoints,
                pf,
                template,
                stats,
                config.maxConsecutiveSendErrors()
        );
        session.startErrorDrain();
        log.info("Opened Kafka session {} against [{}] acks={} compression={} flushMs={}",
                session.id(), bootstrap,
                config.requireAllAcks() ? "all" : "leader",
                config.snappyCompression() ? "snappy" : "none",
                config.flushInterval().toMillis());
        return session;
    }

    @Override
    public void close(ProducerSession session) {
        if (session == null) return;
        try {
            session.close();
            log.info("Closed Kafka session {}", session.id());
        } catch (RuntimeException e) {
            log.warn("Failed to shut down producer cleanly: session={} error={}", session.id(), e.toString(), e);
        }
    }

    protected DefaultKafkaProducerFactory<String, byte[]> producerFactory(Map<String, Object> producerConfig) {
        return new DefaultKafkaProducerFactory<>(producerConfig);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(e);
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
