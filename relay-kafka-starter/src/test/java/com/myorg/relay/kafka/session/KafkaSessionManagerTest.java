package com.myorg.relay.kafka.session;

import com.myorg.relay.contracts.core.exception.SessionConnectException;
import com.myorg.relay.contracts.core.message.BrokerEndpoint;
import com.myorg.relay.contracts.core.stats.StatsSink;
import com.myorg.relay.kafka.ProducerConfigFactory;
import com.myorg.relay.kafka.RelayKafkaConfig;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KafkaSessionManagerTest {

    private static final List<BrokerEndpoint> BROKERS = List.of(
            new BrokerEndpoint("b1", 9092),
            new BrokerEndpoint("b2", 9092)
    );

    @Test
    void open_probeFailure_shouldNameTheBrokers() {
        AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
        ClusterProbe probe = (adminConfig, timeout) -> {
            seen.set(adminConfig);
            throw new TimeoutException("Timed out waiting for a node assignment");
        };
        KafkaSessionManager manager = manager(config(true), probe);

        assertThatThrownBy(() -> manager.open(BROKERS))
                .isInstanceOf(SessionConnectException.class)
                .hasMessageContaining("b1:9092,b2:9092")
                .hasMessageContaining("Timed out waiting");
        assertThat(seen.get()).containsEntry(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, "b1:9092,b2:9092");
    }

    @Test
    void open_interruptedProbe_shouldKeepInterruptFlag() {
        ClusterProbe probe = (adminConfig, timeout) -> {
            throw new InterruptedException();
        };
        KafkaSessionManager manager = manager(config(true), probe);

        try {
            assertThatThrownBy(() -> manager.open(BROKERS)).isInstanceOf(SessionConnectException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void open_unresolvableBroker_shouldFailWithoutProbe() {
        KafkaSessionManager manager = manager(config(false), (adminConfig, timeout) -> {
            throw new AssertionError("probe must not run");
        });

        assertThatThrownBy(() -> manager.open(List.of(new BrokerEndpoint("relay-test.invalid", 9092))))
                .isInstanceOf(SessionConnectException.class)
                .hasMessageContaining("relay-test.invalid:9092");
    }

    @Test
    void open_noBrokers_shouldFail() {
        KafkaSessionManager manager = manager(config(false), (adminConfig, timeout) -> {});

        assertThatThrownBy(() -> manager.open(List.of())).isInstanceOf(SessionConnectException.class);
    }

    @Test
    void close_shouldSwallowShutdownFailures() {
        ProducerSession session = mock(ProducerSession.class);
        when(session.id()).thenReturn("s7");
        doThrow(new IllegalStateException("flush failed")).when(session).close();
        KafkaSessionManager manager = manager(config(false), (adminConfig, timeout) -> {});

        assertThatCode(() -> manager.close(session)).doesNotThrowAnyException();
        assertThatCode(() -> manager.close(null)).doesNotThrowAnyException();
        verify(session).close();
    }

    private static RelayKafkaConfig config(boolean verifyConnect) {
        return RelayKafkaConfig.explicit("b1:9092").toBuilder()
                .verifyConnect(verifyConnect)
                .connectTimeout(Duration.ofMillis(200))
                .maxBlock(Duration.ofMillis(200))
                .build();
    }

    private static KafkaSessionManager manager(RelayKafkaConfig config, ClusterProbe probe) {
        return new KafkaSessionManager(config, new ProducerConfigFactory(config), probe, StatsSink.noop());
    }
}
