package com.myorg.relay.kafka;

import com.myorg.relay.contracts.core.exception.RelayConfigException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelayKafkaPropertiesTest {

    @Test
    void toConfig_withNeitherBrokersNorFramework_shouldFail() {
        RelayKafkaProperties props = new RelayKafkaProperties();

        assertThatThrownBy(props::toConfig)
                .isInstanceOf(RelayConfigException.class)
                .hasMessageContaining("relay.kafka.framework");
    }

    @Test
    void toConfig_withBothBrokersAndFramework_shouldFail() {
        RelayKafkaProperties props = new RelayKafkaProperties();
        props.setBrokers("b1:9092");
        props.setFramework("kafka");

        assertThatThrownBy(props::toConfig).isInstanceOf(RelayConfigException.class);
    }

    @Test
    void toConfig_withExplicitListOfOnlySeparators_shouldFailAtStartup() {
        RelayKafkaProperties props = new RelayKafkaProperties();
        props.setBrokers(" , ,");

        assertThatThrownBy(props::toConfig)
                .isInstanceOf(RelayConfigException.class)
                .hasMessageContaining("non-empty");
    }

    @Test
    void toConfig_shouldFreezeDefaults() {
        RelayKafkaProperties props = new RelayKafkaProperties();
        props.setFramework(" kafka ");

        RelayKafkaConfig cfg = props.toConfig();

        assertThat(cfg.mode()).isEqualTo(DiscoveryMode.FRAMEWORK);
        assertThat(cfg.framework()).isEqualTo("kafka");
        assertThat(cfg.brokers()).isNull();
        assertThat(cfg.discoveryDomain()).isEqualTo("marathon.mesos");
        assertThat(cfg.brokersField()).isEqualTo("dns");
        assertThat(cfg.requireAllAcks()).isFalse();
        assertThat(cfg.snappyCompression()).isTrue();
        assertThat(cfg.flushInterval()).isEqualTo(Duration.ofMillis(5000));
        assertThat(cfg.maxConsecutiveSendErrors()).isEqualTo(1);

        // later edits to the bound properties do not leak into the snapshot
        props.getProducer().setFlushMs(10);
        assertThat(cfg.flushInterval()).isEqualTo(Duration.ofMillis(5000));
    }

    @Test
    void toConfig_withUnknownUrlPlaceholder_shouldFailAtStartup() {
        RelayKafkaProperties props = new RelayKafkaProperties();
        props.setFramework("kafka");
        props.getDiscovery().setConnectionUrlTemplate("http://{fw}.mesos:{port}/v1/connection");

        assertThatThrownBy(props::toConfig)
                .isInstanceOf(RelayConfigException.class)
                .hasMessageContaining("{fw}");
    }

    @Test
    void toConfig_withHostAndPortPlaceholders_shouldPass() {
        RelayKafkaProperties props = new RelayKafkaProperties();
        props.setFramework("kafka");
        props.getDiscovery().setConnectionUrlTemplate("https://{host}:{port}/{framework}/v1/connection");

        assertThat(props.toConfig().connectionUrlTemplate())
                .isEqualTo("https://{host}:{port}/{framework}/v1/connection");
    }

    @Test
    void toConfig_withFlushIntervalBeyondIntRange_shouldFailAtStartup() {
        RelayKafkaProperties props = new RelayKafkaProperties();
        props.setBrokers("b1:9092");
        props.getProducer().setFlushMs(Integer.MAX_VALUE + 1L);

        assertThatThrownBy(props::toConfig)
                .isInstanceOf(RelayConfigException.class)
                .hasMessageContaining("flush-ms");
    }
}
