package com.myorg.relay.kafka.session;

import com.myorg.relay.contracts.core.message.BrokerEndpoint;
import com.myorg.relay.contracts.core.message.OutboundMessage;
import com.myorg.relay.contracts.core.stats.StatsEvent;
import com.myorg.relay.kafka.BrokerLists;
import com.myorg.relay.kafka.ProducerConfigFactory;
import com.myorg.relay.kafka.RelayKafkaConfig;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.test.EmbeddedKafkaBroker;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.kafka.test.utils.KafkaTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@EmbeddedKafka(partitions = 1, topics = KafkaSessionManagerEmbeddedKafkaTest.TOPIC)
class KafkaSessionManagerEmbeddedKafkaTest {

    static final String TOPIC = "relay-it";

    @Test
    void openSubmitClose_shouldDeliverRecordsInOrder(EmbeddedKafkaBroker broker) {
        String bootstrap = broker.getBrokersAsString();
        List<BrokerEndpoint> endpoints = BrokerLists.parseExplicit(bootstrap);
        RelayKafkaConfig config = RelayKafkaConfig.explicit(bootstrap).toBuilder()
                .flushInterval(Duration.ofMillis(10))
                .snappyCompression(false)
                .build();
        List<StatsEvent> events = new CopyOnWriteArrayList<>();
        KafkaSessionManager manager = new KafkaSessionManager(
                config, new ProducerConfigFactory(config), new AdminClientClusterProbe(), events::add);

        ProducerSession session = manager.open(endpoints);
        session.submit(OutboundMessage.of(TOPIC, "m1".getBytes(StandardCharsets.UTF_8)));
        session.submit(OutboundMessage.of(TOPIC, "m2".getBytes(StandardCharsets.UTF_8)));
        manager.close(session);

        assertThat(session.isUsable()).isFalse();
        assertThat(events).isEmpty();

        Map<String, Object> props = KafkaTestUtils.consumerProps("relay-it-group", "false", broker);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        List<String> received = new ArrayList<>();
        try (Consumer<String, byte[]> consumer = new DefaultKafkaConsumerFactory<String, byte[]>(props).createConsumer()) {
            broker.consumeFromAnEmbeddedTopic(consumer, TOPIC);
            long deadline = System.currentTimeMillis() + 15_000;
            while (received.size() < 2 && System.currentTimeMillis() < deadline) {
                for (ConsumerRecord<String, byte[]> r : consumer.poll(Duration.ofMillis(200))) {
                    received.add(new String(r.value(), StandardCharsets.UTF_8));
                }
            }
        }

        assertThat(received).containsExactly("m1", "m2");
    }
}
