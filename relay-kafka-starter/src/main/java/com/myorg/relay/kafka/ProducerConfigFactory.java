package com.myorg.relay.kafka;

import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.util.HashMap;
import java.util.Map;

//Turns the relay config into Kafka producer settings for one broker list.
@RequiredArgsConstructor
public class ProducerConfigFactory {

    private final RelayKafkaConfig config;

    public Map<String, Object> producerConfig(String bootstrapServers) {
        Map<String, Object> p = new HashMap<>();
        p.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        p.put(ProducerConfig.CLIENT_ID_CONFIG, config.clientId());
        p.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        p.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);

        // leader-only acks and snappy unless told otherwise
        p.put(ProducerConfig.ACKS_CONFIG, config.requireAllAcks() ? "all" : "1");
        p.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, config.requireAllAcks() && config.idempotence());
        p.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, config.snappyCompression() ? "snappy" : "none");
        p.put(ProducerConfig.LINGER_MS_CONFIG, Math.toIntExact(config.flushInterval().toMillis()));
        p.put(ProducerConfig.BATCH_SIZE_CONFIG, config.batchSize());
        p.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, config.maxBlock().toMillis());
        return p;
    }

    public Map<String, Object> adminConfig(String bootstrapServers) {
        Map<String, Object> a = new HashMap<>();
        a.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        a.put(AdminClientConfig.CLIENT_ID_CONFIG, config.clientId() + "-probe");
        return a;
    }
}
