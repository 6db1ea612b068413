package com.rental.settlement.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer shared by notifications and payment lifecycle events. Values are written as
 * plain JSON (no type headers) so the mailer and reporting consumers need no Java classes.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    /** Bounds how long a send may block on broker metadata; callers run on request threads. */
    @Value("${rental.kafka.max-block-ms:2000}")
    private long maxBlockMs;

    @Bean(name = "settlementEventObjectMapper")
    public ObjectMapper settlementEventObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public ProducerFactory<String, Object> settlementProducerFactory(
            @Qualifier("settlementEventObjectMapper") ObjectMapper objectMapper) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), jsonSerializer(objectMapper));
    }

    @Bean
    public KafkaTemplate<String, Object> kafkaTemplate(ProducerFactory<String, Object> settlementProducerFactory) {
        return new KafkaTemplate<>(settlementProducerFactory);
    }

    static Serializer<Object> jsonSerializer(ObjectMapper objectMapper) {
        return new Serializer<Object>() {
            @Override
            public byte[] serialize(String topic, Object data) {
                if (data == null) {
                    return null;
                }
                try {
                    byte[] result = objectMapper.writeValueAsBytes(data);
                    // Body not logged: notifications carry email addresses.
                    log.debug("Serialized {} for topic={} length={}", data.getClass().getSimpleName(), topic, result.length);
                    return result;
                } catch (Exception e) {
                    log.error("Serialization failed for topic={}", topic, e);
                    throw new SerializationException("Failed to serialize " + data.getClass().getSimpleName(), e);
                }
            }
        };
    }
}
