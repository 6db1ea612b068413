package com.rental.settlement.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.nio.charset.StandardCharsets;

/**
 * JSON serializer for {@link WebhookReceipt} without polymorphic type info, so values stay
 * readable from redis-cli and across releases.
 */
public class WebhookReceiptRedisSerializer implements RedisSerializer<WebhookReceipt> {

    private final ObjectMapper mapper;

    public WebhookReceiptRedisSerializer() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] serialize(WebhookReceipt value) throws SerializationException {
        if (value == null) return null;
        try {
            return mapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new SerializationException("Could not serialize WebhookReceipt", e);
        }
    }

    @Override
    public WebhookReceipt deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) return null;
        try {
            return mapper.readValue(new String(bytes, StandardCharsets.UTF_8), WebhookReceipt.class);
        } catch (Exception e) {
            throw new SerializationException("Could not deserialize WebhookReceipt", e);
        }
    }
}
