package com.rental.settlement.config;

import com.rental.settlement.core.WebhookReceipt;
import com.rental.settlement.core.WebhookReceiptRedisSerializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis template for webhook de-duplication. Values use {@link WebhookReceiptRedisSerializer}
 * (plain JSON, no {@code @class}).
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, WebhookReceipt> webhookReceiptRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, WebhookReceipt> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new WebhookReceiptRedisSerializer());
        template.afterPropertiesSet();
        return template;
    }
}
