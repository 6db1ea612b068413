package com.rental.settlement.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Drops webhook deliveries the gateway sends more than once. The event id header is claimed
 * with a Redis set-if-absent for 24 hours. When Redis is unavailable the delivery is let
 * through: the ledger's conditional transitions make reprocessing harmless.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookDeduplicationService {

    static final String KEY_PREFIX = "webhook:event:";
    static final Duration TTL = Duration.ofHours(24);

    private final RedisTemplate<String, WebhookReceipt> redisTemplate;

    /**
     * Claims the event id.
     *
     * @return true when this delivery should be processed; false when the id was already claimed
     */
    public boolean claim(String eventId, String eventName) {
        if (eventId == null || eventId.isBlank()) {
            return true;
        }
        WebhookReceipt receipt = WebhookReceipt.builder()
                .eventId(eventId)
                .eventName(eventName)
                .receivedAt(Instant.now())
                .build();
        try {
            Boolean first = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + eventId, receipt, TTL);
            if (Boolean.FALSE.equals(first)) {
                log.info("Duplicate webhook delivery skipped: eventId={} event={}", eventId, eventName);
                return false;
            }
            return true;
        } catch (Exception e) {
            log.warn("Webhook de-duplication unavailable for eventId={}, processing anyway: {}", eventId, e.getMessage());
            return true;
        }
    }

    /** Frees the event id after failed processing so a gateway retry is not dropped. */
    public void release(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            return;
        }
        try {
            redisTemplate.delete(KEY_PREFIX + eventId);
        } catch (Exception e) {
            log.warn("Could not release webhook claim for eventId={}: {}", eventId, e.getMessage());
        }
    }
}
