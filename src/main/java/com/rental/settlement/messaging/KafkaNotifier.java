package com.rental.settlement.messaging;

import com.rental.settlement.config.NotificationProperties;
import com.rental.settlement.domain.NotificationKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes notifications to Kafka for the mailer service, keyed by recipient user id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "rental.notifications.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaNotifier implements Notifier {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final NotificationProperties properties;

    @Override
    public NotificationOutcome notify(NotificationKind kind, String recipientEmail, String recipientName,
                                      Map<String, Object> data, String userIdForLogging) {
        if (recipientEmail == null || recipientEmail.isBlank()) {
            log.warn("Skipping {} notification: no email for userId={}", kind, userIdForLogging);
            return NotificationOutcome.SKIPPED;
        }
        NotificationMessage message = NotificationMessage.builder()
                .messageId(UUID.randomUUID().toString())
                .kind(kind)
                .recipientEmail(recipientEmail)
                .recipientName(recipientName)
                .userId(userIdForLogging)
                .data(data)
                .createdAt(Instant.now())
                .build();

        CompletableFuture<SendResult<String, Object>> future =
                kafkaTemplate.send(properties.getTopic(), userIdForLogging, message);
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish {} notification for userId={} messageId={}",
                        kind, userIdForLogging, message.getMessageId(), ex);
            } else {
                log.info("Published {} notification: userId={} messageId={} offset={}",
                        kind, userIdForLogging, message.getMessageId(),
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
        return NotificationOutcome.QUEUED;
    }
}
