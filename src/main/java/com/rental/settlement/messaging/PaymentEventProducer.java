package com.rental.settlement.messaging;

import com.rental.settlement.domain.PaymentEventName;
import com.rental.settlement.domain.PaymentRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes payment lifecycle events to Kafka once the ledger transaction has committed.
 * Events are keyed by deal id for ordered processing per deal. Publishing is best-effort:
 * failures are logged and never reach the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentEventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${rental.kafka.topic.payment-events:payment-events}")
    private String topic;

    public void publish(PaymentEventName eventType, PaymentRecord payment) {
        PaymentLifecycleEvent event = PaymentLifecycleEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType.name())
                .dealId(payment.getDealId())
                .paymentId(payment.getId())
                .externalOrderId(payment.getExternalOrderId())
                .externalPaymentId(payment.getExternalPaymentId())
                .amount(payment.getAmount())
                .currency(payment.getCurrency())
                .status(payment.getStatus())
                .timestamp(Instant.now())
                .build();
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, payment.getDealId(), event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish payment event dealId={} eventId={} type={}",
                            event.getDealId(), event.getEventId(), event.getEventType(), ex);
                } else {
                    log.debug("Published payment event: dealId={} eventId={} type={}",
                            event.getDealId(), event.getEventId(), event.getEventType());
                }
            });
        } catch (Exception e) {
            log.error("Could not hand payment event to Kafka: dealId={} type={}", event.getDealId(), event.getEventType(), e);
        }
    }
}
