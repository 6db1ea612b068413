package com.rental.settlement.persistence.entity;

import com.rental.settlement.domain.EventOutcome;
import com.rental.settlement.domain.PaymentEventName;
import com.rental.settlement.domain.PaymentEventRecord;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit row for every payment transition attempt, successful or not.
 * Orphan webhooks are stored with a null payment id.
 */
@Entity
@Table(name = "payment_events", indexes = {
        @Index(name = "idx_event_payment_id", columnList = "payment_id"),
        @Index(name = "idx_event_name", columnList = "event_name"),
        @Index(name = "idx_event_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentEventEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "payment_id", updatable = false)
    private String paymentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_name", nullable = false, length = 50, updatable = false)
    private PaymentEventName eventName;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 10, updatable = false)
    private EventOutcome outcome;

    @Column(name = "raw_payload", length = 10000, updatable = false)
    private String rawPayload;

    @Column(name = "error_message", length = 1000, updatable = false)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public PaymentEventRecord toRecord() {
        return PaymentEventRecord.builder()
                .id(id)
                .paymentId(paymentId)
                .eventName(eventName)
                .outcome(outcome)
                .rawPayload(rawPayload)
                .errorMessage(errorMessage)
                .createdAt(createdAt)
                .build();
    }
}
