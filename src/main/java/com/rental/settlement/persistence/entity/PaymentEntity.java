package com.rental.settlement.persistence.entity;

import com.rental.settlement.domain.PaymentMethod;
import com.rental.settlement.domain.PaymentRecord;
import com.rental.settlement.domain.PaymentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Persistent success-fee payment, one per deal. Status changes go through conditional
 * updates in {@link com.rental.settlement.persistence.repository.PaymentRepository}.
 */
@Entity
@Table(name = "payments",
        uniqueConstraints = @UniqueConstraint(name = "uk_payment_deal", columnNames = "deal_id"),
        indexes = {
                @Index(name = "idx_payment_external_order_id", columnList = "external_order_id"),
                @Index(name = "idx_payment_external_payment_id", columnList = "external_payment_id"),
                @Index(name = "idx_payment_status", columnList = "status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "deal_id", nullable = false)
    private String dealId;

    @Column(name = "payer_id", nullable = false)
    private String payerId;

    /** Paise. */
    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "external_order_id")
    private String externalOrderId;

    @Column(name = "external_payment_id")
    private String externalPaymentId;

    @Column(name = "external_signature")
    private String externalSignature;

    @Column(name = "external_refund_id")
    private String externalRefundId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "method", length = 20)
    private PaymentMethod method;

    @Column(name = "notes", length = 2000)
    private String notes;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Column(name = "refund_initiated_at")
    private Instant refundInitiatedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (status == null) {
            status = PaymentStatus.PENDING;
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public PaymentRecord toRecord() {
        return PaymentRecord.builder()
                .id(id)
                .dealId(dealId)
                .payerId(payerId)
                .amount(amount)
                .currency(currency)
                .description(description)
                .externalOrderId(externalOrderId)
                .externalPaymentId(externalPaymentId)
                .externalRefundId(externalRefundId)
                .status(status)
                .method(method)
                .notes(notes)
                .completedAt(completedAt)
                .failedAt(failedAt)
                .refundedAt(refundedAt)
                .refundInitiatedAt(refundInitiatedAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
