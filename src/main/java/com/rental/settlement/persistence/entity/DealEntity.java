package com.rental.settlement.persistence.entity;

import com.rental.settlement.domain.DealPaymentStatus;
import com.rental.settlement.domain.DealStatus;
import com.rental.settlement.domain.DealView;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Persistent deal. One row per conversation; never deleted. The status column is a cache of
 * {@link DealStatus#derive(boolean, boolean, boolean)} and is recomputed on every write.
 */
@Entity
@Table(name = "deals",
        uniqueConstraints = @UniqueConstraint(name = "uk_deal_conversation", columnNames = "conversation_id"),
        indexes = {
                @Index(name = "idx_deal_owner_id", columnList = "owner_id"),
                @Index(name = "idx_deal_tenant_id", columnList = "tenant_id"),
                @Index(name = "idx_deal_status", columnList = "status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DealEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "conversation_id", nullable = false)
    private String conversationId;

    @Column(name = "property_id", nullable = false)
    private String propertyId;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "agreed_rent", nullable = false)
    private Integer agreedRent;

    @Column(name = "owner_confirmed", nullable = false)
    private boolean ownerConfirmed;

    @Column(name = "tenant_confirmed", nullable = false)
    private boolean tenantConfirmed;

    @Column(name = "owner_confirmed_at")
    private Instant ownerConfirmedAt;

    @Column(name = "tenant_confirmed_at")
    private Instant tenantConfirmedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DealStatus status;

    @Column(name = "success_fee_amount")
    private Integer successFeeAmount;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 10)
    private DealPaymentStatus paymentStatus;

    @Column(name = "payment_id")
    private String paymentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public DealStatus derivedStatus() {
        return DealStatus.derive(ownerConfirmed, tenantConfirmed, cancelledAt != null);
    }

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (paymentStatus == null) {
            paymentStatus = DealPaymentStatus.UNPAID;
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
        status = derivedStatus();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
        status = derivedStatus();
    }

    public DealView toView() {
        return DealView.builder()
                .id(id)
                .conversationId(conversationId)
                .propertyId(propertyId)
                .ownerId(ownerId)
                .tenantId(tenantId)
                .agreedRent(agreedRent)
                .ownerConfirmed(ownerConfirmed)
                .tenantConfirmed(tenantConfirmed)
                .ownerConfirmedAt(ownerConfirmedAt)
                .tenantConfirmedAt(tenantConfirmedAt)
                .status(derivedStatus())
                .successFeeAmount(successFeeAmount)
                .completedAt(completedAt)
                .cancelledAt(cancelledAt)
                .paymentStatus(paymentStatus)
                .paymentId(paymentId)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
