package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read view of a deal. The ledger returns it without summaries; the state machine attaches
 * owner, tenant and property summaries before handing it to callers.
 */
@Value
@Builder(toBuilder = true)
public class DealView {

    String id;
    String conversationId;
    String propertyId;
    String ownerId;
    String tenantId;
    Integer agreedRent;
    boolean ownerConfirmed;
    boolean tenantConfirmed;
    Instant ownerConfirmedAt;
    Instant tenantConfirmedAt;
    DealStatus status;
    Integer successFeeAmount;
    Instant completedAt;
    Instant cancelledAt;
    DealPaymentStatus paymentStatus;
    String paymentId;
    Instant createdAt;
    Instant updatedAt;

    PartySummary owner;
    PartySummary tenant;
    PropertySummary property;

    public boolean involves(String userId) {
        return userId != null && (userId.equals(ownerId) || userId.equals(tenantId));
    }
}
