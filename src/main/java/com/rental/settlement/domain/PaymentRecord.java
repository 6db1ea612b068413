package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read view of the payment row of a deal. The stored gateway signature is not exposed.
 */
@Value
@Builder
public class PaymentRecord {

    String id;
    String dealId;
    String payerId;
    /** Amount in paise. */
    long amount;
    String currency;
    String description;
    String externalOrderId;
    String externalPaymentId;
    String externalRefundId;
    PaymentStatus status;
    PaymentMethod method;
    String notes;
    Instant completedAt;
    Instant failedAt;
    Instant refundedAt;
    Instant refundInitiatedAt;
    Instant createdAt;
    Instant updatedAt;
}
