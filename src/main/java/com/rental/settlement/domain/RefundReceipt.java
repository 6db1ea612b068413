package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Acknowledgement of a refund request. The payment stays COMPLETED until the gateway
 * confirms the refund by webhook.
 */
@Value
@Builder
public class RefundReceipt {

    String dealId;
    String paymentId;
    String externalPaymentId;
    String externalRefundId;
    long amount;
    String currency;
    PaymentStatus paymentStatus;
    String reason;
    Instant initiatedAt;
}
