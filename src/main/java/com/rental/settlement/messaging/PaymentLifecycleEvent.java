package com.rental.settlement.messaging;

import com.rental.settlement.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Event emitted to Kafka after every committed payment transition. Used for reconciliation
 * reports and downstream accounting; the ledger remains the source of truth.
 */
@Value
@Builder
@Jacksonized
public class PaymentLifecycleEvent {

    String eventId;
    /** PAYMENT_INITIATED, PAYMENT_COMPLETED, PAYMENT_FAILED, REFUND_INITIATED, REFUND_COMPLETED */
    String eventType;
    String dealId;
    String paymentId;
    String externalOrderId;
    String externalPaymentId;
    /** Paise. */
    long amount;
    String currency;
    PaymentStatus status;
    Instant timestamp;
}
