package com.rental.settlement.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a success-fee payment. Transitions are monotonic:
 * PENDING/INITIATED to COMPLETED or FAILED, and COMPLETED to REFUNDED.
 */
public enum PaymentStatus {
    /** Row exists but no gateway order was confirmed yet. */
    PENDING,
    /** Gateway order created; waiting for the client to pay. */
    INITIATED,
    /** Captured at the gateway and verified. Reached at most once. */
    COMPLETED,
    /** Gateway reported the attempt as failed. A new order may be created. */
    FAILED,
    /** Refund confirmed by the gateway. Terminal. */
    REFUNDED,
    /** Administrative cancellation. Terminal. */
    CANCELLED;

    /** Statuses from which a payment may still move to COMPLETED or FAILED. */
    public static final Set<PaymentStatus> AWAITING_CAPTURE = EnumSet.of(PENDING, INITIATED);
}
