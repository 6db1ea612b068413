package com.rental.settlement.domain;

/**
 * Names of the audit rows appended to the payment ledger.
 */
public enum PaymentEventName {
    PAYMENT_INITIATED,
    PAYMENT_AUTHORIZED,
    PAYMENT_COMPLETED,
    PAYMENT_FAILED,
    SIGNATURE_VERIFICATION_FAILED,
    REFUND_INITIATED,
    REFUND_COMPLETED,
    /** Validly signed webhook that matched no payment (wrong environment, test traffic). */
    ORPHAN_WEBHOOK
}
