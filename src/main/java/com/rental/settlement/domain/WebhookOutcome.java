package com.rental.settlement.domain;

/**
 * What a verified webhook delivery did to the ledger.
 */
public enum WebhookOutcome {
    /** A status transition was applied by this delivery. */
    APPLIED,
    /** The target state was already reached; nothing changed. */
    ALREADY_APPLIED,
    /** Recorded in the audit log only (e.g. authorization, ignored failure). */
    AUDITED,
    /** No payment matched; recorded as an orphan webhook. */
    ORPHAN,
    /** Event name this service does not handle. */
    IGNORED,
    /** Event id already processed. */
    DUPLICATE
}
