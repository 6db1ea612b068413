package com.rental.settlement.domain;

/**
 * Lifecycle of a deal. The value is always derived from the two confirmation flags and the
 * cancellation marker; it is never set independently.
 */
public enum DealStatus {
    PENDING_BOTH,
    PENDING_OWNER,
    PENDING_TENANT,
    COMPLETED,
    CANCELLED;

    public static DealStatus derive(boolean ownerConfirmed, boolean tenantConfirmed, boolean cancelled) {
        if (ownerConfirmed && tenantConfirmed) {
            return COMPLETED;
        }
        if (cancelled) {
            return CANCELLED;
        }
        if (ownerConfirmed) {
            return PENDING_TENANT;
        }
        if (tenantConfirmed) {
            return PENDING_OWNER;
        }
        return PENDING_BOTH;
    }
}
