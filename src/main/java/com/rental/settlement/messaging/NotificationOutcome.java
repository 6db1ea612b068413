package com.rental.settlement.messaging;

public enum NotificationOutcome {
    /** Handed to the transport; delivery is reported asynchronously. */
    QUEUED,
    /** Only written to the log (transport disabled). */
    LOGGED,
    /** Nothing sent: recipient has no email address. */
    SKIPPED
}
