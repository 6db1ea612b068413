package com.rental.settlement.domain;

/** Notification templates the settlement core asks the mailer to render. */
public enum NotificationKind {
    DEAL_CREATED,
    DEAL_COMPLETED
}
