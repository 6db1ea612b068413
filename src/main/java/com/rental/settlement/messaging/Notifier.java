package com.rental.settlement.messaging;

import com.rental.settlement.domain.NotificationKind;

import java.util.Map;

/**
 * Outbound notification channel. Always invoked off the request thread through
 * {@link NotificationDispatcher}; callers never wait on delivery.
 */
public interface Notifier {

    /**
     * Hands one notification to the channel.
     *
     * @param data             template variables (property title, rent, other party, role)
     * @param userIdForLogging recipient user id, used as message key and in logs
     */
    NotificationOutcome notify(NotificationKind kind, String recipientEmail, String recipientName,
                               Map<String, Object> data, String userIdForLogging);
}
