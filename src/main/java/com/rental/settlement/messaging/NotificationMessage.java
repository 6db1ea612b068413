package com.rental.settlement.messaging;

import com.rental.settlement.domain.NotificationKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Message published to the notifications topic. The mailer service renders the template
 * named by {@link #kind} with {@link #data}.
 */
@Value
@Builder
@Jacksonized
public class NotificationMessage {

    String messageId;
    NotificationKind kind;
    String recipientEmail;
    String recipientName;
    String userId;
    Map<String, Object> data;
    Instant createdAt;
}
