package com.rental.settlement.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Marker stored in Redis for a webhook delivery that has been taken for processing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookReceipt {

    private String eventId;
    private String eventName;
    private Instant receivedAt;
}
