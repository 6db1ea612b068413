package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Refund accepted by the gateway. Completion is reported later by webhook.
 */
@Value
@Builder
public class RemoteRefund {

    String refundId;
    long amountMinor;
    /** Gateway response as received, kept for the audit trail. */
    String rawPayload;
}
