package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Order created at the gateway.
 */
@Value
@Builder
public class RemoteOrder {

    String orderId;
    long amountMinor;
    String currency;
    String receipt;
    /** Gateway response as received, kept for the audit trail. */
    String rawPayload;
}
