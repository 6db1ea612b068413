package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PaymentEventRecord {

    String id;
    String paymentId;
    PaymentEventName eventName;
    EventOutcome outcome;
    String rawPayload;
    String errorMessage;
    Instant createdAt;
}
