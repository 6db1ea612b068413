package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

/** Client-side checkout callback: the gateway ids plus the signature it produced. */
@Value
@Builder
public class VerificationRequest {

    String externalOrderId;
    String externalPaymentId;
    String signature;
    String dealId;
}
