package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/** Order handed back to the client so it can open the gateway checkout. */
@Value
@Builder
public class PaymentOrder {

    String dealId;
    String orderId;
    BigDecimal amount;
    long amountInMinor;
    String currency;
    String receipt;
}
