package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** A payment together with its audit history, newest event first. */
@Value
@Builder
public class PaymentDetails {

    PaymentRecord payment;
    List<PaymentEventRecord> events;
}
