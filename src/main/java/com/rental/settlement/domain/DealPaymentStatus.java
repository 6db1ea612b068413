package com.rental.settlement.domain;

/** Whether the success fee of a completed deal has been collected. */
public enum DealPaymentStatus {
    UNPAID,
    PAID
}
