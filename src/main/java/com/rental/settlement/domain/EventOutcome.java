package com.rental.settlement.domain;

public enum EventOutcome {
    SUCCESS,
    FAILED
}
