package com.rental.settlement.domain;

public enum PropertyStatus {
    AVAILABLE,
    RENTED,
    INACTIVE
}
