package com.rental.settlement.domain;

public enum UserRole {
    OWNER,
    TENANT,
    SUPER_ADMIN
}
