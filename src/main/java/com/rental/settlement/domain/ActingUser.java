package com.rental.settlement.domain;

import lombok.Value;

/**
 * Authenticated caller of an operation: subject id plus platform role.
 */
@Value
public class ActingUser {

    String userId;
    UserRole role;

    public boolean isAdmin() {
        return role == UserRole.SUPER_ADMIN;
    }
}
