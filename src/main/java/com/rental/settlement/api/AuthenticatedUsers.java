package com.rental.settlement.api;

import com.rental.settlement.domain.ActingUser;
import com.rental.settlement.domain.UserRole;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Locale;

/** Maps a verified bearer token to the caller of an operation. */
final class AuthenticatedUsers {

    private AuthenticatedUsers() {
    }

    static ActingUser from(Jwt jwt) {
        return new ActingUser(jwt.getSubject(), role(jwt));
    }

    private static UserRole role(Jwt jwt) {
        String role = jwt.getClaimAsString("role");
        if (role == null) {
            return null;
        }
        try {
            return UserRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
