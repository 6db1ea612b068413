package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PartySummary {

    String id;
    String firstName;
    String lastName;
    String email;

    public String getFullName() {
        if (lastName == null || lastName.isBlank()) {
            return firstName;
        }
        return firstName + " " + lastName;
    }
}
