package com.rental.settlement.api;

import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Optional body of owner confirmation and deal creation.
 */
@Data
public class AgreedRentRequestDto {

    /** Monthly rent in whole rupees. Falls back to the stored or listed rent when absent. */
    @Positive
    private Integer agreedRent;
}
