package com.rental.settlement.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Request body for opening a gateway order for a deal's success fee.
 */
@Data
public class CreateOrderRequestDto {

    @NotBlank(message = "dealId is required")
    private String dealId;

    /** Rupees; converted to paise before reaching the gateway. */
    @NotNull
    @DecimalMin("1.00")
    private BigDecimal amount;

    private String description;

    @NotBlank(message = "phone is required")
    @Pattern(regexp = "^[6-9]\\d{9}$", message = "phone must be a 10-digit Indian mobile number")
    private String phone;

    @Email
    private String email;

    private String userName;
}
