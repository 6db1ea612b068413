package com.rental.settlement.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Checkout callback forwarded by the client after the gateway reports success.
 */
@Data
public class VerifyPaymentRequestDto {

    @NotBlank
    private String orderId;

    @NotBlank
    private String paymentId;

    @NotBlank
    private String signature;

    @NotBlank
    private String dealId;
}
