package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request to open a gateway order for a deal's success fee.
 */
@Value
@Builder
public class OrderRequest {

    String dealId;
    /** Amount in rupees (major units). Converted to paise at the gateway boundary. */
    BigDecimal amount;
    String description;
    String payerId;
    String email;
    String phone;
    String userName;
}
