package com.rental.settlement.api;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RefundRequestDto {

    @Size(max = 255)
    private String reason;
}
