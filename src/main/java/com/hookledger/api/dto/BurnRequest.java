package com.hookledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * DTO for burning units held by an account.
 */
@Data
public class BurnRequest {

    @NotBlank(message = "Source account is required")
    private String from;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount cannot be negative")
    private Long amount;
}
