package com.hookledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * DTO for minting new units.
 */
@Data
public class MintRequest {

    @NotBlank(message = "Recipient is required")
    private String to;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount cannot be negative")
    private Long amount;
}
