package com.hookledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * DTO for transferring units from the caller to another account.
 */
@Data
public class TransferRequest {

    @NotBlank(message = "Recipient is required")
    private String to;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount cannot be negative")
    private Long amount;
}
