package com.hookledger.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for registering the ledger's asset.
 */
@Data
public class InitializeAssetRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 32, message = "Name must be at most 32 characters")
    private String name;

    @NotBlank(message = "Symbol is required")
    @Size(max = 10, message = "Symbol must be at most 10 characters")
    private String symbol;

    @NotNull(message = "Decimals is required")
    @Min(value = 0, message = "Decimals cannot be negative")
    @Max(value = 32, message = "Decimals must be at most 32")
    private Integer decimals;
}
