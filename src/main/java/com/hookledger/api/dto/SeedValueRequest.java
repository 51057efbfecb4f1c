package com.hookledger.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * DTO for seeding a host-side value of an account.
 */
@Data
public class SeedValueRequest {

    @NotNull(message = "Value is required")
    @PositiveOrZero(message = "Value cannot be negative")
    private Long value;
}
