package com.omnioracle.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record WeightRequest(
        @NotNull(message = "INVALID_WEIGHT")
        @Min(value = 0, message = "INVALID_WEIGHT")
        @Max(value = 255, message = "INVALID_WEIGHT")
        Integer weight
) {
}
