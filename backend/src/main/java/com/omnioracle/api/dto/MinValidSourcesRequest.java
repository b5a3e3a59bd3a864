package com.omnioracle.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record MinValidSourcesRequest(
        @Min(value = 1, message = "INVALID_MIN_SOURCES")
        @Max(value = 4, message = "INVALID_MIN_SOURCES")
        int minValidSources
) {
}
