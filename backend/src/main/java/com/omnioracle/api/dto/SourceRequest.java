package com.omnioracle.api.dto;

import com.omnioracle.api.validation.EvmAddress;
import com.omnioracle.domain.FeedKind;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * PUT /api/v1/admin/sources/{id}. A zero staleness bound selects the default.
 */
public record SourceRequest(
        @NotNull(message = "KIND_REQUIRED")
        FeedKind kind,

        @EvmAddress
        String endpointRef,

        @Min(value = 0, message = "INVALID_WEIGHT")
        @Max(value = 255, message = "INVALID_WEIGHT")
        int weight,

        @PositiveOrZero(message = "INVALID_STALENESS")
        long maxStalenessSeconds,

        Boolean active,

        String extra
) {
}
