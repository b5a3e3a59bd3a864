package com.omnioracle.api.dto;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * PUT /api/v1/admin/breaker. {@code maxDeviationBps = 0} disables the gate.
 */
public record BreakerRequest(
        @PositiveOrZero(message = "INVALID_DEVIATION")
        long maxDeviationBps,

        @PositiveOrZero(message = "INVALID_GRACE_PERIOD")
        long gracePeriodSeconds
) {
}
