package com.omnioracle.api.dto;

import com.omnioracle.api.validation.FixedPointValue;
import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/admin/emergency. Price as an 18-decimal fixed-point string.
 */
public record EmergencyRequest(
        @NotBlank(message = "INVALID_PRICE")
        @FixedPointValue
        String price
) {
}
