package com.omnioracle.api.dto;

import com.omnioracle.domain.LatestPrice;

/**
 * Price as an 18-decimal fixed-point decimal string. {@code ("0", 0)} means no data.
 */
public record PriceResponse(String price, long timestamp) {

    public static PriceResponse from(LatestPrice latest) {
        return new PriceResponse(latest.price().toString(), latest.timestamp());
    }
}
