package com.omnioracle.api.dto;

import com.omnioracle.oracle.PriceUpdateResult;

public record UpdateResponse(String price, String nativePrice, long timestamp, boolean degraded, String ratioMethod) {

    public static UpdateResponse from(PriceUpdateResult result) {
        return new UpdateResponse(
                result.price().toString(),
                result.nativePrice().toString(),
                result.timestamp(),
                result.degraded(),
                result.ratioMethod() != null ? result.ratioMethod().name() : null);
    }
}
