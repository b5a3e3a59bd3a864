package com.omnioracle.api.dto;

import com.omnioracle.domain.PriceUpdateRecord;

/**
 * One entry of GET /api/v1/oracle/history.
 */
public record PriceHistoryItem(String origin, Long sourceChainId, String price, String nativePrice,
                               long priceTimestamp, boolean degraded) {

    public static PriceHistoryItem from(PriceUpdateRecord r) {
        return new PriceHistoryItem(
                r.getOrigin() != null ? r.getOrigin().name() : null,
                r.getSourceChainId(),
                r.getPrice(),
                r.getNativePrice(),
                r.getPriceTimestamp(),
                r.isDegraded());
    }
}
