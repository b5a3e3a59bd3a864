package com.omnioracle.api.dto;

import com.omnioracle.domain.PeerPrice;

public record PeerPriceResponse(String price, String nativePrice, long timestamp, boolean valid) {

    public static PeerPriceResponse from(PeerPrice p) {
        return new PeerPriceResponse(p.price().toString(), p.nativePrice().toString(), p.timestamp(), p.valid());
    }
}
