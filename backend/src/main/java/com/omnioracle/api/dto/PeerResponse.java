package com.omnioracle.api.dto;

import com.omnioracle.domain.PeerEndpoint;

public record PeerResponse(long chainId, String remoteOracleRef, boolean active, String lastPrice, String lastNativePrice,
                           long lastTimestamp) {

    public static PeerResponse from(PeerEndpoint p) {
        return new PeerResponse(p.chainId(), p.remoteOracleRef(), p.active(), p.lastPrice18().toString(),
                p.lastNativePrice18().toString(), p.lastTimestamp());
    }
}
