package com.omnioracle.api.dto;

import com.omnioracle.sync.PendingRequest;

/**
 * 202 body of POST /api/v1/peers/{chainId}/request: the correlation id to look for and the quoted fee.
 */
public record RemoteReadTicketResponse(String correlationId, long chainId, String nativeFee, String lzTokenFee) {

    public static RemoteReadTicketResponse from(PendingRequest p) {
        return new RemoteReadTicketResponse(p.correlationId(), p.chainId(),
                p.fee().nativeFee().toString(), p.fee().lzTokenFee().toString());
    }
}
