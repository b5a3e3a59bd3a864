package com.omnioracle.api.dto;

import com.omnioracle.api.validation.EvmAddress;

/**
 * PUT /api/v1/peers/{chainId}. A blank or zero reference registers the peer as inactive.
 */
public record RegisterPeerRequest(
        @EvmAddress(optional = true)
        String remoteOracleRef
) {
}
