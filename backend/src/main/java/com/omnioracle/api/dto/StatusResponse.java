package com.omnioracle.api.dto;

import com.omnioracle.domain.OracleStatus;

import java.util.List;

/**
 * GET /api/v1/oracle/status.
 */
public record StatusResponse(
        String mode,
        boolean emergencyMode,
        boolean circuitBreakerActive,
        boolean inGracePeriod,
        int activeSources,
        int minValidSources,
        long maxDeviationBps,
        boolean priceInitialized,
        String latestPrice,
        long latestTimestamp,
        List<Long> activePeers,
        int pendingRequests
) {

    public static StatusResponse from(OracleStatus s) {
        return new StatusResponse(
                s.mode().name(),
                s.emergencyMode(),
                s.circuitBreakerActive(),
                s.inGracePeriod(),
                s.activeSources(),
                s.minValidSources(),
                s.maxDeviationBps(),
                s.priceInitialized(),
                s.latestPrice().toString(),
                s.latestTimestamp(),
                s.activePeers(),
                s.pendingRequests());
    }
}
