package com.omnioracle.domain;

import java.math.BigInteger;
import java.util.List;

public record OracleStatus(
        OracleMode mode,
        boolean emergencyMode,
        boolean circuitBreakerActive,
        boolean inGracePeriod,
        int activeSources,
        int minValidSources,
        long maxDeviationBps,
        boolean priceInitialized,
        BigInteger latestPrice,
        long latestTimestamp,
        List<Long> activePeers,
        int pendingRequests
) {}
