package com.omnioracle.domain;

import java.math.BigInteger;

/**
 * Remote oracle on another chain plus the last price received from it. {@code lastNativePrice18} is zero when the
 * peer did not report its native price.
 */
public record PeerEndpoint(
        long chainId,
        String remoteOracleRef,
        boolean active,
        BigInteger lastPrice18,
        BigInteger lastNativePrice18,
        long lastTimestamp
) {

    public static PeerEndpoint of(long chainId, String remoteOracleRef, boolean active) {
        return new PeerEndpoint(chainId, remoteOracleRef, active, BigInteger.ZERO, BigInteger.ZERO, 0L);
    }

    public PeerEndpoint withReference(String ref, boolean newActive) {
        return new PeerEndpoint(chainId, ref, newActive, lastPrice18, lastNativePrice18, lastTimestamp);
    }

    public PeerEndpoint withActive(boolean newActive) {
        return new PeerEndpoint(chainId, remoteOracleRef, newActive, lastPrice18, lastNativePrice18, lastTimestamp);
    }

    public PeerEndpoint withPrice(BigInteger price18, BigInteger nativePrice18, long timestamp) {
        return new PeerEndpoint(chainId, remoteOracleRef, active, price18, nativePrice18, timestamp);
    }
}
