package com.omnioracle.liquidity;

import java.math.BigInteger;

/**
 * Pool reserves in raw token units and the pool's last update time (epoch seconds).
 */
public record PoolReserves(BigInteger reserve0, BigInteger reserve1, long lastTimestamp) {}
