package com.omnioracle.liquidity;

import java.math.BigInteger;

/**
 * Read-only constant-product pool. Cumulative prices are UQ112x112 accumulators: {@code cumulativePrice0} sums
 * token1-per-token0 over time. Implementations throw on transport or format failure.
 */
public interface LiquidityPool {

    String ref();

    PoolReserves reserves();

    String token0();

    String token1();

    BigInteger cumulativePrice0();

    BigInteger cumulativePrice1();
}
