package com.omnioracle.liquidity;

import com.omnioracle.common.FixedPoint;
import com.omnioracle.domain.InvalidConfigurationException;
import com.omnioracle.domain.RatioUnavailableException;
import com.omnioracle.domain.TwapState;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Asset-per-native ratio from one or two pools. The TWAP runs on the primary pool; whenever it cannot produce a
 * value (disabled, not initialized, window not elapsed) the estimator falls back to spot reserves, blending two
 * pools by native-side liquidity.
 */
@Slf4j
public class LiquidityRatioEstimator {

    public static final int MAX_POOLS = 2;

    private static final BigInteger UINT256_MODULUS = BigInteger.ONE.shiftLeft(256);

    private final List<LiquidityPool> pools;
    private final String nativeToken;
    private final int nativeDecimals;
    private final int assetDecimals;
    private final boolean twapEnabled;
    private final long twapPeriodSeconds;

    private TwapState twapState;

    public LiquidityRatioEstimator(List<LiquidityPool> pools, String nativeToken, int nativeDecimals, int assetDecimals,
                                   boolean twapEnabled, long twapPeriodSeconds) {
        if (pools == null || pools.isEmpty() || pools.size() > MAX_POOLS) {
            throw new InvalidConfigurationException("Between 1 and " + MAX_POOLS + " pools are required");
        }
        if (nativeToken == null || nativeToken.isBlank()) {
            throw new InvalidConfigurationException("Native token address is required");
        }
        if (twapEnabled && twapPeriodSeconds <= 0) {
            throw new InvalidConfigurationException("TWAP period must be positive: " + twapPeriodSeconds);
        }
        this.pools = List.copyOf(pools);
        this.nativeToken = nativeToken.strip();
        this.nativeDecimals = nativeDecimals;
        this.assetDecimals = assetDecimals;
        this.twapEnabled = twapEnabled;
        this.twapPeriodSeconds = twapPeriodSeconds;
    }

    /**
     * Snapshots the primary pool's accumulators. No-op (returns false) when the pool cannot be read.
     */
    public synchronized boolean init() {
        LiquidityPool pool = pools.get(0);
        try {
            PoolReserves reserves = pool.reserves();
            twapState = new TwapState(pool.cumulativePrice0(), pool.cumulativePrice1(), reserves.lastTimestamp(),
                    twapState != null ? twapState.ratio18() : BigInteger.ZERO);
            log.info("TWAP initialized on pool {} at {}", pool.ref(), reserves.lastTimestamp());
            return true;
        } catch (RuntimeException e) {
            log.warn("TWAP init skipped, pool {} unreadable: {}", pool.ref(), e.getMessage());
            return false;
        }
    }

    /**
     * Current ratio. TWAP when a full window has elapsed, otherwise spot.
     *
     * @throws RatioUnavailableException when no pool yields a ratio
     */
    public synchronized RatioEstimate estimate() {
        if (twapEnabled) {
            if (twapState == null) {
                init();
            } else {
                Optional<BigInteger> twap = advanceTwap();
                if (twap.isPresent()) {
                    return new RatioEstimate(twap.get(), RatioEstimate.Method.TWAP);
                }
            }
        }
        return spot();
    }

    public synchronized Optional<TwapState> twapState() {
        return Optional.ofNullable(twapState);
    }

    /** Restores a persisted TWAP snapshot. */
    public synchronized void restore(TwapState state) {
        if (state != null && state.lastTimestamp() > 0) {
            this.twapState = state;
        }
    }

    public String primaryPoolRef() {
        return pools.get(0).ref();
    }

    private Optional<BigInteger> advanceTwap() {
        LiquidityPool pool = pools.get(0);
        try {
            PoolReserves reserves = pool.reserves();
            long elapsed = reserves.lastTimestamp() - twapState.lastTimestamp();
            if (elapsed <= 0 || elapsed < twapPeriodSeconds) {
                return Optional.empty();
            }
            BigInteger cumulative0 = pool.cumulativePrice0();
            BigInteger cumulative1 = pool.cumulativePrice1();
            boolean nativeIsToken0 = nativeToken.equalsIgnoreCase(pool.token0());
            BigInteger now = nativeIsToken0 ? cumulative0 : cumulative1;
            BigInteger last = nativeIsToken0 ? twapState.cumulativePrice0Last() : twapState.cumulativePrice1Last();
            BigInteger ratio = twapRatio(last, now, elapsed);
            twapState = new TwapState(cumulative0, cumulative1, reserves.lastTimestamp(), ratio);
            if (ratio.signum() == 0) {
                return Optional.empty();
            }
            return Optional.of(ratio);
        } catch (RuntimeException e) {
            log.debug("TWAP read failed on pool {}: {}", pool.ref(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Average of a UQ112x112 accumulator over {@code elapsed} seconds, scaled to 18 decimals and decimal-corrected.
     * Accumulators wrap modulo 2^256.
     */
    BigInteger twapRatio(BigInteger cumulativeLast, BigInteger cumulativeNow, long elapsed) {
        BigInteger diff = cumulativeNow.subtract(cumulativeLast);
        if (diff.signum() < 0) {
            diff = diff.add(UINT256_MODULUS);
        }
        BigInteger average = diff.divide(BigInteger.valueOf(elapsed));
        return FixedPoint.correctDecimals(FixedPoint.fromQ112(average), nativeDecimals, assetDecimals);
    }

    private RatioEstimate spot() {
        List<BigInteger> ratios = new ArrayList<>(MAX_POOLS);
        List<BigInteger> nativeReserves = new ArrayList<>(MAX_POOLS);
        for (LiquidityPool pool : pools) {
            try {
                PoolReserves reserves = pool.reserves();
                boolean nativeIsToken0 = nativeToken.equalsIgnoreCase(pool.token0());
                BigInteger nativeReserve = nativeIsToken0 ? reserves.reserve0() : reserves.reserve1();
                BigInteger assetReserve = nativeIsToken0 ? reserves.reserve1() : reserves.reserve0();
                if (nativeReserve.signum() <= 0 || assetReserve.signum() <= 0) {
                    log.debug("Pool {} has a zero reserve", pool.ref());
                    continue;
                }
                BigInteger ratio = FixedPoint.correctDecimals(
                        assetReserve.multiply(FixedPoint.ONE).divide(nativeReserve), nativeDecimals, assetDecimals);
                if (ratio.signum() == 0) {
                    continue;
                }
                ratios.add(ratio);
                nativeReserves.add(nativeReserve);
            } catch (RuntimeException e) {
                log.debug("Pool {} unreadable: {}", pool.ref(), e.getMessage());
            }
        }
        if (ratios.isEmpty()) {
            throw new RatioUnavailableException("No pool yields a spot ratio");
        }
        if (ratios.size() == 1) {
            return new RatioEstimate(ratios.get(0), RatioEstimate.Method.SPOT);
        }
        BigInteger weighted = BigInteger.ZERO;
        BigInteger totalReserve = BigInteger.ZERO;
        for (int i = 0; i < ratios.size(); i++) {
            weighted = weighted.add(ratios.get(i).multiply(nativeReserves.get(i)));
            totalReserve = totalReserve.add(nativeReserves.get(i));
        }
        return new RatioEstimate(weighted.divide(totalReserve), RatioEstimate.Method.BLENDED);
    }
}
