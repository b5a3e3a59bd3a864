package com.omnioracle.liquidity.evm;

import com.omnioracle.chain.RpcException;
import com.omnioracle.chain.evm.EvmCallExecutor;
import com.omnioracle.common.AbiWords;
import com.omnioracle.config.CaffeineConfig;
import com.omnioracle.liquidity.LiquidityPool;
import com.omnioracle.liquidity.PoolReserves;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.math.BigInteger;

/**
 * Constant-product pair read via eth_call. Token addresses are cached in poolMetaCache.
 */
public class EvmLiquidityPool implements LiquidityPool {

    /** keccak256("getReserves()")[0:4]. */
    static final String GET_RESERVES_SELECTOR = "0x0902f1ac";
    /** keccak256("token0()")[0:4]. */
    static final String TOKEN0_SELECTOR = "0x0dfe1681";
    /** keccak256("token1()")[0:4]. */
    static final String TOKEN1_SELECTOR = "0xd21220a7";
    /** keccak256("price0CumulativeLast()")[0:4]. */
    static final String PRICE0_CUMULATIVE_SELECTOR = "0x5909c0d5";
    /** keccak256("price1CumulativeLast()")[0:4]. */
    static final String PRICE1_CUMULATIVE_SELECTOR = "0x5a3d5493";

    private final String address;
    private final EvmCallExecutor executor;
    private final CacheManager cacheManager;

    public EvmLiquidityPool(String address, EvmCallExecutor executor, CacheManager cacheManager) {
        this.address = address;
        this.executor = executor;
        this.cacheManager = cacheManager;
    }

    @Override
    public String ref() {
        return address;
    }

    @Override
    public PoolReserves reserves() {
        String result = executor.call(address, GET_RESERVES_SELECTOR);
        if (AbiWords.wordCount(result) < 3) {
            throw new RpcException("getReserves() returned " + AbiWords.wordCount(result) + " words");
        }
        return new PoolReserves(AbiWords.uint(result, 0), AbiWords.uint(result, 1), AbiWords.uintAsLong(result, 2));
    }

    @Override
    public String token0() {
        return tokenAddress(TOKEN0_SELECTOR, "token0");
    }

    @Override
    public String token1() {
        return tokenAddress(TOKEN1_SELECTOR, "token1");
    }

    @Override
    public BigInteger cumulativePrice0() {
        return AbiWords.uint(executor.call(address, PRICE0_CUMULATIVE_SELECTOR), 0);
    }

    @Override
    public BigInteger cumulativePrice1() {
        return AbiWords.uint(executor.call(address, PRICE1_CUMULATIVE_SELECTOR), 0);
    }

    private String tokenAddress(String selector, String slot) {
        Cache cache = cacheManager.getCache(CaffeineConfig.POOL_META_CACHE);
        if (cache == null) {
            return fetchAddress(selector);
        }
        return cache.get(address.toLowerCase() + ":" + slot, () -> fetchAddress(selector));
    }

    private String fetchAddress(String selector) {
        return AbiWords.address(executor.call(address, selector), 0);
    }
}
