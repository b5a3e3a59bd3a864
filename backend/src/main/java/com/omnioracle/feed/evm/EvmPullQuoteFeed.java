package com.omnioracle.feed.evm;

import com.github.benmanes.caffeine.cache.Cache;
import com.omnioracle.chain.RpcException;
import com.omnioracle.chain.evm.EvmCallExecutor;
import com.omnioracle.common.AbiWords;
import com.omnioracle.feed.client.PullQuoteFeed;
import com.omnioracle.feed.client.RoundData;

/**
 * Aggregator-style feed: {@code latestRoundData()} and {@code decimals()}. Decimals are cached per feed.
 */
public class EvmPullQuoteFeed implements PullQuoteFeed {

    /** keccak256("latestRoundData()")[0:4]. */
    static final String LATEST_ROUND_DATA_SELECTOR = "0xfeaf968c";
    /** keccak256("decimals()")[0:4]. */
    static final String DECIMALS_SELECTOR = "0x313ce567";

    private final String address;
    private final EvmCallExecutor executor;
    private final Cache<String, Integer> decimalsCache;

    public EvmPullQuoteFeed(String address, EvmCallExecutor executor, Cache<String, Integer> decimalsCache) {
        this.address = address;
        this.executor = executor;
        this.decimalsCache = decimalsCache;
    }

    @Override
    public RoundData latestValue() {
        String result = executor.call(address, LATEST_ROUND_DATA_SELECTOR);
        if (AbiWords.wordCount(result) < 5) {
            throw new RpcException("latestRoundData() returned " + AbiWords.wordCount(result) + " words");
        }
        // (roundId, answer, startedAt, updatedAt, answeredInRound)
        return new RoundData(AbiWords.int256(result, 1), AbiWords.uintAsLong(result, 3));
    }

    @Override
    public int decimalCount() {
        return decimalsCache.get(address.toLowerCase(), key -> {
            String result = executor.call(address, DECIMALS_SELECTOR);
            return AbiWords.uint(result, 0).intValueExact() & 0xFF;
        });
    }
}
