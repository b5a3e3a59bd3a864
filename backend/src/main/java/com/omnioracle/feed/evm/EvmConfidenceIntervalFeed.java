package com.omnioracle.feed.evm;

import com.omnioracle.chain.RpcException;
import com.omnioracle.chain.evm.EvmCallExecutor;
import com.omnioracle.common.AbiWords;
import com.omnioracle.feed.client.ConfidenceIntervalFeed;
import com.omnioracle.feed.client.ConfidencePrice;

/**
 * Pull-oracle contract exposing {@code getPriceUnsafe(bytes32) -> (int64 price, uint64 conf, int32 expo, uint publishTime)}.
 */
public class EvmConfidenceIntervalFeed implements ConfidenceIntervalFeed {

    /** keccak256("getPriceUnsafe(bytes32)")[0:4]. */
    static final String GET_PRICE_UNSAFE_SELECTOR = "0x96834ad3";

    private final String address;
    private final EvmCallExecutor executor;

    public EvmConfidenceIntervalFeed(String address, EvmCallExecutor executor) {
        this.address = address;
        this.executor = executor;
    }

    @Override
    public ConfidencePrice priceUnsafe(String priceId) {
        String result = executor.call(address, GET_PRICE_UNSAFE_SELECTOR + AbiWords.encodeBytes32(priceId));
        if (AbiWords.wordCount(result) < 4) {
            throw new RpcException("getPriceUnsafe returned " + AbiWords.wordCount(result) + " words");
        }
        return new ConfidencePrice(
                AbiWords.int256(result, 0),
                AbiWords.uint(result, 1),
                AbiWords.int256(result, 2).intValueExact(),
                AbiWords.uintAsLong(result, 3));
    }
}
