package com.omnioracle.feed.evm;

import com.omnioracle.chain.RpcException;
import com.omnioracle.chain.evm.EvmCallExecutor;
import com.omnioracle.common.AbiWords;
import com.omnioracle.feed.client.PushAggregateFeed;
import com.omnioracle.feed.client.PushPrice;
import com.omnioracle.feed.client.ReferenceRate;

/**
 * Reference-data feed: structured {@code getPrice(string)} and legacy {@code getReferenceData(string,string)}.
 */
public class EvmPushAggregateFeed implements PushAggregateFeed {

    /** keccak256("getPrice(string)")[0:4]. */
    static final String GET_PRICE_SELECTOR = "0x524f3889";
    /** keccak256("getReferenceData(string,string)")[0:4]. */
    static final String GET_REFERENCE_DATA_SELECTOR = "0x65555bcc";

    private final String address;
    private final EvmCallExecutor executor;

    public EvmPushAggregateFeed(String address, EvmCallExecutor executor) {
        this.address = address;
        this.executor = executor;
    }

    @Override
    public PushPrice priceFor(String symbol) {
        String result = executor.call(address, AbiWords.encodeStringCall(GET_PRICE_SELECTOR, symbol));
        if (AbiWords.wordCount(result) != 2) {
            throw new RpcException("getPrice(string) format mismatch: " + AbiWords.wordCount(result) + " words");
        }
        return new PushPrice(AbiWords.uint(result, 0), AbiWords.uintAsLong(result, 1));
    }

    @Override
    public ReferenceRate referenceRate(String base, String quote) {
        String result = executor.call(address, AbiWords.encodeStringCall(GET_REFERENCE_DATA_SELECTOR, base, quote));
        if (AbiWords.wordCount(result) < 3) {
            throw new RpcException("getReferenceData format mismatch: " + AbiWords.wordCount(result) + " words");
        }
        return new ReferenceRate(AbiWords.uint(result, 0), AbiWords.uintAsLong(result, 1), AbiWords.uintAsLong(result, 2));
    }
}
