package com.omnioracle.feed.evm;

import com.omnioracle.chain.RpcException;
import com.omnioracle.chain.evm.EvmCallExecutor;
import com.omnioracle.common.AbiWords;
import com.omnioracle.feed.client.ProxyReadFeed;
import com.omnioracle.feed.client.ProxyValue;

/**
 * Data-feed proxy exposing {@code read() -> (int224 value, uint32 timestamp)}.
 */
public class EvmProxyReadFeed implements ProxyReadFeed {

    /** keccak256("read()")[0:4]. */
    static final String READ_SELECTOR = "0x57de26a4";

    private final String address;
    private final EvmCallExecutor executor;

    public EvmProxyReadFeed(String address, EvmCallExecutor executor) {
        this.address = address;
        this.executor = executor;
    }

    @Override
    public ProxyValue read() {
        String result = executor.call(address, READ_SELECTOR);
        if (AbiWords.wordCount(result) < 2) {
            throw new RpcException("read() returned " + AbiWords.wordCount(result) + " words");
        }
        return new ProxyValue(AbiWords.int256(result, 0), AbiWords.uintAsLong(result, 1));
    }
}
