package com.omnioracle.feed.evm;

import com.github.benmanes.caffeine.cache.Cache;
import com.omnioracle.chain.evm.EvmCallExecutor;
import com.omnioracle.feed.client.ConfidenceIntervalFeed;
import com.omnioracle.feed.client.FeedClientFactory;
import com.omnioracle.feed.client.ProxyReadFeed;
import com.omnioracle.feed.client.PullQuoteFeed;
import com.omnioracle.feed.client.PushAggregateFeed;

/**
 * Feed clients backed by eth_call on the local chain. Clients are cheap and created per lookup.
 */
public class EvmFeedClientFactory implements FeedClientFactory {

    private final EvmCallExecutor executor;
    private final Cache<String, Integer> decimalsCache;

    public EvmFeedClientFactory(EvmCallExecutor executor, Cache<String, Integer> decimalsCache) {
        this.executor = executor;
        this.decimalsCache = decimalsCache;
    }

    @Override
    public PullQuoteFeed pullQuote(String endpointRef) {
        return new EvmPullQuoteFeed(endpointRef, executor, decimalsCache);
    }

    @Override
    public PushAggregateFeed pushAggregate(String endpointRef) {
        return new EvmPushAggregateFeed(endpointRef, executor);
    }

    @Override
    public ProxyReadFeed proxyRead(String endpointRef) {
        return new EvmProxyReadFeed(endpointRef, executor);
    }

    @Override
    public ConfidenceIntervalFeed confidenceInterval(String endpointRef) {
        return new EvmConfidenceIntervalFeed(endpointRef, executor);
    }
}
