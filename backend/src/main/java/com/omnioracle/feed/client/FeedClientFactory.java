package com.omnioracle.feed.client;

/**
 * Resolves an endpoint reference (contract address) to a typed feed client.
 */
public interface FeedClientFactory {

    PullQuoteFeed pullQuote(String endpointRef);

    PushAggregateFeed pushAggregate(String endpointRef);

    ProxyReadFeed proxyRead(String endpointRef);

    ConfidenceIntervalFeed confidenceInterval(String endpointRef);
}
