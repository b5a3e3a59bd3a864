package com.omnioracle.feed.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.omnioracle.chain.evm.EvmCallExecutor;
import com.omnioracle.feed.client.FeedClientFactory;
import com.omnioracle.feed.evm.EvmFeedClientFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FeedConfig {

    @Bean
    public FeedClientFactory feedClientFactory(EvmCallExecutor evmCallExecutor,
                                               @Qualifier("feedDecimalsCache") Cache<String, Integer> feedDecimalsCache) {
        return new EvmFeedClientFactory(evmCallExecutor, feedDecimalsCache);
    }
}
