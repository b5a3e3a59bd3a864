package com.omnioracle.feed;

import com.omnioracle.domain.FeedKind;
import com.omnioracle.domain.FeedSource;
import com.omnioracle.domain.QuoteResult;
import com.omnioracle.feed.client.FeedClientFactory;
import com.omnioracle.feed.client.ProxyValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ProxyReadAdapter implements FeedAdapter {

    private final FeedClientFactory clients;

    @Override
    public FeedKind kind() {
        return FeedKind.PROXY_READ;
    }

    @Override
    public QuoteResult quote(FeedSource source, long nowSeconds) {
        ProxyValue value;
        try {
            value = clients.proxyRead(source.endpointRef()).read();
        } catch (RuntimeException e) {
            log.debug("Proxy-read source {} unavailable: {}", source.id(), e.getMessage());
            return QuoteResult.unavailable();
        }
        if (value == null || value.value18() == null || value.value18().signum() <= 0 || value.timestamp() == 0) {
            return QuoteResult.unavailable();
        }
        if (nowSeconds - value.timestamp() > source.maxStalenessSeconds()) {
            log.debug("Proxy-read source {} stale: timestamp={}", source.id(), value.timestamp());
            return QuoteResult.stale();
        }
        return QuoteResult.ok(value.value18());
    }
}
