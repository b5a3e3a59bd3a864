package com.omnioracle.feed;

import com.omnioracle.domain.FeedKind;
import com.omnioracle.domain.FeedSource;
import com.omnioracle.domain.QuoteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatch table from {@link FeedKind} to its adapter.
 */
@Component
@Slf4j
public class FeedAdapterRegistry {

    private final Map<FeedKind, FeedAdapter> adapters = new EnumMap<>(FeedKind.class);

    public FeedAdapterRegistry(List<FeedAdapter> adapters) {
        for (FeedAdapter adapter : adapters) {
            FeedAdapter previous = this.adapters.put(adapter.kind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate adapter for " + adapter.kind());
            }
        }
    }

    public boolean supports(FeedKind kind) {
        return adapters.containsKey(kind);
    }

    /**
     * Quotes one source. A missing adapter or an unexpected adapter failure yields an unavailable result.
     */
    public QuoteResult quote(FeedSource source, long nowSeconds) {
        FeedAdapter adapter = adapters.get(source.kind());
        if (adapter == null) {
            log.warn("No adapter registered for kind {} (source {})", source.kind(), source.id());
            return QuoteResult.unavailable();
        }
        try {
            QuoteResult result = adapter.quote(source, nowSeconds);
            return result != null ? result : QuoteResult.unavailable();
        } catch (RuntimeException e) {
            log.warn("Adapter {} failed for source {}", source.kind(), source.id(), e);
            return QuoteResult.unavailable();
        }
    }
}
