package com.omnioracle.pricing;

import com.omnioracle.domain.AggregatedResult;
import com.omnioracle.domain.FallbackCache;
import com.omnioracle.domain.FeedKind;
import com.omnioracle.domain.FeedSource;
import com.omnioracle.domain.InsufficientSourcesException;
import com.omnioracle.domain.InvalidConfigurationException;
import com.omnioracle.domain.QuoteResult;
import com.omnioracle.feed.FeedAdapterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Weighted average over the active feed sources with a minimum-source bar and a degradation ladder:
 * full quorum, lone source, fallback cache, failure. Division truncates.
 * <p>
 * Configuration and the fallback cache are guarded by this instance's monitor; adapter calls run outside it.
 */
@Slf4j
public class WeightedAggregator {

    public static final int MIN_VALID_SOURCES_FLOOR = 1;
    public static final int MIN_VALID_SOURCES_CEILING = 4;
    public static final int DEFAULT_MIN_VALID_SOURCES = 2;
    public static final long DEFAULT_STALENESS_SECONDS = 3600L;
    public static final long DEFAULT_FALLBACK_MAX_AGE_SECONDS = 24 * 3600L;

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final FeedAdapterRegistry adapters;
    private final long fallbackMaxAgeSeconds;
    private final long defaultStalenessSeconds;
    private final Map<String, FeedSource> sources = new LinkedHashMap<>();
    private int minValidSources = DEFAULT_MIN_VALID_SOURCES;
    private FallbackCache fallback;

    public WeightedAggregator(FeedAdapterRegistry adapters, long fallbackMaxAgeSeconds, long defaultStalenessSeconds) {
        this.adapters = adapters;
        this.fallbackMaxAgeSeconds = fallbackMaxAgeSeconds;
        this.defaultStalenessSeconds = defaultStalenessSeconds;
    }

    public WeightedAggregator(FeedAdapterRegistry adapters) {
        this(adapters, DEFAULT_FALLBACK_MAX_AGE_SECONDS, DEFAULT_STALENESS_SECONDS);
    }

    /**
     * Adds or replaces a source. A non-positive staleness bound is replaced by the default.
     *
     * @throws InvalidConfigurationException on blank id, missing kind, zero reference, weight outside 0..255
     *                                       or a missing symbol/feed id for kinds that need one
     */
    public synchronized FeedSource configureSource(FeedSource source) {
        validate(source);
        FeedSource stored = source.maxStalenessSeconds() > 0 ? source
                : new FeedSource(source.id(), source.kind(), source.endpointRef(), source.weight(),
                        defaultStalenessSeconds, source.active(), source.extra());
        sources.put(stored.id(), stored);
        log.info("Configured source {} kind={} weight={} active={}", stored.id(), stored.kind(), stored.weight(), stored.active());
        return stored;
    }

    public synchronized FeedSource setWeight(String id, int weight) {
        checkWeight(weight);
        FeedSource updated = require(id).withWeight(weight);
        sources.put(id, updated);
        return updated;
    }

    public synchronized FeedSource setActive(String id, boolean active) {
        FeedSource updated = require(id).withActive(active);
        sources.put(id, updated);
        return updated;
    }

    public synchronized Optional<FeedSource> getSource(String id) {
        return Optional.ofNullable(sources.get(id));
    }

    public synchronized List<FeedSource> listSources() {
        return List.copyOf(sources.values());
    }

    public synchronized int activeSourceCount() {
        return (int) sources.values().stream().filter(FeedSource::active).count();
    }

    public synchronized void setMinValidSources(int n) {
        if (n < MIN_VALID_SOURCES_FLOOR || n > MIN_VALID_SOURCES_CEILING) {
            throw new InvalidConfigurationException("minValidSources must be in "
                    + MIN_VALID_SOURCES_FLOOR + ".." + MIN_VALID_SOURCES_CEILING + ": " + n);
        }
        this.minValidSources = n;
    }

    public synchronized int getMinValidSources() {
        return minValidSources;
    }

    public synchronized Optional<FallbackCache> fallbackCache() {
        return Optional.ofNullable(fallback);
    }

    /** Restores a persisted fallback cache; ignored when empty. */
    public synchronized void restoreFallback(FallbackCache cache) {
        if (cache != null && cache.price18() != null && cache.timestamp() > 0) {
            this.fallback = cache;
        }
    }

    /**
     * Runs one aggregation pass.
     *
     * @throws InsufficientSourcesException when the ladder is exhausted
     */
    public AggregatedResult aggregate(long nowSeconds) {
        List<FeedSource> active;
        int required;
        synchronized (this) {
            active = new ArrayList<>();
            for (FeedSource s : sources.values()) {
                if (s.active() && s.weight() > 0) {
                    active.add(s);
                }
            }
            required = minValidSources;
        }

        BigInteger weightedSum = BigInteger.ZERO;
        BigInteger totalWeight = BigInteger.ZERO;
        BigInteger lonePrice = null;
        int validCount = 0;
        for (FeedSource source : active) {
            QuoteResult result = adapters.quote(source, nowSeconds);
            if (!result.isValid()) {
                log.debug("Source {} skipped: {}", source.id(), result.error().orElse(null));
                continue;
            }
            BigInteger price = result.quote().price18();
            BigInteger weight = BigInteger.valueOf(source.weight());
            weightedSum = weightedSum.add(price.multiply(weight));
            totalWeight = totalWeight.add(weight);
            lonePrice = price;
            validCount++;
        }

        synchronized (this) {
            if (validCount >= required) {
                BigInteger price = weightedSum.divide(totalWeight);
                fallback = new FallbackCache(price, nowSeconds);
                return new AggregatedResult(price, nowSeconds, false);
            }
            if (validCount == 1 && required > 1) {
                log.warn("Degraded aggregation: single valid source, {} required", required);
                return new AggregatedResult(lonePrice, nowSeconds, true);
            }
            if (fallback != null && fallback.isUsable(nowSeconds, fallbackMaxAgeSeconds)) {
                log.warn("Degraded aggregation: {} valid sources, using fallback from {}", validCount, fallback.timestamp());
                return new AggregatedResult(fallback.price18(), fallback.timestamp(), true);
            }
        }
        throw new InsufficientSourcesException(validCount, required);
    }

    private FeedSource require(String id) {
        FeedSource source = sources.get(id);
        if (source == null) {
            throw new InvalidConfigurationException("Unknown source: " + id);
        }
        return source;
    }

    private static void validate(FeedSource source) {
        if (source == null || source.id() == null || source.id().isBlank()) {
            throw new InvalidConfigurationException("Source id is required");
        }
        if (source.kind() == null) {
            throw new InvalidConfigurationException("Source kind is required: " + source.id());
        }
        if (source.endpointRef() == null || source.endpointRef().isBlank()
                || ZERO_ADDRESS.equalsIgnoreCase(source.endpointRef().strip())) {
            throw new InvalidConfigurationException("Source endpoint reference is required: " + source.id());
        }
        checkWeight(source.weight());
        boolean needsExtra = source.kind() == FeedKind.PUSH_AGGREGATE || source.kind() == FeedKind.CONFIDENCE_INTERVAL;
        if (needsExtra && (source.extra() == null || source.extra().isBlank())) {
            throw new InvalidConfigurationException("Source " + source.id() + " of kind " + source.kind()
                    + " needs a symbol or feed id");
        }
    }

    private static void checkWeight(int weight) {
        if (weight < 0 || weight > FeedSource.MAX_WEIGHT) {
            throw new InvalidConfigurationException("Weight must be in 0.." + FeedSource.MAX_WEIGHT + ": " + weight);
        }
    }
}
