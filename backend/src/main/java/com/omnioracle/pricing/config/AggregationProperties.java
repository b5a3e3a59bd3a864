package com.omnioracle.pricing.config;

import com.omnioracle.domain.FeedKind;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregation configuration. Documented in application.yml under omnioracle.aggregation.
 */
@ConfigurationProperties(prefix = "omnioracle.aggregation")
@Getter
@Setter
public class AggregationProperties {

    /**
     * Valid quotes required for a non-degraded result (1..4).
     */
    private int minValidSources = 2;

    /**
     * Maximum age of the fallback cache before aggregation fails outright.
     */
    private long fallbackMaxAgeSeconds = 86_400;

    /**
     * Staleness bound applied to sources that configure none.
     */
    private long defaultStalenessSeconds = 3_600;

    /**
     * Source id -> source definition, applied at startup.
     */
    private Map<String, Source> sources = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Source {
        private FeedKind kind;
        /** Feed contract address on the local chain. */
        private String endpointRef;
        private int weight;
        /** 0 = use default-staleness-seconds. */
        private long maxStalenessSeconds;
        private boolean active = true;
        /** Base symbol (push-aggregate) or 32-byte feed id (confidence-interval). */
        private String extra;
    }
}
