package com.omnioracle.pricing.config;

import com.omnioracle.domain.FeedSource;
import com.omnioracle.feed.FeedAdapterRegistry;
import com.omnioracle.pricing.DerivedPriceComposer;
import com.omnioracle.pricing.WeightedAggregator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Aggregator seeded from omnioracle.aggregation.sources. Invalid entries fail startup.
 */
@Configuration
@EnableConfigurationProperties(AggregationProperties.class)
public class PricingConfig {

    @Bean
    public WeightedAggregator weightedAggregator(FeedAdapterRegistry feedAdapterRegistry, AggregationProperties properties) {
        WeightedAggregator aggregator = new WeightedAggregator(feedAdapterRegistry,
                properties.getFallbackMaxAgeSeconds(), properties.getDefaultStalenessSeconds());
        aggregator.setMinValidSources(properties.getMinValidSources());
        for (Map.Entry<String, AggregationProperties.Source> entry : properties.getSources().entrySet()) {
            AggregationProperties.Source s = entry.getValue();
            aggregator.configureSource(new FeedSource(entry.getKey(), s.getKind(), s.getEndpointRef(), s.getWeight(),
                    s.getMaxStalenessSeconds(), s.isActive(), s.getExtra()));
        }
        return aggregator;
    }

    @Bean
    public DerivedPriceComposer derivedPriceComposer() {
        return new DerivedPriceComposer();
    }
}
