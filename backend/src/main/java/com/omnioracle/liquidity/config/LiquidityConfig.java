package com.omnioracle.liquidity.config;

import com.omnioracle.chain.evm.EvmCallExecutor;
import com.omnioracle.liquidity.LiquidityPool;
import com.omnioracle.liquidity.LiquidityRatioEstimator;
import com.omnioracle.liquidity.evm.EvmLiquidityPool;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Estimator bean exists only when a native token is configured. Without it the oracle publishes the native
 * price unchanged.
 */
@Configuration
@EnableConfigurationProperties(LiquidityProperties.class)
public class LiquidityConfig {

    @Bean
    @ConditionalOnProperty(prefix = "omnioracle.liquidity", name = "native-token")
    public LiquidityRatioEstimator liquidityRatioEstimator(LiquidityProperties properties,
                                                           EvmCallExecutor evmCallExecutor,
                                                           CacheManager cacheManager) {
        List<LiquidityPool> pools = properties.getPools().stream()
                .map(address -> (LiquidityPool) new EvmLiquidityPool(address, evmCallExecutor, cacheManager))
                .toList();
        return new LiquidityRatioEstimator(pools, properties.getNativeToken(), properties.getNativeDecimals(),
                properties.getAssetDecimals(), properties.getTwap().isEnabled(), properties.getTwap().getPeriodSeconds());
    }
}
