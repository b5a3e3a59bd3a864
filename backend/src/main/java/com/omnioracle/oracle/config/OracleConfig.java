package com.omnioracle.oracle.config;

import com.omnioracle.config.OracleProperties;
import com.omnioracle.liquidity.LiquidityRatioEstimator;
import com.omnioracle.oracle.OmniPriceOracle;
import com.omnioracle.pricing.DerivedPriceComposer;
import com.omnioracle.pricing.WeightedAggregator;
import com.omnioracle.state.DeviationCircuitBreaker;
import com.omnioracle.state.LocalPriceStore;
import com.omnioracle.state.OracleStateMachine;
import com.omnioracle.sync.PeerSynchronizationManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OracleConfig {

    @Bean
    public OmniPriceOracle omniPriceOracle(WeightedAggregator weightedAggregator,
                                           ObjectProvider<LiquidityRatioEstimator> liquidityRatioEstimator,
                                           DerivedPriceComposer derivedPriceComposer,
                                           PeerSynchronizationManager peerSynchronizationManager,
                                           OracleStateMachine oracleStateMachine,
                                           LocalPriceStore localPriceStore,
                                           DeviationCircuitBreaker deviationCircuitBreaker,
                                           ApplicationEventPublisher events,
                                           Clock clock,
                                           OracleProperties properties) {
        return new OmniPriceOracle(weightedAggregator, liquidityRatioEstimator.getIfAvailable(), derivedPriceComposer,
                peerSynchronizationManager, oracleStateMachine, localPriceStore, deviationCircuitBreaker, events, clock,
                properties.getFreshness());
    }
}
