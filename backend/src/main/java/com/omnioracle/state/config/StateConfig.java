package com.omnioracle.state.config;

import com.omnioracle.config.OracleProperties;
import com.omnioracle.state.DeviationCircuitBreaker;
import com.omnioracle.state.LocalPriceStore;
import com.omnioracle.state.OracleStateMachine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared per-instance state: mode, local price and deviation gate.
 */
@Configuration
@EnableConfigurationProperties(OracleProperties.class)
public class StateConfig {

    @Bean
    public OracleStateMachine oracleStateMachine(OracleProperties properties, ApplicationEventPublisher events) {
        return new OracleStateMachine(properties.getInitialMode(), events);
    }

    @Bean
    public LocalPriceStore localPriceStore() {
        return new LocalPriceStore();
    }

    @Bean
    public DeviationCircuitBreaker deviationCircuitBreaker(OracleProperties properties, ApplicationEventPublisher events) {
        OracleProperties.Breaker breaker = properties.getBreaker();
        return new DeviationCircuitBreaker(breaker.getMaxDeviationBps(), breaker.getGracePeriodSeconds(), events);
    }
}
