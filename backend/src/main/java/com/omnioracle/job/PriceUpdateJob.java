package com.omnioracle.job;

import com.omnioracle.config.OracleProperties;
import com.omnioracle.domain.OracleException;
import com.omnioracle.domain.OracleMode;
import com.omnioracle.oracle.OmniPriceOracle;
import com.omnioracle.state.OracleStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic producer update. Skipped outside producer mode and during emergency override.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PriceUpdateJob {

    private final OmniPriceOracle oracle;
    private final OracleStateMachine stateMachine;
    private final OracleProperties properties;

    @Scheduled(
            fixedDelayString = "${omnioracle.update.interval-ms:300000}",
            initialDelayString = "${omnioracle.update.initial-delay-ms:10000}")
    public void runScheduled() {
        if (!properties.getUpdate().isScheduled()) {
            return;
        }
        OracleStateMachine.State state = stateMachine.snapshot();
        if (state.mode() != OracleMode.PRODUCER || state.emergency()) {
            log.debug("Update skipped: mode={} emergency={}", state.mode(), state.emergency());
            return;
        }
        try {
            oracle.updatePrice();
        } catch (OracleException e) {
            log.warn("Scheduled update failed [{}]: {}", e.getCode(), e.getMessage());
        }
    }
}
