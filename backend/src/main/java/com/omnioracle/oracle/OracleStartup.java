package com.omnioracle.oracle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Restores persisted state, then takes the first TWAP snapshot if none was restored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OracleStartup {

    private final OracleStatePersistence persistence;
    private final OmniPriceOracle oracle;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        persistence.restore();
        oracle.initTwapIfNeeded();
        log.info("Oracle ready: {}", oracle.status().mode());
    }
}
