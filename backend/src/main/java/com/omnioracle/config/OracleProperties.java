package com.omnioracle.config;

import com.omnioracle.domain.OracleMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Instance identity, role and freshness windows. Documented in application.yml under omnioracle.
 */
@ConfigurationProperties(prefix = "omnioracle")
@Getter
@Setter
public class OracleProperties {

    /**
     * Key of this instance's snapshot document.
     */
    private String instanceId = "default";

    /**
     * Chain id of the chain this instance serves.
     */
    private long chainId;

    /**
     * Mode applied on first start; a persisted snapshot takes precedence.
     */
    private OracleMode initialMode = OracleMode.UNINITIALIZED;

    private Freshness freshness = new Freshness();

    private Breaker breaker = new Breaker();

    private Update update = new Update();

    @Getter
    @Setter
    public static class Freshness {
        /** Local price is valid for validate()/isFresh() within this window. */
        private long localSeconds = 3_600;
        /** Peer prices are valid within this window. */
        private long peerSeconds = 3_600;
        /** latestPrice() returns no data past this age. */
        private long latestPriceMaxAgeSeconds = 86_400;
    }

    @Getter
    @Setter
    public static class Breaker {
        /** 0 disables the deviation gate. */
        private long maxDeviationBps = 0;
        private long gracePeriodSeconds = 3_600;
    }

    @Getter
    @Setter
    public static class Update {
        /** Producer pipeline schedule. */
        private long intervalMs = 300_000;
        private boolean scheduled = true;
    }
}
