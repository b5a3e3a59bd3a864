package com.omnioracle.liquidity.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Liquidity ratio configuration. Documented in application.yml under omnioracle.liquidity.
 */
@ConfigurationProperties(prefix = "omnioracle.liquidity")
@Getter
@Setter
public class LiquidityProperties {

    /**
     * Wrapped native token address; identifies the native side of every pool.
     */
    private String nativeToken;

    private int nativeDecimals = 18;

    private int assetDecimals = 18;

    /**
     * Pool addresses; the first is the TWAP pool. At most two.
     */
    private List<String> pools = new ArrayList<>();

    private Twap twap = new Twap();

    @Getter
    @Setter
    public static class Twap {
        private boolean enabled = true;
        /** Minimum elapsed pool time before a new TWAP value is taken. */
        private long periodSeconds = 1_800;
    }
}
