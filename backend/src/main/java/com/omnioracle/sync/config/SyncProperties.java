package com.omnioracle.sync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Peer synchronization configuration. Documented in application.yml under omnioracle.sync.
 */
@ConfigurationProperties(prefix = "omnioracle.sync")
@Getter
@Setter
public class SyncProperties {

    /**
     * Local read channel id; 0 leaves the channel unset and remote reads fail fast.
     */
    private long readChannelId = 0;

    /**
     * Pending remote reads are dropped after this horizon.
     */
    private long requestExpirySeconds = 600;

    /**
     * HTTP timeout for one remote read.
     */
    private long requestTimeoutMs = 10_000;

    private int confirmations = 1;

    /**
     * Native fee quoted per remote read, in wei.
     */
    private BigInteger readFeeWei = BigInteger.ZERO;

    /**
     * Valid peers that must agree with a received price before a consumer adopts it.
     */
    private int consumerQuorum = 1;

    private long agreementToleranceBps = 100;

    /**
     * Consumer peer poll schedule.
     */
    private long pollIntervalMs = 300_000;

    /**
     * Chain id -> peer deployment.
     */
    private Map<Long, Peer> peers = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Peer {
        /** Remote oracle address on the peer chain. */
        private String oracleRef;
        /** Base URL of the peer instance, e.g. http://oracle-arb:8080. */
        private String url;
        private long readChannelId;
        private boolean active = true;
    }
}
