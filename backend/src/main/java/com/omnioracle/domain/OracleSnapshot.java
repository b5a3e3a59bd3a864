package com.omnioracle.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable state of one oracle instance, restored at startup. Fixed-point values are stored as decimal strings
 * so that int256 magnitudes survive without Decimal128 precision loss.
 */
@Document(collection = "oracle_snapshots")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class OracleSnapshot {

    /** Instance id (omnioracle.instance-id). */
    @Id
    @EqualsAndHashCode.Include
    private String id;
    private OracleMode mode;
    private boolean emergencyMode;
    private String emergencyPrice;
    private String latestPrice;
    private long latestTimestamp;
    private String latestNativePrice;
    private String fallbackPrice;
    private long fallbackTimestamp;
    private int minValidSources;
    private boolean circuitBreakerTripped;
    private long graceStartedAt;
    /** Null in snapshots written before breaker settings were persisted; configured values apply then. */
    private Long maxDeviationBps;
    private Long gracePeriodSeconds;
    private List<TwapEntry> twapStates = new ArrayList<>();
    private Instant updatedAt;

    public void setTwapStates(List<TwapEntry> twapStates) {
        this.twapStates = twapStates != null ? twapStates : new ArrayList<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class TwapEntry {
        private String poolRef;
        private String cumulativePrice0Last;
        private String cumulativePrice1Last;
        private long lastTimestamp;
        private String ratio18;
    }
}
