package com.omnioracle.oracle;

import com.omnioracle.config.AsyncConfig;
import com.omnioracle.config.OracleProperties;
import com.omnioracle.domain.CircuitBreakerTrippedEvent;
import com.omnioracle.domain.CrossChainPriceReceivedEvent;
import com.omnioracle.domain.EmergencyModeChangedEvent;
import com.omnioracle.domain.OracleModeChangedEvent;
import com.omnioracle.domain.OracleSnapshot;
import com.omnioracle.domain.OracleSnapshotRepository;
import com.omnioracle.domain.OracleStateChangedEvent;
import com.omnioracle.domain.PriceUpdateRecord;
import com.omnioracle.domain.PriceUpdateRecordRepository;
import com.omnioracle.domain.PriceUpdatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Writes the instance snapshot and the price audit trail off the pricing path. Failures are logged only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OracleStatePersistence {

    private final OmniPriceOracle oracle;
    private final OracleSnapshotRepository snapshotRepository;
    private final PriceUpdateRecordRepository priceUpdateRepository;
    private final OracleProperties properties;
    private final Clock clock;

    /**
     * Applies the stored snapshot, if any.
     *
     * @return true if a snapshot was applied
     */
    public boolean restore() {
        try {
            Optional<OracleSnapshot> snapshot = snapshotRepository.findById(properties.getInstanceId());
            if (snapshot.isEmpty()) {
                log.info("No snapshot for instance {}, starting fresh", properties.getInstanceId());
                return false;
            }
            oracle.restoreSnapshot(snapshot.get());
            log.info("Restored snapshot for instance {} (mode={}, latestTimestamp={})", properties.getInstanceId(),
                    snapshot.get().getMode(), snapshot.get().getLatestTimestamp());
            return true;
        } catch (RuntimeException e) {
            log.warn("Snapshot restore failed for instance {}: {}", properties.getInstanceId(), e.getMessage());
            return false;
        }
    }

    public List<PriceUpdateRecord> recentUpdates() {
        return priceUpdateRepository.findTop20ByInstanceIdOrderByPriceTimestampDesc(properties.getInstanceId());
    }

    @Async(AsyncConfig.PERSISTENCE_EXECUTOR)
    @EventListener
    public void onPriceUpdated(PriceUpdatedEvent event) {
        PriceUpdateRecord record = newRecord(PriceUpdateRecord.Origin.LOCAL, null, event.price().toString(), event.timestamp());
        record.setNativePrice(event.nativePrice().toString());
        record.setDegraded(event.degraded());
        saveRecord(record);
        saveSnapshot();
    }

    @Async(AsyncConfig.PERSISTENCE_EXECUTOR)
    @EventListener
    public void onCrossChainPrice(CrossChainPriceReceivedEvent event) {
        if (!event.adopted()) {
            return;
        }
        PriceUpdateRecord record = newRecord(PriceUpdateRecord.Origin.PEER, event.chainId(), event.price().toString(), event.timestamp());
        if (event.nativePrice().signum() > 0) {
            record.setNativePrice(event.nativePrice().toString());
        }
        saveRecord(record);
        saveSnapshot();
    }

    @Async(AsyncConfig.PERSISTENCE_EXECUTOR)
    @EventListener({OracleModeChangedEvent.class, EmergencyModeChangedEvent.class,
            CircuitBreakerTrippedEvent.class, OracleStateChangedEvent.class})
    public void onStateChanged() {
        saveSnapshot();
    }

    void saveSnapshot() {
        try {
            snapshotRepository.save(oracle.exportSnapshot(properties.getInstanceId()));
        } catch (RuntimeException e) {
            log.warn("Snapshot save failed for instance {}: {}", properties.getInstanceId(), e.getMessage());
        }
    }

    private void saveRecord(PriceUpdateRecord record) {
        try {
            priceUpdateRepository.save(record);
        } catch (RuntimeException e) {
            log.warn("Price audit write failed: {}", e.getMessage());
        }
    }

    private PriceUpdateRecord newRecord(PriceUpdateRecord.Origin origin, Long chainId, String price, long timestamp) {
        PriceUpdateRecord record = new PriceUpdateRecord();
        record.setInstanceId(properties.getInstanceId());
        record.setOrigin(origin);
        record.setSourceChainId(chainId);
        record.setPrice(price);
        record.setPriceTimestamp(timestamp);
        record.setRecordedAt(Instant.now(clock));
        return record;
    }
}
