package com.omnioracle.oracle;

import com.omnioracle.config.OracleProperties;
import com.omnioracle.domain.AggregatedResult;
import com.omnioracle.domain.FallbackCache;
import com.omnioracle.domain.LatestPrice;
import com.omnioracle.domain.OracleMode;
import com.omnioracle.domain.OracleSnapshot;
import com.omnioracle.domain.OracleStateChangedEvent;
import com.omnioracle.domain.OracleStatus;
import com.omnioracle.domain.PriceUpdatedEvent;
import com.omnioracle.domain.RemoteReadException;
import com.omnioracle.domain.TwapState;
import com.omnioracle.domain.ValidationResult;
import com.omnioracle.liquidity.LiquidityRatioEstimator;
import com.omnioracle.liquidity.RatioEstimate;
import com.omnioracle.pricing.DerivedPriceComposer;
import com.omnioracle.pricing.WeightedAggregator;
import com.omnioracle.state.DeviationCircuitBreaker;
import com.omnioracle.state.LocalPrice;
import com.omnioracle.state.LocalPriceStore;
import com.omnioracle.state.OracleStateMachine;
import com.omnioracle.sync.PeerSynchronizationManager;
import com.omnioracle.sync.RemoteReadCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Facade over one oracle instance: the producer update pipeline (aggregate, derive, gate, store) and the
 * caller-facing queries. Updates are serialized by a lock; queries read immutable snapshots and never block.
 */
@Slf4j
public class OmniPriceOracle {

    private final WeightedAggregator aggregator;
    private final LiquidityRatioEstimator estimator;
    private final DerivedPriceComposer composer;
    private final PeerSynchronizationManager sync;
    private final OracleStateMachine stateMachine;
    private final LocalPriceStore localPrice;
    private final DeviationCircuitBreaker breaker;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final OracleProperties.Freshness freshness;
    private final ReentrantLock updateLock = new ReentrantLock();

    /**
     * @param estimator may be null; the aggregated price is then published as is
     */
    public OmniPriceOracle(WeightedAggregator aggregator, LiquidityRatioEstimator estimator, DerivedPriceComposer composer,
                           PeerSynchronizationManager sync, OracleStateMachine stateMachine, LocalPriceStore localPrice,
                           DeviationCircuitBreaker breaker, ApplicationEventPublisher events, Clock clock,
                           OracleProperties.Freshness freshness) {
        this.aggregator = aggregator;
        this.estimator = estimator;
        this.composer = composer;
        this.sync = sync;
        this.stateMachine = stateMachine;
        this.localPrice = localPrice;
        this.breaker = breaker;
        this.events = events;
        this.clock = clock;
        this.freshness = freshness;
    }

    /**
     * Runs the producer pipeline once. Blocking: performs RPC reads.
     *
     * @throws com.omnioracle.domain.OracleStateException        outside producer mode or during emergency
     * @throws com.omnioracle.domain.InsufficientSourcesException when aggregation fails
     * @throws com.omnioracle.domain.RatioUnavailableException   when no pool yields a ratio
     * @throws com.omnioracle.domain.CircuitBreakerOpenException when the deviation gate rejects the price
     */
    public PriceUpdateResult updatePrice() {
        updateLock.lock();
        try {
            stateMachine.requireLocalAggregation();
            long now = nowSeconds();
            AggregatedResult nativeResult = aggregator.aggregate(now);
            BigInteger price = nativeResult.price18();
            RatioEstimate.Method method = null;
            if (estimator != null) {
                RatioEstimate ratio = estimator.estimate();
                price = composer.compose(nativeResult.price18(), ratio.ratio18());
                method = ratio.method();
            }
            LocalPrice previous = localPrice.current();
            breaker.check(price, previous.isInitialized() ? previous.price() : null, now);
            // fallback results keep the fallback's own timestamp
            long priceTimestamp = nativeResult.timestamp();
            localPrice.set(price, nativeResult.price18(), priceTimestamp);
            breaker.onAccepted(now);
            log.info("Price updated: {} at {} (native {}, degraded={}, ratio={})", price, priceTimestamp,
                    nativeResult.price18(), nativeResult.degraded(), method);
            events.publishEvent(new PriceUpdatedEvent(price, nativeResult.price18(), priceTimestamp, nativeResult.degraded()));
            return new PriceUpdateResult(price, nativeResult.price18(), priceTimestamp, nativeResult.degraded(), method);
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * Latest price, or {@link LatestPrice#NONE} when uninitialized, non-positive or older than the max age.
     * During emergency mode the operator price is returned stamped with the current time.
     */
    public LatestPrice latestPrice() {
        long now = nowSeconds();
        OracleStateMachine.State state = stateMachine.snapshot();
        if (state.emergency()) {
            return new LatestPrice(state.emergencyPrice(), now);
        }
        LocalPrice current = localPrice.current();
        return usable(current.price(), current.timestamp(), now);
    }

    public LatestPrice latestNativePrice() {
        LocalPrice current = localPrice.current();
        return usable(current.nativePrice(), current.timestamp(), nowSeconds());
    }

    /** True when the local price was updated within the local freshness window. */
    public boolean isFresh() {
        LocalPrice current = localPrice.current();
        return current.isInitialized() && nowSeconds() - current.timestamp() <= freshness.getLocalSeconds();
    }

    public ValidationResult validate() {
        return new ValidationResult(isFresh(), sync.crossChainValid());
    }

    public OracleStatus status() {
        long now = nowSeconds();
        OracleStateMachine.State state = stateMachine.snapshot();
        LocalPrice current = localPrice.current();
        return new OracleStatus(
                state.mode(),
                state.emergency(),
                breaker.isTripped(),
                breaker.inGracePeriod(now),
                aggregator.activeSourceCount(),
                aggregator.getMinValidSources(),
                breaker.getMaxDeviationBps(),
                current.isInitialized(),
                current.price(),
                current.timestamp(),
                sync.activePeerIds(),
                sync.pendingCount());
    }

    public void setMode(OracleMode mode) {
        stateMachine.setMode(mode);
    }

    public void activateEmergencyMode(BigInteger price) {
        stateMachine.activateEmergency(price);
    }

    public void deactivateEmergencyMode() {
        stateMachine.deactivateEmergency();
    }

    public void setMinValidSources(int n) {
        aggregator.setMinValidSources(n);
        events.publishEvent(new OracleStateChangedEvent("min-valid-sources"));
    }

    public void configureCircuitBreaker(long maxDeviationBps, long gracePeriodSeconds) {
        breaker.configure(maxDeviationBps, gracePeriodSeconds);
        log.info("Circuit breaker configured: max={}bps grace={}s", maxDeviationBps, gracePeriodSeconds);
        events.publishEvent(new OracleStateChangedEvent("breaker-config"));
    }

    public void resetCircuitBreaker() {
        breaker.reset();
        events.publishEvent(new OracleStateChangedEvent("breaker-reset"));
    }

    /**
     * Answers an inbound remote read with the ABI-encoded {@link #latestPrice()} and {@link #latestNativePrice()}.
     *
     * @throws RemoteReadException for any selector other than getLatestPrice()
     */
    public String serveRead(String callSelector) {
        if (!RemoteReadCodec.isLatestPriceSelector(callSelector)) {
            throw new RemoteReadException(RemoteReadException.UNSUPPORTED_SELECTOR, "Unsupported selector: " + callSelector);
        }
        return RemoteReadCodec.encodeLatestPrice(latestPrice(), latestNativePrice().price());
    }

    /** Takes the first TWAP snapshot unless one was restored. */
    public void initTwapIfNeeded() {
        if (estimator != null && estimator.twapState().isEmpty()) {
            estimator.init();
        }
    }

    public OracleSnapshot exportSnapshot(String instanceId) {
        OracleStateMachine.State state = stateMachine.snapshot();
        LocalPrice current = localPrice.current();
        OracleSnapshot snapshot = new OracleSnapshot();
        snapshot.setId(instanceId);
        snapshot.setMode(state.mode());
        snapshot.setEmergencyMode(state.emergency());
        snapshot.setEmergencyPrice(toText(state.emergencyPrice()));
        snapshot.setLatestPrice(toText(current.price()));
        snapshot.setLatestTimestamp(current.timestamp());
        snapshot.setLatestNativePrice(toText(current.nativePrice()));
        aggregator.fallbackCache().ifPresent(cache -> {
            snapshot.setFallbackPrice(toText(cache.price18()));
            snapshot.setFallbackTimestamp(cache.timestamp());
        });
        snapshot.setMinValidSources(aggregator.getMinValidSources());
        snapshot.setCircuitBreakerTripped(breaker.isTripped());
        snapshot.setMaxDeviationBps(breaker.getMaxDeviationBps());
        snapshot.setGracePeriodSeconds(breaker.getGracePeriodSeconds());
        snapshot.setGraceStartedAt(breaker.getGraceStartedAt());
        List<OracleSnapshot.TwapEntry> twaps = new ArrayList<>();
        if (estimator != null) {
            estimator.twapState().ifPresent(twap -> twaps.add(toEntry(estimator.primaryPoolRef(), twap)));
        }
        snapshot.setTwapStates(twaps);
        snapshot.setUpdatedAt(Instant.now(clock));
        return snapshot;
    }

    public void restoreSnapshot(OracleSnapshot snapshot) {
        updateLock.lock();
        try {
            stateMachine.restore(snapshot.getMode(), snapshot.isEmergencyMode(), fromText(snapshot.getEmergencyPrice()));
            localPrice.restore(new LocalPrice(orZero(snapshot.getLatestPrice()), orZero(snapshot.getLatestNativePrice()),
                    snapshot.getLatestTimestamp()));
            if (snapshot.getFallbackPrice() != null) {
                aggregator.restoreFallback(new FallbackCache(fromText(snapshot.getFallbackPrice()), snapshot.getFallbackTimestamp()));
            }
            if (snapshot.getMinValidSources() >= WeightedAggregator.MIN_VALID_SOURCES_FLOOR
                    && snapshot.getMinValidSources() <= WeightedAggregator.MIN_VALID_SOURCES_CEILING) {
                aggregator.setMinValidSources(snapshot.getMinValidSources());
            }
            if (snapshot.getMaxDeviationBps() != null && snapshot.getGracePeriodSeconds() != null) {
                breaker.configure(snapshot.getMaxDeviationBps(), snapshot.getGracePeriodSeconds());
            }
            breaker.restore(snapshot.isCircuitBreakerTripped(), snapshot.getGraceStartedAt());
            if (estimator != null) {
                snapshot.getTwapStates().stream()
                        .filter(e -> estimator.primaryPoolRef().equalsIgnoreCase(e.getPoolRef()))
                        .filter(e -> e.getCumulativePrice0Last() != null && e.getCumulativePrice1Last() != null)
                        .findFirst()
                        .ifPresent(e -> estimator.restore(new TwapState(fromText(e.getCumulativePrice0Last()),
                                fromText(e.getCumulativePrice1Last()), e.getLastTimestamp(), orZero(e.getRatio18()))));
            }
        } finally {
            updateLock.unlock();
        }
    }

    private LatestPrice usable(BigInteger price, long timestamp, long now) {
        if (timestamp == 0 || price == null || price.signum() <= 0 || now - timestamp > freshness.getLatestPriceMaxAgeSeconds()) {
            return LatestPrice.NONE;
        }
        return new LatestPrice(price, timestamp);
    }

    private static OracleSnapshot.TwapEntry toEntry(String poolRef, TwapState twap) {
        OracleSnapshot.TwapEntry entry = new OracleSnapshot.TwapEntry();
        entry.setPoolRef(poolRef);
        entry.setCumulativePrice0Last(toText(twap.cumulativePrice0Last()));
        entry.setCumulativePrice1Last(toText(twap.cumulativePrice1Last()));
        entry.setLastTimestamp(twap.lastTimestamp());
        entry.setRatio18(toText(twap.ratio18()));
        return entry;
    }

    private static String toText(BigInteger value) {
        return value != null ? value.toString() : null;
    }

    private static BigInteger fromText(String value) {
        return value != null && !value.isBlank() ? new BigInteger(value) : null;
    }

    private static BigInteger orZero(String value) {
        BigInteger parsed = fromText(value);
        return parsed != null ? parsed : BigInteger.ZERO;
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }
}
