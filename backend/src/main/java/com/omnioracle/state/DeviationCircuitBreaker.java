package com.omnioracle.state;

import com.omnioracle.common.FixedPoint;
import com.omnioracle.domain.CircuitBreakerOpenException;
import com.omnioracle.domain.CircuitBreakerTrippedEvent;
import com.omnioracle.domain.InvalidConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;

/**
 * Deviation gate between a candidate price and the last accepted one. Disabled while {@code maxDeviationBps == 0}.
 * The grace period starts at the first accepted price; a trip holds until {@link #reset()}.
 */
@Slf4j
public class DeviationCircuitBreaker {

    private final ApplicationEventPublisher events;

    private long maxDeviationBps;
    private long gracePeriodSeconds;
    private long graceStartedAt;
    private boolean tripped;

    public DeviationCircuitBreaker(long maxDeviationBps, long gracePeriodSeconds, ApplicationEventPublisher events) {
        this.events = events;
        configure(maxDeviationBps, gracePeriodSeconds);
    }

    public synchronized void configure(long maxDeviationBps, long gracePeriodSeconds) {
        if (maxDeviationBps < 0 || gracePeriodSeconds < 0) {
            throw new InvalidConfigurationException("Deviation and grace period must be non-negative");
        }
        this.maxDeviationBps = maxDeviationBps;
        this.gracePeriodSeconds = gracePeriodSeconds;
    }

    /**
     * @throws CircuitBreakerOpenException if already tripped, or if this candidate trips it
     */
    public synchronized void check(BigInteger candidate, BigInteger reference, long nowSeconds) {
        if (tripped) {
            throw new CircuitBreakerOpenException(CircuitBreakerOpenException.OPEN, "Circuit breaker is open, manual reset required");
        }
        if (maxDeviationBps == 0 || reference == null || reference.signum() <= 0 || inGracePeriod(nowSeconds)) {
            return;
        }
        BigInteger deviation = FixedPoint.deviationBps(candidate, reference);
        if (deviation.compareTo(BigInteger.valueOf(maxDeviationBps)) > 0) {
            tripped = true;
            log.warn("Circuit breaker tripped: candidate={} reference={} deviation={}bps max={}bps",
                    candidate, reference, deviation, maxDeviationBps);
            events.publishEvent(new CircuitBreakerTrippedEvent(candidate, reference, deviation));
            throw new CircuitBreakerOpenException(CircuitBreakerOpenException.DEVIATION_EXCEEDED,
                    "Deviation " + deviation + "bps exceeds " + maxDeviationBps + "bps");
        }
    }

    public synchronized void onAccepted(long nowSeconds) {
        if (graceStartedAt == 0) {
            graceStartedAt = nowSeconds;
        }
    }

    public synchronized boolean inGracePeriod(long nowSeconds) {
        return graceStartedAt == 0 || nowSeconds - graceStartedAt < gracePeriodSeconds;
    }

    public synchronized void reset() {
        if (tripped) {
            log.info("Circuit breaker reset");
        }
        tripped = false;
    }

    public synchronized boolean isTripped() {
        return tripped;
    }

    public synchronized long getMaxDeviationBps() {
        return maxDeviationBps;
    }

    public synchronized long getGracePeriodSeconds() {
        return gracePeriodSeconds;
    }

    public synchronized long getGraceStartedAt() {
        return graceStartedAt;
    }

    public synchronized void restore(boolean tripped, long graceStartedAt) {
        this.tripped = tripped;
        this.graceStartedAt = Math.max(0L, graceStartedAt);
    }
}
