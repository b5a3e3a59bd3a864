package com.omnioracle.state;

import com.omnioracle.domain.EmergencyModeChangedEvent;
import com.omnioracle.domain.InvalidConfigurationException;
import com.omnioracle.domain.OracleMode;
import com.omnioracle.domain.OracleModeChangedEvent;
import com.omnioracle.domain.OracleStateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Role and emergency override of this instance. Mode leaves {@link OracleMode#UNINITIALIZED} once and never
 * returns to it; producer and consumer may swap. Emergency mode pins the published price to an operator value.
 */
@Slf4j
public class OracleStateMachine {

    /**
     * Immutable view of the state machine.
     */
    public record State(OracleMode mode, boolean emergency, BigInteger emergencyPrice) {}

    private final AtomicReference<State> state;
    private final ApplicationEventPublisher events;

    public OracleStateMachine(OracleMode initialMode, ApplicationEventPublisher events) {
        this.state = new AtomicReference<>(new State(initialMode != null ? initialMode : OracleMode.UNINITIALIZED,
                false, null));
        this.events = events;
    }

    public State snapshot() {
        return state.get();
    }

    public OracleMode mode() {
        return state.get().mode();
    }

    public boolean isEmergency() {
        return state.get().emergency();
    }

    public synchronized void setMode(OracleMode next) {
        if (next == null || next == OracleMode.UNINITIALIZED) {
            throw new OracleStateException(OracleStateException.MODE_VIOLATION, "Cannot enter UNINITIALIZED");
        }
        State prev = state.get();
        if (prev.mode() == next) {
            return;
        }
        state.set(new State(next, prev.emergency(), prev.emergencyPrice()));
        log.info("Oracle mode {} -> {}", prev.mode(), next);
        events.publishEvent(new OracleModeChangedEvent(prev.mode(), next));
    }

    public synchronized void activateEmergency(BigInteger price) {
        if (price == null || price.signum() <= 0) {
            throw new InvalidConfigurationException("Emergency price must be positive");
        }
        State prev = state.get();
        state.set(new State(prev.mode(), true, price));
        log.warn("Emergency mode activated at price {}", price);
        events.publishEvent(new EmergencyModeChangedEvent(true, price));
    }

    public synchronized void deactivateEmergency() {
        State prev = state.get();
        if (!prev.emergency()) {
            return;
        }
        state.set(new State(prev.mode(), false, null));
        log.warn("Emergency mode deactivated");
        events.publishEvent(new EmergencyModeChangedEvent(false, null));
    }

    /**
     * Fails with {@link OracleStateException} unless this instance may run local aggregation.
     */
    public void requireLocalAggregation() {
        State current = state.get();
        if (current.emergency()) {
            throw new OracleStateException(OracleStateException.EMERGENCY_ACTIVE, "Updates are blocked while emergency mode is active");
        }
        if (current.mode() != OracleMode.PRODUCER) {
            throw new OracleStateException(OracleStateException.MODE_VIOLATION,
                    "Local aggregation requires PRODUCER mode, current " + current.mode());
        }
    }

    /** Restores persisted state without publishing events. */
    public synchronized void restore(OracleMode mode, boolean emergency, BigInteger emergencyPrice) {
        boolean validEmergency = emergency && emergencyPrice != null && emergencyPrice.signum() > 0;
        state.set(new State(mode != null ? mode : OracleMode.UNINITIALIZED, validEmergency,
                validEmergency ? emergencyPrice : null));
    }
}
