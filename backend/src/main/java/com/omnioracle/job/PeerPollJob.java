package com.omnioracle.job;

import com.omnioracle.domain.OracleException;
import com.omnioracle.domain.OracleMode;
import com.omnioracle.state.OracleStateMachine;
import com.omnioracle.sync.PeerSynchronizationManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Consumer poll: one remote read per active peer, then eviction of expired pending reads.
 * A failing peer does not stop the others.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PeerPollJob {

    private final PeerSynchronizationManager sync;
    private final OracleStateMachine stateMachine;

    @Scheduled(
            fixedRateString = "${omnioracle.sync.poll-interval-ms:300000}",
            initialDelayString = "${omnioracle.sync.poll-interval-ms:300000}")
    public void runScheduled() {
        if (stateMachine.mode() == OracleMode.CONSUMER) {
            for (Long chainId : sync.activePeerIds()) {
                try {
                    sync.requestRemotePrice(chainId);
                } catch (OracleException e) {
                    log.warn("Poll of chain {} failed [{}]: {}", chainId, e.getCode(), e.getMessage());
                }
            }
        }
        sync.sweepExpired();
    }
}
