package com.omnioracle.sync;

import com.omnioracle.config.OracleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Registers the peers listed by the {@link PeerDirectory} and picks up the local read channel id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PeerBootstrap {

    private final PeerDirectory directory;
    private final PeerSynchronizationManager manager;
    private final OracleProperties oracleProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        bootstrap();
    }

    void bootstrap() {
        PeerDirectory.OracleConfig local = directory.oracleConfigFor(oracleProperties.getChainId());
        if (local.configured()) {
            manager.setReadChannelId(local.readChannelId());
        }
        int registered = 0;
        for (Long chainId : directory.knownChainIds()) {
            PeerDirectory.OracleConfig config = directory.oracleConfigFor(chainId);
            if (!config.configured()) {
                continue;
            }
            try {
                manager.registerPeer(chainId, config.primaryRef());
                if (!config.active()) {
                    manager.setPeerActive(chainId, false);
                }
                registered++;
            } catch (RuntimeException e) {
                log.warn("Skipping peer chain {}: {}", chainId, e.getMessage());
            }
        }
        log.info("Peer bootstrap done: {} peers, read channel {}", registered, manager.getReadChannelId());
    }
}
