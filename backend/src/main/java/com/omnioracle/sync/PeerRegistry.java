package com.omnioracle.sync;

import com.omnioracle.domain.InvalidConfigurationException;
import com.omnioracle.domain.PeerEndpoint;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known peers and the unordered list of active chain ids. Deactivation swaps the id with the last element and
 * truncates. Peers are never forgotten, only deactivated.
 */
@Slf4j
public class PeerRegistry {

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final Map<Long, PeerEndpoint> peers = new LinkedHashMap<>();
    private final List<Long> activeIds = new ArrayList<>();

    /**
     * Sets the peer's remote oracle reference. The peer is active iff the reference is set.
     */
    public synchronized PeerEndpoint register(long chainId, String remoteOracleRef) {
        checkChainId(chainId);
        boolean active = isSet(remoteOracleRef);
        String ref = active ? remoteOracleRef.strip() : null;
        PeerEndpoint previous = peers.get(chainId);
        PeerEndpoint next = previous == null ? PeerEndpoint.of(chainId, ref, active) : previous.withReference(ref, active);
        peers.put(chainId, next);
        applyActivity(chainId, previous != null && previous.active(), active);
        return next;
    }

    public synchronized PeerEndpoint setActive(long chainId, boolean active) {
        PeerEndpoint previous = peers.get(chainId);
        if (previous == null) {
            throw new InvalidConfigurationException("Unknown peer chain: " + chainId);
        }
        PeerEndpoint next = previous.withActive(active);
        peers.put(chainId, next);
        applyActivity(chainId, previous.active(), active);
        return next;
    }

    /**
     * Caches a received price unless it is older than the one already held.
     *
     * @return false for unknown peers and out-of-order responses
     */
    public synchronized boolean recordPrice(long chainId, BigInteger price, BigInteger nativePrice, long timestamp) {
        PeerEndpoint peer = peers.get(chainId);
        if (peer == null) {
            return false;
        }
        if (timestamp < peer.lastTimestamp()) {
            log.debug("Ignoring out-of-order response from chain {}: {} < {}", chainId, timestamp, peer.lastTimestamp());
            return false;
        }
        peers.put(chainId, peer.withPrice(price, nativePrice, timestamp));
        return true;
    }

    public synchronized Optional<PeerEndpoint> get(long chainId) {
        return Optional.ofNullable(peers.get(chainId));
    }

    public synchronized List<Long> activeIds() {
        return List.copyOf(activeIds);
    }

    public synchronized List<PeerEndpoint> all() {
        return List.copyOf(peers.values());
    }

    public synchronized List<PeerEndpoint> activePeers() {
        List<PeerEndpoint> result = new ArrayList<>(activeIds.size());
        for (Long id : activeIds) {
            result.add(peers.get(id));
        }
        return result;
    }

    private void applyActivity(long chainId, boolean wasActive, boolean active) {
        if (!wasActive && active) {
            activeIds.add(chainId);
            log.info("Peer chain {} activated", chainId);
        } else if (wasActive && !active) {
            removeActive(chainId);
            log.info("Peer chain {} deactivated", chainId);
        }
    }

    private void removeActive(long chainId) {
        int index = activeIds.indexOf(chainId);
        if (index < 0) {
            return;
        }
        int last = activeIds.size() - 1;
        activeIds.set(index, activeIds.get(last));
        activeIds.remove(last);
    }

    private static boolean isSet(String ref) {
        return ref != null && !ref.isBlank() && !ZERO_ADDRESS.equalsIgnoreCase(ref.strip());
    }

    private static void checkChainId(long chainId) {
        if (chainId <= 0) {
            throw new InvalidConfigurationException("Chain id must be positive: " + chainId);
        }
    }
}
