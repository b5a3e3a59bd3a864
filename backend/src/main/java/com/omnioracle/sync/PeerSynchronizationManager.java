package com.omnioracle.sync;

import com.github.benmanes.caffeine.cache.Cache;
import com.omnioracle.common.FixedPoint;
import com.omnioracle.domain.CrossChainPriceReceivedEvent;
import com.omnioracle.domain.FeeQuote;
import com.omnioracle.domain.OracleMode;
import com.omnioracle.domain.PeerEndpoint;
import com.omnioracle.domain.PeerPrice;
import com.omnioracle.domain.PriceRequestedEvent;
import com.omnioracle.domain.RemoteReadException;
import com.omnioracle.state.LocalPriceStore;
import com.omnioracle.state.OracleStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Peer registry plus the remote-read cycle: issue a request, match the response by correlation id, cache the
 * peer price and, on a consumer, adopt it as the local price once enough peers agree.
 */
@Slf4j
public class PeerSynchronizationManager {

    private final PeerRegistry registry;
    private final ReadChannel readChannel;
    private final Cache<String, PendingRequest> pending;
    private final OracleStateMachine stateMachine;
    private final LocalPriceStore localPrice;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final SyncSettings settings;

    private volatile long readChannelId;

    public PeerSynchronizationManager(PeerRegistry registry, ReadChannel readChannel, Cache<String, PendingRequest> pending,
                                      OracleStateMachine stateMachine, LocalPriceStore localPrice,
                                      ApplicationEventPublisher events, Clock clock, SyncSettings settings,
                                      long readChannelId) {
        this.registry = registry;
        this.readChannel = readChannel;
        this.pending = pending;
        this.stateMachine = stateMachine;
        this.localPrice = localPrice;
        this.events = events;
        this.clock = clock;
        this.settings = settings;
        this.readChannelId = readChannelId;
    }

    public PeerEndpoint registerPeer(long chainId, String remoteOracleRef) {
        PeerEndpoint peer = registry.register(chainId, remoteOracleRef);
        log.info("Registered peer chain {} ref={} active={}", chainId, peer.remoteOracleRef(), peer.active());
        return peer;
    }

    public PeerEndpoint setPeerActive(long chainId, boolean active) {
        return registry.setActive(chainId, active);
    }

    public List<PeerEndpoint> listPeers() {
        return registry.all();
    }

    public List<Long> activePeerIds() {
        return registry.activeIds();
    }

    public long getReadChannelId() {
        return readChannelId;
    }

    public void setReadChannelId(long readChannelId) {
        this.readChannelId = readChannelId;
    }

    public FeeQuote quoteFee(long chainId) {
        return new FeeQuote(settings.readFeeWei(), BigInteger.ZERO);
    }

    /**
     * Issues a read of the peer's latest price and returns immediately. The response is handled asynchronously.
     *
     * @throws RemoteReadException when the read channel is unset, the peer is inactive or has no reference
     */
    public PendingRequest requestRemotePrice(long chainId) {
        if (readChannelId == 0) {
            throw new RemoteReadException(RemoteReadException.READ_CHANNEL_UNSET, "Read channel is not configured");
        }
        PeerEndpoint peer = registry.get(chainId)
                .filter(PeerEndpoint::active)
                .orElseThrow(() -> new RemoteReadException(RemoteReadException.PEER_INACTIVE, "Peer chain " + chainId + " is not active"));
        if (peer.remoteOracleRef() == null || peer.remoteOracleRef().isBlank()) {
            throw new RemoteReadException(RemoteReadException.PEER_REF_UNSET, "Peer chain " + chainId + " has no oracle reference");
        }
        long now = clock.instant().getEpochSecond();
        FeeQuote fee = quoteFee(chainId);
        String correlationId = UUID.randomUUID().toString();
        RemoteReadRequest request = new RemoteReadRequest(correlationId, chainId, peer.remoteOracleRef(),
                RemoteReadCodec.GET_LATEST_PRICE_SELECTOR, now, settings.confirmations());
        PendingRequest handle = new PendingRequest(correlationId, chainId, now, fee);
        pending.put(correlationId, handle);
        events.publishEvent(new PriceRequestedEvent(correlationId, chainId, fee));
        log.debug("Remote read {} issued to chain {}", correlationId, chainId);
        readChannel.send(request).subscribe(
                this::handleResponse,
                e -> log.warn("Remote read {} to chain {} failed: {}", correlationId, chainId, e.getMessage()));
        return handle;
    }

    /**
     * Matches a response to its pending request and applies it. Unknown or expired correlation ids are dropped.
     *
     * @return true if the peer cache was updated
     */
    public boolean handleResponse(RemoteReadResponse response) {
        if (response == null || response.correlationId() == null) {
            return false;
        }
        PendingRequest request = pending.asMap().remove(response.correlationId());
        if (request == null) {
            log.debug("Dropping response with unknown or expired correlation id {}", response.correlationId());
            return false;
        }
        RemoteReadCodec.RemotePrice decoded;
        try {
            decoded = RemoteReadCodec.decode(response.payload());
        } catch (RemoteReadException e) {
            log.warn("Invalid payload from chain {}: {}", request.chainId(), e.getMessage());
            return false;
        }
        return onRemoteResponse(request.chainId(), decoded.price(), decoded.nativePrice(), decoded.timestamp());
    }

    /**
     * Caches a peer price and, in consumer mode, may adopt it locally.
     *
     * @return true if the peer cache was updated
     */
    public boolean onRemoteResponse(long chainId, BigInteger price, long timestamp) {
        return onRemoteResponse(chainId, price, BigInteger.ZERO, timestamp);
    }

    /**
     * As {@link #onRemoteResponse(long, BigInteger, long)}, with the peer's native price (zero when unknown).
     */
    public boolean onRemoteResponse(long chainId, BigInteger price, BigInteger nativePrice, long timestamp) {
        BigInteger nativeOrZero = nativePrice != null && nativePrice.signum() > 0 ? nativePrice : BigInteger.ZERO;
        if (timestamp == 0) {
            log.debug("Rejected response from chain {} with zero timestamp", chainId);
            return false;
        }
        if (!registry.recordPrice(chainId, price, nativeOrZero, timestamp)) {
            return false;
        }
        boolean adopted = maybeAdopt(chainId, price, nativeOrZero, timestamp);
        events.publishEvent(new CrossChainPriceReceivedEvent(chainId, price, nativeOrZero, timestamp, adopted));
        return true;
    }

    public PeerPrice getPeerPrice(long chainId) {
        Optional<PeerEndpoint> peer = registry.get(chainId);
        if (peer.isEmpty()) {
            return new PeerPrice(BigInteger.ZERO, BigInteger.ZERO, 0L, false);
        }
        PeerEndpoint p = peer.get();
        return new PeerPrice(p.lastPrice18(), p.lastNativePrice18(), p.lastTimestamp(), isValid(p, nowSeconds()));
    }

    /** True if at least one active peer holds a fresh price. */
    public boolean crossChainValid() {
        long now = nowSeconds();
        return registry.activePeers().stream().anyMatch(p -> isValid(p, now));
    }

    public int pendingCount() {
        pending.cleanUp();
        return (int) pending.estimatedSize();
    }

    /** Evicts expired pending requests. */
    public void sweepExpired() {
        pending.cleanUp();
    }

    private boolean maybeAdopt(long chainId, BigInteger price, BigInteger nativePrice, long timestamp) {
        OracleStateMachine.State state = stateMachine.snapshot();
        if (state.mode() != OracleMode.CONSUMER || state.emergency() || price.signum() <= 0) {
            return false;
        }
        if (timestamp <= localPrice.current().timestamp()) {
            return false;
        }
        long now = nowSeconds();
        long agreeing = registry.activePeers().stream()
                .filter(p -> isValid(p, now))
                .filter(p -> p.lastPrice18().signum() > 0)
                .filter(p -> FixedPoint.deviationBps(p.lastPrice18(), price).longValue() <= settings.agreementToleranceBps())
                .count();
        if (agreeing < settings.consumerQuorum()) {
            log.warn("Price from chain {} not adopted: {} of {} peers agree", chainId, agreeing, settings.consumerQuorum());
            return false;
        }
        boolean adopted = localPrice.setIfNewer(price, nativePrice, timestamp);
        if (adopted) {
            log.info("Adopted price {} at {} from chain {}", price, timestamp, chainId);
        }
        return adopted;
    }

    private boolean isValid(PeerEndpoint peer, long now) {
        return peer.active() && peer.lastTimestamp() > 0 && now - peer.lastTimestamp() <= settings.peerFreshnessSeconds();
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }
}
