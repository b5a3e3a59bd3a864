package com.omnioracle.api.controller;

import com.omnioracle.api.dto.ActiveRequest;
import com.omnioracle.api.dto.FeeResponse;
import com.omnioracle.api.dto.PeerPriceResponse;
import com.omnioracle.api.dto.PeerResponse;
import com.omnioracle.api.dto.RegisterPeerRequest;
import com.omnioracle.api.dto.RemoteReadTicketResponse;
import com.omnioracle.sync.PeerSynchronizationManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Peer registry, cached peer prices and manual remote reads.
 */
@RestController
@RequestMapping("/api/v1/peers")
@RequiredArgsConstructor
public class PeerController {

    private final PeerSynchronizationManager sync;

    @GetMapping
    public List<PeerResponse> list() {
        return sync.listPeers().stream().map(PeerResponse::from).toList();
    }

    @GetMapping("/{chainId}/price")
    public PeerPriceResponse price(@PathVariable long chainId) {
        return PeerPriceResponse.from(sync.getPeerPrice(chainId));
    }

    @PutMapping("/{chainId}")
    public PeerResponse register(@PathVariable long chainId, @Valid @RequestBody RegisterPeerRequest request) {
        return PeerResponse.from(sync.registerPeer(chainId, request.remoteOracleRef()));
    }

    @PatchMapping("/{chainId}/active")
    public PeerResponse setActive(@PathVariable long chainId, @Valid @RequestBody ActiveRequest request) {
        return PeerResponse.from(sync.setPeerActive(chainId, request.active()));
    }

    @PostMapping("/{chainId}/request")
    public ResponseEntity<RemoteReadTicketResponse> request(@PathVariable long chainId) {
        return ResponseEntity.accepted().body(RemoteReadTicketResponse.from(sync.requestRemotePrice(chainId)));
    }

    @GetMapping("/{chainId}/fee")
    public FeeResponse fee(@PathVariable long chainId) {
        return FeeResponse.from(sync.quoteFee(chainId));
    }
}
