package com.omnioracle.api.controller;

import com.omnioracle.api.dto.ActiveRequest;
import com.omnioracle.api.dto.BreakerRequest;
import com.omnioracle.api.dto.EmergencyRequest;
import com.omnioracle.api.dto.MinValidSourcesRequest;
import com.omnioracle.api.dto.ModeRequest;
import com.omnioracle.api.dto.SourceRequest;
import com.omnioracle.api.dto.SourceResponse;
import com.omnioracle.api.dto.StatusResponse;
import com.omnioracle.api.dto.WeightRequest;
import com.omnioracle.domain.FeedSource;
import com.omnioracle.oracle.OmniPriceOracle;
import com.omnioracle.pricing.WeightedAggregator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * Operator surface: mode, emergency override, feed sources, minimum sources and the circuit breaker.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final OmniPriceOracle oracle;
    private final WeightedAggregator aggregator;

    @PutMapping("/mode")
    public StatusResponse setMode(@Valid @RequestBody ModeRequest request) {
        oracle.setMode(request.mode());
        return StatusResponse.from(oracle.status());
    }

    @PostMapping("/emergency")
    public StatusResponse activateEmergency(@Valid @RequestBody EmergencyRequest request) {
        oracle.activateEmergencyMode(new BigInteger(request.price()));
        return StatusResponse.from(oracle.status());
    }

    @DeleteMapping("/emergency")
    public StatusResponse deactivateEmergency() {
        oracle.deactivateEmergencyMode();
        return StatusResponse.from(oracle.status());
    }

    @GetMapping("/sources")
    public List<SourceResponse> listSources() {
        return aggregator.listSources().stream().map(SourceResponse::from).toList();
    }

    @GetMapping("/sources/{id}")
    public ResponseEntity<SourceResponse> getSource(@PathVariable String id) {
        return aggregator.getSource(id)
                .map(s -> ResponseEntity.ok(SourceResponse.from(s)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/sources/{id}")
    public SourceResponse configureSource(@PathVariable String id, @Valid @RequestBody SourceRequest request) {
        FeedSource source = new FeedSource(id, request.kind(), request.endpointRef().trim(), request.weight(),
                request.maxStalenessSeconds(), request.active() == null || request.active(), request.extra());
        return SourceResponse.from(aggregator.configureSource(source));
    }

    @PatchMapping("/sources/{id}/weight")
    public SourceResponse setWeight(@PathVariable String id, @Valid @RequestBody WeightRequest request) {
        return SourceResponse.from(aggregator.setWeight(id, request.weight()));
    }

    @PatchMapping("/sources/{id}/active")
    public SourceResponse setActive(@PathVariable String id, @Valid @RequestBody ActiveRequest request) {
        return SourceResponse.from(aggregator.setActive(id, request.active()));
    }

    @PutMapping("/min-valid-sources")
    public StatusResponse setMinValidSources(@Valid @RequestBody MinValidSourcesRequest request) {
        oracle.setMinValidSources(request.minValidSources());
        return StatusResponse.from(oracle.status());
    }

    @PutMapping("/breaker")
    public StatusResponse configureBreaker(@Valid @RequestBody BreakerRequest request) {
        oracle.configureCircuitBreaker(request.maxDeviationBps(), request.gracePeriodSeconds());
        return StatusResponse.from(oracle.status());
    }

    @PostMapping("/breaker/reset")
    public StatusResponse resetBreaker() {
        oracle.resetCircuitBreaker();
        return StatusResponse.from(oracle.status());
    }
}
