package com.omnioracle.api.controller;

import com.omnioracle.api.dto.FreshResponse;
import com.omnioracle.api.dto.PriceHistoryItem;
import com.omnioracle.api.dto.PriceResponse;
import com.omnioracle.api.dto.StatusResponse;
import com.omnioracle.api.dto.UpdateResponse;
import com.omnioracle.domain.ValidationResult;
import com.omnioracle.oracle.OmniPriceOracle;
import com.omnioracle.oracle.OracleStatePersistence;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Caller-facing queries and the manual producer update.
 */
@RestController
@RequestMapping("/api/v1/oracle")
@RequiredArgsConstructor
public class OracleController {

    private final OmniPriceOracle oracle;
    private final OracleStatePersistence persistence;

    @GetMapping("/price")
    public PriceResponse latestPrice() {
        return PriceResponse.from(oracle.latestPrice());
    }

    @GetMapping("/price/native")
    public PriceResponse latestNativePrice() {
        return PriceResponse.from(oracle.latestNativePrice());
    }

    @GetMapping("/validate")
    public ValidationResult validate() {
        return oracle.validate();
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return StatusResponse.from(oracle.status());
    }

    @GetMapping("/fresh")
    public FreshResponse fresh() {
        return new FreshResponse(oracle.isFresh());
    }

    /** Runs the pipeline on boundedElastic: it blocks on RPC reads. */
    @PostMapping("/update")
    public Mono<ResponseEntity<UpdateResponse>> update() {
        return Mono.fromCallable(() -> ResponseEntity.ok(UpdateResponse.from(oracle.updatePrice())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/history")
    public Mono<List<PriceHistoryItem>> history() {
        return Mono.fromCallable(() -> persistence.recentUpdates().stream().map(PriceHistoryItem::from).toList())
                .subscribeOn(Schedulers.boundedElastic());
    }
}
