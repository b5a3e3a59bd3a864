package com.omnioracle.api.controller;

import com.omnioracle.oracle.OmniPriceOracle;
import com.omnioracle.sync.RemoteReadRequest;
import com.omnioracle.sync.RemoteReadResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/v1/oracle/read: inbound remote read from a peer instance.
 */
@RestController
@RequestMapping("/api/v1/oracle")
@RequiredArgsConstructor
@Slf4j
public class RemoteReadController {

    private final OmniPriceOracle oracle;

    @PostMapping("/read")
    public RemoteReadResponse read(@RequestBody RemoteReadRequest request) {
        log.debug("Remote read {} selector={}", request.correlationId(), request.callSelector());
        return new RemoteReadResponse(request.correlationId(), oracle.serveRead(request.callSelector()));
    }
}
