package com.omnioracle.sync;

import reactor.core.publisher.Mono;

/**
 * Transport that delivers a read command to a peer and emits its response.
 */
public interface ReadChannel {

    Mono<RemoteReadResponse> send(RemoteReadRequest request);
}
