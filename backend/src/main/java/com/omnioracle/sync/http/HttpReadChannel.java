package com.omnioracle.sync.http;

import com.omnioracle.domain.RemoteReadException;
import com.omnioracle.sync.PeerDirectory;
import com.omnioracle.sync.ReadChannel;
import com.omnioracle.sync.RemoteReadRequest;
import com.omnioracle.sync.RemoteReadResponse;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Delivers read commands as {@code POST {peerUrl}/api/v1/oracle/read}.
 */
public class HttpReadChannel implements ReadChannel {

    public static final String READ_PATH = "/api/v1/oracle/read";

    private final WebClient webClient;
    private final PeerDirectory directory;
    private final Duration timeout;

    public HttpReadChannel(WebClient.Builder builder, PeerDirectory directory, Duration timeout) {
        this.webClient = builder.build();
        this.directory = directory;
        this.timeout = timeout;
    }

    @Override
    public Mono<RemoteReadResponse> send(RemoteReadRequest request) {
        String base = directory.endpointFor(request.targetChainId()).orElse(null);
        if (base == null) {
            return Mono.error(new RemoteReadException(RemoteReadException.PEER_REF_UNSET,
                    "No endpoint for chain " + request.targetChainId()));
        }
        String url = base.endsWith("/") ? base.substring(0, base.length() - 1) + READ_PATH : base + READ_PATH;
        return webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(RemoteReadResponse.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class,
                        e -> new RemoteReadException(RemoteReadException.PAYLOAD_INVALID,
                                "Peer " + request.targetChainId() + " answered " + e.getStatusCode().value(), e));
    }
}
