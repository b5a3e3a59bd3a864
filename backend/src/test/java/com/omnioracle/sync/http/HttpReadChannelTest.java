package com.omnioracle.sync.http;

import com.omnioracle.domain.RemoteReadException;
import com.omnioracle.sync.PeerDirectory;
import com.omnioracle.sync.RemoteReadRequest;
import com.omnioracle.sync.RemoteReadResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class HttpReadChannelTest {

    private static final RemoteReadRequest REQUEST =
            new RemoteReadRequest("c-1", 42161, "0xabc", "0x8e15f473", 1_700_000_000L, 1);

    @Test
    @DisplayName("POSTs the request to the peer read path and maps the response")
    void postsToPeer() {
        List<String> urls = new ArrayList<>();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            urls.add(request.url().toString());
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body("{\"correlationId\":\"c-1\",\"payload\":\"0x01\"}")
                    .build());
        });
        HttpReadChannel channel = new HttpReadChannel(builder, directory("http://peer:8080/"), Duration.ofSeconds(5));

        StepVerifier.create(channel.send(REQUEST))
                .expectNext(new RemoteReadResponse("c-1", "0x01"))
                .verifyComplete();
        assertThat(urls).containsExactly("http://peer:8080/api/v1/oracle/read");
    }

    @Test
    void peerErrorStatus_isPayloadInvalid() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request ->
                Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()));
        HttpReadChannel channel = new HttpReadChannel(builder, directory("http://peer:8080"), Duration.ofSeconds(5));

        StepVerifier.create(channel.send(REQUEST))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(RemoteReadException.class);
                    assertThat(((RemoteReadException) e).getCode()).isEqualTo(RemoteReadException.PAYLOAD_INVALID);
                })
                .verify();
    }

    @Test
    void unknownEndpoint_failsWithoutCall() {
        List<String> urls = new ArrayList<>();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            urls.add(request.url().toString());
            return Mono.empty();
        });
        HttpReadChannel channel = new HttpReadChannel(builder, directory(null), Duration.ofSeconds(5));

        StepVerifier.create(channel.send(REQUEST))
                .expectErrorSatisfies(e -> assertThat(((RemoteReadException) e).getCode())
                        .isEqualTo(RemoteReadException.PEER_REF_UNSET))
                .verify();
        assertThat(urls).isEmpty();
    }

    private static PeerDirectory directory(String url) {
        return new PeerDirectory() {
            @Override
            public Optional<String> endpointFor(long chainId) {
                return Optional.ofNullable(url);
            }

            @Override
            public OracleConfig oracleConfigFor(long chainId) {
                return OracleConfig.NONE;
            }

            @Override
            public List<Long> knownChainIds() {
                return List.of();
            }
        };
    }
}
