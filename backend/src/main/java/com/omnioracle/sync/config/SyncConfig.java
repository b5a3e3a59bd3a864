package com.omnioracle.sync.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.omnioracle.config.OracleProperties;
import com.omnioracle.state.LocalPriceStore;
import com.omnioracle.state.OracleStateMachine;
import com.omnioracle.sync.PeerDirectory;
import com.omnioracle.sync.PeerRegistry;
import com.omnioracle.sync.PeerSynchronizationManager;
import com.omnioracle.sync.PendingRequest;
import com.omnioracle.sync.ReadChannel;
import com.omnioracle.sync.SyncSettings;
import com.omnioracle.sync.http.HttpReadChannel;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(SyncProperties.class)
public class SyncConfig {

    @Bean
    public PeerDirectory peerDirectory(SyncProperties syncProperties, OracleProperties oracleProperties) {
        return new ConfigPeerDirectory(syncProperties, oracleProperties.getChainId());
    }

    @Bean
    public ReadChannel readChannel(WebClient.Builder webClientBuilder, PeerDirectory peerDirectory, SyncProperties properties) {
        return new HttpReadChannel(webClientBuilder, peerDirectory, Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    /** Unanswered reads expire after omnioracle.sync.request-expiry-seconds. */
    @Bean
    public Cache<String, PendingRequest> pendingReadCache(SyncProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(properties.getRequestExpirySeconds(), TimeUnit.SECONDS)
                .maximumSize(10_000)
                .build();
    }

    @Bean
    public PeerSynchronizationManager peerSynchronizationManager(ReadChannel readChannel,
                                                                 Cache<String, PendingRequest> pendingReadCache,
                                                                 OracleStateMachine oracleStateMachine,
                                                                 LocalPriceStore localPriceStore,
                                                                 ApplicationEventPublisher events, Clock clock,
                                                                 SyncProperties syncProperties,
                                                                 OracleProperties oracleProperties) {
        SyncSettings settings = new SyncSettings(
                syncProperties.getConfirmations(),
                syncProperties.getReadFeeWei(),
                oracleProperties.getFreshness().getPeerSeconds(),
                syncProperties.getConsumerQuorum(),
                syncProperties.getAgreementToleranceBps());
        return new PeerSynchronizationManager(new PeerRegistry(), readChannel, pendingReadCache, oracleStateMachine,
                localPriceStore, events, clock, settings, syncProperties.getReadChannelId());
    }
}
