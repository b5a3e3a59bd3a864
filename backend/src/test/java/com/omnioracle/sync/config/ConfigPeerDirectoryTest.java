package com.omnioracle.sync.config;

import com.omnioracle.sync.PeerDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigPeerDirectoryTest {

    private ConfigPeerDirectory directory;

    @BeforeEach
    void setUp() {
        SyncProperties properties = new SyncProperties();
        properties.setReadChannelId(30101);
        properties.getPeers().put(1L, peer("0xlocal", "http://self", true));
        properties.getPeers().put(42161L, peer("0xarb", " http://arb:8080 ", true));
        properties.getPeers().put(10L, peer("0xop", "", false));
        directory = new ConfigPeerDirectory(properties, 1L);
    }

    @Test
    void knownChainIds_excludesLocalChain() {
        assertThat(directory.knownChainIds()).containsExactly(42161L, 10L);
    }

    @Test
    void localChain_answersReadChannel() {
        PeerDirectory.OracleConfig local = directory.oracleConfigFor(1L);

        assertThat(local.configured()).isTrue();
        assertThat(local.readChannelId()).isEqualTo(30101);
    }

    @Test
    void peerConfig() {
        assertThat(directory.oracleConfigFor(42161L))
                .isEqualTo(new PeerDirectory.OracleConfig("0xarb", 30110, true, true));
        assertThat(directory.oracleConfigFor(10L).active()).isFalse();
        assertThat(directory.oracleConfigFor(5L)).isEqualTo(PeerDirectory.OracleConfig.NONE);
    }

    @Test
    void endpoints() {
        assertThat(directory.endpointFor(42161L)).contains("http://arb:8080");
        assertThat(directory.endpointFor(10L)).isEmpty();
        assertThat(directory.endpointFor(5L)).isEmpty();
    }

    private static SyncProperties.Peer peer(String ref, String url, boolean active) {
        SyncProperties.Peer peer = new SyncProperties.Peer();
        peer.setOracleRef(ref);
        peer.setUrl(url);
        peer.setReadChannelId(30110);
        peer.setActive(active);
        return peer;
    }
}
