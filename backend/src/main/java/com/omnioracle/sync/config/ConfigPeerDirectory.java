package com.omnioracle.sync.config;

import com.omnioracle.sync.PeerDirectory;

import java.util.List;
import java.util.Optional;

/**
 * Peer directory backed by omnioracle.sync.peers. The local chain is answered from omnioracle.sync.read-channel-id.
 */
public class ConfigPeerDirectory implements PeerDirectory {

    private final SyncProperties properties;
    private final long localChainId;

    public ConfigPeerDirectory(SyncProperties properties, long localChainId) {
        this.properties = properties;
        this.localChainId = localChainId;
    }

    @Override
    public Optional<String> endpointFor(long chainId) {
        SyncProperties.Peer peer = properties.getPeers().get(chainId);
        if (peer == null || peer.getUrl() == null || peer.getUrl().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(peer.getUrl().strip());
    }

    @Override
    public OracleConfig oracleConfigFor(long chainId) {
        if (chainId == localChainId) {
            long channel = properties.getReadChannelId();
            return new OracleConfig(null, channel, channel != 0, true);
        }
        SyncProperties.Peer peer = properties.getPeers().get(chainId);
        if (peer == null) {
            return OracleConfig.NONE;
        }
        return new OracleConfig(peer.getOracleRef(), peer.getReadChannelId(), true, peer.isActive());
    }

    @Override
    public List<Long> knownChainIds() {
        return properties.getPeers().keySet().stream()
                .filter(id -> id != localChainId)
                .toList();
    }
}
