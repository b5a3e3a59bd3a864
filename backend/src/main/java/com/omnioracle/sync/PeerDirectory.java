package com.omnioracle.sync;

import java.util.List;
import java.util.Optional;

/**
 * Read-only registry of peer deployments.
 */
public interface PeerDirectory {

    /** Transport endpoint of the peer on {@code chainId}. */
    Optional<String> endpointFor(long chainId);

    OracleConfig oracleConfigFor(long chainId);

    List<Long> knownChainIds();

    /**
     * Deployment record of an oracle. {@code configured} is false when the directory knows nothing about the chain.
     */
    record OracleConfig(String primaryRef, long readChannelId, boolean configured, boolean active) {

        public static final OracleConfig NONE = new OracleConfig(null, 0L, false, false);
    }
}
