package com.omnioracle.sync;

import java.math.BigInteger;

/**
 * Tunables of {@link PeerSynchronizationManager}.
 *
 * @param confirmations         block confirmations requested from the read channel
 * @param readFeeWei            native fee quoted per remote read
 * @param peerFreshnessSeconds  a cached peer price is valid within this window
 * @param consumerQuorum        valid peers that must agree before a consumer adopts a price
 * @param agreementToleranceBps maximum distance between agreeing peer prices
 */
public record SyncSettings(
        int confirmations,
        BigInteger readFeeWei,
        long peerFreshnessSeconds,
        int consumerQuorum,
        long agreementToleranceBps
) {}
