package com.omnioracle.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Append-only audit entry for every price that became the local latest price.
 */
@Document(collection = "price_updates")
@CompoundIndex(name = "instance_ts", def = "{'instanceId': 1, 'priceTimestamp': -1}")
@NoArgsConstructor
@Getter
@Setter
public class PriceUpdateRecord {

    @Id
    private String id;
    private String instanceId;
    private Origin origin;
    /** Source chain for PEER records; null for LOCAL. */
    private Long sourceChainId;
    private String price;
    private String nativePrice;
    private long priceTimestamp;
    private boolean degraded;
    private Instant recordedAt;

    public enum Origin {
        LOCAL,
        PEER
    }
}
