package com.omnioracle.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers(disabledWithoutDocker = true)
class OracleSnapshotMongoIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    OracleSnapshotRepository snapshotRepository;
    @Autowired
    PriceUpdateRecordRepository priceUpdateRepository;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void clean() {
        snapshotRepository.deleteAll();
        priceUpdateRepository.deleteAll();
    }

    @Test
    @DisplayName("snapshot keeps int256-sized values and TWAP accumulators as exact strings")
    void persistAndReadSnapshot() {
        String bigCumulative = "115792089237316195423570985008687907853269984665640564039457584007913129639935";
        OracleSnapshot snapshot = new OracleSnapshot();
        snapshot.setId("node-a");
        snapshot.setMode(OracleMode.PRODUCER);
        snapshot.setLatestPrice("1000000000000000000");
        snapshot.setLatestTimestamp(1_700_000_000L);
        snapshot.setFallbackPrice("999000000000000000");
        snapshot.setFallbackTimestamp(1_699_999_000L);
        snapshot.setMinValidSources(2);
        OracleSnapshot.TwapEntry twap = new OracleSnapshot.TwapEntry();
        twap.setPoolRef("0xpool");
        twap.setCumulativePrice0Last(bigCumulative);
        twap.setCumulativePrice1Last("0");
        twap.setLastTimestamp(1_699_990_000L);
        twap.setRatio18("2500000000000000000000");
        snapshot.setTwapStates(List.of(twap));
        snapshot.setUpdatedAt(Instant.parse("2025-01-01T00:00:00Z"));

        snapshotRepository.save(snapshot);

        OracleSnapshot read = snapshotRepository.findById("node-a").orElseThrow();
        assertThat(read.getMode()).isEqualTo(OracleMode.PRODUCER);
        assertThat(read.getLatestPrice()).isEqualTo("1000000000000000000");
        assertThat(read.getFallbackTimestamp()).isEqualTo(1_699_999_000L);
        assertThat(read.getTwapStates()).hasSize(1);
        assertThat(read.getTwapStates().get(0).getCumulativePrice0Last()).isEqualTo(bigCumulative);
    }

    @Test
    @DisplayName("history query returns the newest twenty records of one instance")
    void recentUpdatesNewestFirst() {
        for (int i = 0; i < 25; i++) {
            priceUpdateRepository.save(record("node-a", 1_700_000_000L + i));
        }
        priceUpdateRepository.save(record("node-b", 1_800_000_000L));

        List<PriceUpdateRecord> recent = priceUpdateRepository.findTop20ByInstanceIdOrderByPriceTimestampDesc("node-a");

        assertThat(recent).hasSize(20);
        assertThat(recent.get(0).getPriceTimestamp()).isEqualTo(1_700_000_024L);
        assertThat(recent).allMatch(r -> r.getInstanceId().equals("node-a"));
    }

    @Test
    @DisplayName("price_updates index is created")
    void indexesCreated() {
        priceUpdateRepository.save(record("node-a", 1L));
        List<IndexInfo> indexes = mongoTemplate.indexOps("price_updates").getIndexInfo();
        List<String> names = indexes.stream().map(IndexInfo::getName).toList();

        assertThat(names).contains("instance_ts");
    }

    private static PriceUpdateRecord record(String instanceId, long ts) {
        PriceUpdateRecord r = new PriceUpdateRecord();
        r.setInstanceId(instanceId);
        r.setOrigin(PriceUpdateRecord.Origin.LOCAL);
        r.setPrice("1000000000000000000");
        r.setNativePrice("2500000000000000000000");
        r.setPriceTimestamp(ts);
        r.setRecordedAt(Instant.now());
        return r;
    }
}
