package com.omnioracle.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PriceUpdateRecordRepository extends MongoRepository<PriceUpdateRecord, String> {

    List<PriceUpdateRecord> findTop20ByInstanceIdOrderByPriceTimestampDesc(String instanceId);
}
