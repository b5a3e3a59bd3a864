package com.omnioracle.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for oracle_snapshots, one document per instance id.
 */
public interface OracleSnapshotRepository extends MongoRepository<OracleSnapshot, String> {
}
