package com.chainindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for domain_events. Written by TransformResultStore, read by TransformQueryService.
 */
public interface DomainEventRecordRepository extends MongoRepository<DomainEventRecord, String> {

    List<DomainEventRecord> findByTxHashOrderByLogIndexAsc(String txHash);
}
