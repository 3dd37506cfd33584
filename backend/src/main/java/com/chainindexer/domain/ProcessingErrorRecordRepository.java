package com.chainindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ProcessingErrorRecordRepository extends MongoRepository<ProcessingErrorRecord, String> {

    List<ProcessingErrorRecord> findByTxHashOrderByLogIndexAsc(String txHash);
}
