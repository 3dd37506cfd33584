package com.chainindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface BlockTransformSummaryRecordRepository extends MongoRepository<BlockTransformSummaryRecord, Long> {
}
