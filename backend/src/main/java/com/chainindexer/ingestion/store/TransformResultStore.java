package com.chainindexer.ingestion.store;

import com.chainindexer.domain.BlockTransformSummaryRecord;
import com.chainindexer.domain.BlockTransformSummaryRecordRepository;
import com.chainindexer.domain.DomainEvent;
import com.chainindexer.domain.DomainEventRecord;
import com.chainindexer.domain.DomainEventRecordRepository;
import com.chainindexer.domain.ProcessingError;
import com.chainindexer.domain.ProcessingErrorRecord;
import com.chainindexer.domain.ProcessingErrorRecordRepository;
import com.chainindexer.domain.TransformedTransaction;
import com.chainindexer.ingestion.reconciliation.BlockTransformResult;
import com.chainindexer.ingestion.reconciliation.BlockTransformSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Idempotent persistence of transform output. Every document is keyed by its content id, so replaying a block
 * rewrites the same documents instead of adding new ones.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransformResultStore {

    private final DomainEventRecordRepository domainEventRecordRepository;
    private final ProcessingErrorRecordRepository processingErrorRecordRepository;
    private final BlockTransformSummaryRecordRepository blockTransformSummaryRecordRepository;
    private final DomainEventDocumentMapper mapper;

    public BlockTransformSummary store(BlockTransformResult result) {
        result.transactions().forEach(this::store);
        BlockTransformSummary summary = result.summary();
        BlockTransformSummaryRecord record = blockTransformSummaryRecordRepository.findById(summary.blockNumber())
                .orElse(new BlockTransformSummaryRecord());
        record.setBlockNumber(summary.blockNumber());
        record.setTransactions(summary.transactions());
        record.setProcessedTransactions(summary.processed());
        record.setSkippedTransactions(summary.skipped());
        record.setErroredTransactions(summary.erroredTransactions());
        record.setEvents(summary.events());
        record.setPositions(summary.positions());
        record.setErrors(summary.errors());
        record.setCompletedAt(Instant.now());
        blockTransformSummaryRecordRepository.save(record);
        return summary;
    }

    public void store(TransformedTransaction tx) {
        long blockNumber = tx.transaction().blockNumber();
        tx.events().values().forEach(event -> upsert(event, blockNumber));
        tx.positions().values().forEach(position -> upsert(position, blockNumber));
        tx.errors().values().forEach(error -> upsert(error, blockNumber));
        log.debug("Stored tx {}: {} events, {} positions, {} errors", tx.txHash(), tx.events().size(),
                tx.positions().size(), tx.errors().size());
    }

    private void upsert(DomainEvent event, long blockNumber) {
        Optional<DomainEventRecord> existing = domainEventRecordRepository.findById(event.contentId());
        existing.filter(r -> r.getEventType() != event.eventType() || !event.txHash().equals(r.getTxHash())
                        || r.getLogIndex() != event.logIndex())
                .ifPresent(r -> log.warn("Content id {} collision: stored {} of tx {} overwritten by {} of tx {}",
                        r.getId(), r.getEventType(), r.getTxHash(), event.eventType(), event.txHash()));
        DomainEventRecord record = mapper.toRecord(event, blockNumber, existing.orElse(new DomainEventRecord()));
        record.setStoredAt(Instant.now());
        domainEventRecordRepository.save(record);
    }

    private void upsert(ProcessingError error, long blockNumber) {
        ProcessingErrorRecord record = mapper.toRecord(error, blockNumber,
                processingErrorRecordRepository.findById(error.errorId()).orElse(new ProcessingErrorRecord()));
        record.setStoredAt(Instant.now());
        processingErrorRecordRepository.save(record);
    }
}
