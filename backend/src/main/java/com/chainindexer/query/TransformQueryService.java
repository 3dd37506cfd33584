package com.chainindexer.query;

import com.chainindexer.domain.BlockTransformSummaryRecordRepository;
import com.chainindexer.domain.DomainEventRecordRepository;
import com.chainindexer.domain.ProcessingErrorRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the transform store. Tx hashes are matched lowercase, as the engine stores them.
 */
@Service
@RequiredArgsConstructor
public class TransformQueryService {

    private final DomainEventRecordRepository domainEventRecordRepository;
    private final ProcessingErrorRecordRepository processingErrorRecordRepository;
    private final BlockTransformSummaryRecordRepository blockTransformSummaryRecordRepository;

    /**
     * Events and positions of one transaction in log order.
     */
    public List<EventView> findEvents(String txHash) {
        return domainEventRecordRepository.findByTxHashOrderByLogIndexAsc(txHash.toLowerCase()).stream()
                .map(r -> new EventView(r.getId(), r.getEventType(), r.getTxHash(), r.getBlockNumber(),
                        r.getLogIndex(), r.getTimestamp(), r.getPayload()))
                .toList();
    }

    public List<ErrorView> findErrors(String txHash) {
        return processingErrorRecordRepository.findByTxHashOrderByLogIndexAsc(txHash.toLowerCase()).stream()
                .map(r -> new ErrorView(r.getId(), r.getErrorType(), r.getMessage(), r.getTxHash(), r.getLogIndex(),
                        r.getContract(), r.getTransformerName(), r.getContext()))
                .toList();
    }

    public Optional<BlockSummaryView> findBlockSummary(long blockNumber) {
        return blockTransformSummaryRecordRepository.findById(blockNumber)
                .map(r -> new BlockSummaryView(r.getBlockNumber(), r.getTransactions(), r.getProcessedTransactions(),
                        r.getSkippedTransactions(), r.getErroredTransactions(), r.getEvents(), r.getPositions(),
                        r.getErrors(), r.getCompletedAt()));
    }
}
