package com.chainindexer.ingestion.store;

import com.chainindexer.domain.Transaction;
import com.chainindexer.ingestion.reconciliation.BlockTransformProcessor;
import com.chainindexer.ingestion.reconciliation.BlockTransformResult;
import com.chainindexer.ingestion.reconciliation.BlockTransformSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for the decoder side: transform one block and persist everything it produced.
 */
@Service
@RequiredArgsConstructor
public class BlockTransformService {

    private final BlockTransformProcessor blockTransformProcessor;
    private final TransformResultStore transformResultStore;

    public BlockTransformSummary transformAndStore(long blockNumber, List<Transaction> transactions) {
        BlockTransformResult result = blockTransformProcessor.process(blockNumber, transactions);
        return transformResultStore.store(result);
    }
}
