package com.chainindexer.ingestion.reconciliation;

import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.ErrorType;
import com.chainindexer.domain.MatchedTransfer;
import com.chainindexer.domain.ProcessingError;
import com.chainindexer.domain.Signal;
import com.chainindexer.domain.Transaction;
import com.chainindexer.domain.TransferSignal;
import com.chainindexer.domain.TransformedTransaction;
import com.chainindexer.ingestion.registry.TransformerRegistry;
import com.chainindexer.ingestion.transform.SignalExtraction;
import com.chainindexer.ingestion.transform.TransformContext;
import com.chainindexer.ingestion.transform.TransformResult;
import com.chainindexer.ingestion.transformer.Transformer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Reconciles one transaction: phase 1 extracts signals for every registered contract, phase 2 runs each
 * contract's event logic in priority order against the shared pool, and finalization turns leftover transfers
 * into plain Transfer events.
 * <p>
 * Each result is merged before the next contract runs, so lower-priority contracts see earlier consumption.
 * A result that would re-match a transfer another event already holds is dropped with a conflicting_match error.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final TransformerRegistry registry;

    /**
     * Never throws for bad transaction content: failures end up as ProcessingErrors on the returned record.
     */
    public TransformedTransaction transform(Transaction tx) {
        if (!tx.txSuccess() || tx.decodedLogs().isEmpty()) {
            log.debug("Passing through tx {} (success={}, decoded logs={})", tx.txHash(), tx.txSuccess(),
                    tx.decodedLogs().size());
            return TransformedTransaction.passThrough(tx, Map.of());
        }
        try {
            return reconcile(tx);
        } catch (RuntimeException e) {
            log.error("Transform failed for tx {}", tx.txHash(), e);
            Map<String, String> context = new LinkedHashMap<>();
            context.put("tx_hash", tx.txHash());
            context.put("exception", e.getClass().getName());
            ProcessingError error = ProcessingError.of(ErrorType.PROCESSING_EXCEPTION,
                    "Transaction aborted: " + e.getClass().getSimpleName() + ": " + e.getMessage(),
                    tx.txHash(), null, null, getClass().getSimpleName(), context);
            return TransformedTransaction.passThrough(tx, Map.of(error.errorId(), error));
        }
    }

    private TransformedTransaction reconcile(Transaction tx) {
        TransformContext context = new TransformContext(tx);

        SortedMap<Integer, Map<String, List<DecodedLog>>> transferLogs = registry.getTransfersOrdered(tx);
        transferLogs.forEach((priority, byContract) -> byContract.forEach((contract, logs) ->
                extract(context, contract, logs)));

        context.beginReconciliation();
        log.debug("Tx {}: {} signals extracted, reconciling", tx.txHash(), context.signals().size());

        SortedMap<Integer, Map<String, List<DecodedLog>>> eventLogs = registry.getRemainingLogsOrdered(tx);
        eventLogs.forEach((priority, byContract) -> byContract.forEach((contract, logs) ->
                reconcileContract(context, priority, contract, logs)));

        TransformedTransaction result = context.finalizeToTransaction();
        log.debug("Tx {} finalized: {} events, {} positions, {} errors", tx.txHash(), result.events().size(),
                result.positions().size(), result.errors().size());
        return result;
    }

    private void extract(TransformContext context, String contract, List<DecodedLog> logs) {
        Transformer transformer = transformerFor(contract);
        SignalExtraction extraction;
        try {
            extraction = transformer.processTransfers(logs, context.transaction());
        } catch (RuntimeException e) {
            context.addErrors(contractFailure(context, transformer, logs, e));
            return;
        }
        context.addSignals(extraction.signals());
        context.addErrors(extraction.errors());
    }

    private void reconcileContract(TransformContext context, int priority, String contract, List<DecodedLog> logs) {
        Transformer transformer = transformerFor(contract);
        log.debug("Tx {}: priority {} dispatching {} logs to {} on {}", context.txHash(), priority, logs.size(),
                transformer.name(), contract);
        TransformResult result;
        try {
            result = transformer.processLogs(logs, context);
        } catch (RuntimeException e) {
            context.addErrors(contractFailure(context, transformer, logs, e));
            return;
        }
        merge(context, transformer, result);
    }

    private void merge(TransformContext context, Transformer transformer, TransformResult result) {
        List<Integer> conflicts = new ArrayList<>();
        for (MatchedTransfer matched : result.matchedTransfers().values()) {
            Signal signal = context.signals().get(matched.logIndex());
            if (!(signal instanceof TransferSignal) || context.isMatched(matched.logIndex())) {
                conflicts.add(matched.logIndex());
            }
        }
        for (Integer consumed : result.consumedSignals()) {
            Signal signal = context.signals().get(consumed);
            if (signal == null || signal instanceof TransferSignal || context.isConsumed(consumed)) {
                conflicts.add(consumed);
            }
        }
        context.addErrors(result.errors());
        if (!conflicts.isEmpty()) {
            log.warn("{} on {} tried to re-match signals {} in tx {}; dropping its {} events",
                    transformer.name(), transformer.contractAddress(), conflicts, context.txHash(),
                    result.events().size());
            Map<String, String> errorContext = new LinkedHashMap<>();
            errorContext.put("tx_hash", context.txHash());
            errorContext.put("log_indexes", conflicts.toString());
            ProcessingError error = ProcessingError.of(ErrorType.CONFLICTING_MATCH,
                    "Signals " + conflicts + " are already matched or consumed", context.txHash(), conflicts.get(0),
                    transformer.contractAddress(), transformer.name(), errorContext);
            context.addErrors(Map.of(error.errorId(), error));
            return;
        }
        result.matchedTransfers().keySet().forEach(context::matchTransfer);
        context.markSignalsConsumed(result.consumedSignals());
        context.removeEvents(result.removedEventIds());
        context.addEvents(result.events());
        context.addPositions(result.positions());
    }

    private Transformer transformerFor(String contract) {
        return registry.transformerFor(contract)
                .orElseThrow(() -> new IllegalStateException("No transformer registered for " + contract));
    }

    private Map<String, ProcessingError> contractFailure(TransformContext context, Transformer transformer,
                                                         List<DecodedLog> logs, RuntimeException e) {
        log.error("{} failed on contract {} in tx {}", transformer.name(), transformer.contractAddress(),
                context.txHash(), e);
        Map<String, ProcessingError> errors = new LinkedHashMap<>();
        for (DecodedLog decoded : logs) {
            Map<String, String> errorContext = new LinkedHashMap<>();
            errorContext.put("tx_hash", context.txHash());
            errorContext.put("log_name", decoded.name());
            errorContext.put("exception", e.getClass().getName());
            ProcessingError error = ProcessingError.of(ErrorType.PROCESSING_EXCEPTION,
                    transformer.name() + " raised " + e.getClass().getSimpleName() + ": " + e.getMessage(),
                    context.txHash(), decoded.index(), transformer.contractAddress(), transformer.name(), errorContext);
            errors.put(error.errorId(), error);
        }
        return errors;
    }
}
