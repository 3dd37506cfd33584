package com.chainindexer.ingestion.transform;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.domain.DomainEvent;
import com.chainindexer.domain.Position;
import com.chainindexer.domain.ProcessingError;
import com.chainindexer.domain.Signal;
import com.chainindexer.domain.Transaction;
import com.chainindexer.domain.Transfer;
import com.chainindexer.domain.TransferSignal;
import com.chainindexer.domain.TransformedTransaction;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Mutable workspace for one transaction. Owned by a single reconciliation run on a single thread and
 * discarded after {@link #finalizeToTransaction()}.
 * <p>
 * A transfer signal is unmatched until it lands in {@code matchedTransfers}; any other signal is pending until it
 * lands in {@code consumedSignals}. The two sets never share an index. The transfer index is cached per signal
 * generation and rebuilt lazily after signals change.
 */
@Slf4j
public class TransformContext {

    private final Transaction transaction;
    private final Map<Integer, Signal> signals = new TreeMap<>();
    private final Map<String, DomainEvent> events = new LinkedHashMap<>();
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final Map<String, ProcessingError> errors = new LinkedHashMap<>();
    private final Set<Integer> consumedSignals = new TreeSet<>();
    private final Set<Integer> matchedTransfers = new TreeSet<>();

    private ReconciliationPhase phase = ReconciliationPhase.EXTRACTING;
    private long signalGeneration;
    private TransferIndex transferIndex;

    public TransformContext(Transaction transaction) {
        this.transaction = Objects.requireNonNull(transaction, "transaction");
    }

    public Transaction transaction() {
        return transaction;
    }

    public String txHash() {
        return transaction.txHash();
    }

    public ReconciliationPhase phase() {
        return phase;
    }

    public void beginReconciliation() {
        if (phase != ReconciliationPhase.EXTRACTING) {
            throw new IllegalStateException("Cannot start reconciliation from phase " + phase + " for " + txHash());
        }
        phase = ReconciliationPhase.RECONCILING;
    }

    public void addSignals(Map<Integer, ? extends Signal> incoming) {
        requirePhase(ReconciliationPhase.EXTRACTING, "add signals");
        Objects.requireNonNull(incoming, "signals");
        incoming.forEach((index, signal) -> {
            if (index == null || signal == null) {
                throw new IllegalArgumentException("Null signal entry " + index + " -> " + signal);
            }
            if (index != signal.logIndex()) {
                throw new IllegalArgumentException("Signal key " + index + " does not match log index " + signal.logIndex());
            }
            Signal existing = signals.get(index);
            if (existing != null && !existing.equals(signal)) {
                throw new IllegalArgumentException("Log " + index + " already produced a different signal");
            }
        });
        signals.putAll(incoming);
        invalidate();
    }

    public void addEvents(Map<String, ? extends DomainEvent> incoming) {
        requireOpen("add events");
        Objects.requireNonNull(incoming, "events");
        incoming.forEach((id, event) -> {
            if (id == null || event == null) {
                throw new IllegalArgumentException("Null event entry " + id + " -> " + event);
            }
            if (event instanceof Position) {
                throw new IllegalArgumentException("Positions go through addPositions: " + id);
            }
            if (!id.equals(event.contentId())) {
                throw new IllegalArgumentException("Event key " + id + " is not its content id " + event.contentId());
            }
        });
        incoming.forEach((id, event) -> put(events, id, event));
        invalidate();
    }

    public void removeEvents(Collection<String> ids) {
        requireOpen("remove events");
        Objects.requireNonNull(ids, "ids");
        ids.forEach(events::remove);
        invalidate();
    }

    public void addPositions(Map<String, Position> incoming) {
        requireOpen("add positions");
        Objects.requireNonNull(incoming, "positions");
        incoming.forEach((id, position) -> {
            if (id == null || position == null || !id.equals(position.contentId())) {
                throw new IllegalArgumentException("Position key " + id + " does not match position " + position);
            }
        });
        incoming.forEach((id, position) -> put(positions, id, position));
        invalidate();
    }

    public void addErrors(Map<String, ProcessingError> incoming) {
        requireOpen("add errors");
        Objects.requireNonNull(incoming, "errors");
        incoming.forEach((id, error) -> {
            if (id == null || error == null || !id.equals(error.errorId())) {
                throw new IllegalArgumentException("Error key " + id + " does not match error " + error);
            }
        });
        errors.putAll(incoming);
        invalidate();
    }

    public void markSignalConsumed(int logIndex) {
        requireOpen("consume signal");
        Signal signal = signals.get(logIndex);
        if (signal == null) {
            throw new IllegalArgumentException("No signal at log " + logIndex);
        }
        if (signal instanceof TransferSignal) {
            throw new IllegalArgumentException("Transfer at log " + logIndex + " must be matched, not consumed");
        }
        consumedSignals.add(logIndex);
    }

    public void markSignalsConsumed(Collection<Integer> logIndexes) {
        logIndexes.forEach(this::markSignalConsumed);
    }

    public void matchTransfer(int logIndex) {
        requireOpen("match transfer");
        if (!(signals.get(logIndex) instanceof TransferSignal)) {
            throw new IllegalArgumentException("No transfer signal at log " + logIndex);
        }
        matchedTransfers.add(logIndex);
    }

    public Map<Integer, Signal> signals() {
        return Collections.unmodifiableMap(signals);
    }

    public Map<String, DomainEvent> events() {
        return Collections.unmodifiableMap(events);
    }

    public Map<String, Position> positions() {
        return Collections.unmodifiableMap(positions);
    }

    public Map<String, ProcessingError> errors() {
        return Collections.unmodifiableMap(errors);
    }

    public Set<Integer> consumedSignals() {
        return Collections.unmodifiableSet(consumedSignals);
    }

    public Set<Integer> matchedTransfers() {
        return Collections.unmodifiableSet(matchedTransfers);
    }

    public boolean isMatched(int logIndex) {
        return matchedTransfers.contains(logIndex);
    }

    public boolean isConsumed(int logIndex) {
        return consumedSignals.contains(logIndex);
    }

    public Map<Integer, TransferSignal> getUnmatchedTransfers() {
        Map<Integer, TransferSignal> out = new TreeMap<>();
        signals.forEach((index, signal) -> {
            if (signal instanceof TransferSignal transfer && !matchedTransfers.contains(index)) {
                out.put(index, transfer);
            }
        });
        return out;
    }

    public Map<Integer, Signal> getRemainingSignals() {
        Map<Integer, Signal> out = new TreeMap<>();
        signals.forEach((index, signal) -> {
            if (!matchedTransfers.contains(index) && !consumedSignals.contains(index)) {
                out.put(index, signal);
            }
        });
        return out;
    }

    public TransferLookup getContractTransfers(String contract) {
        return index().contract(EvmAddresses.normalize(contract), Set.of());
    }

    public TransferLookup getContractTransfersUnmatched(String contract) {
        return index().contract(EvmAddresses.normalize(contract), matchedTransfers);
    }

    public TransferLookup getTokenTransfers(String token) {
        return index().token(EvmAddresses.normalize(token), Set.of());
    }

    public TransferLookup getTokenTransfersUnmatched(String token) {
        return index().token(EvmAddresses.normalize(token), matchedTransfers);
    }

    /**
     * Turns every still-unmatched transfer into a plain {@link Transfer} event and freezes the result.
     * May be called once; the context rejects further mutation afterwards.
     */
    public TransformedTransaction finalizeToTransaction() {
        requireOpen("finalize");
        Map<String, DomainEvent> finalEvents = new LinkedHashMap<>(events);
        getUnmatchedTransfers().values().forEach(transfer -> {
            Transfer plain = Transfer.unmatched(transfer, txHash(), transaction.timestamp());
            finalEvents.put(plain.contentId(), plain);
        });
        phase = ReconciliationPhase.FINALIZED;
        return new TransformedTransaction(transaction, signals, finalEvents, positions, errors);
    }

    private TransferIndex index() {
        if (transferIndex == null || transferIndex.generation() != signalGeneration) {
            transferIndex = TransferIndex.build(signalGeneration, signals.values());
        }
        return transferIndex;
    }

    private void invalidate() {
        signalGeneration++;
    }

    private <T extends DomainEvent> void put(Map<String, T> target, String id, T value) {
        T existing = target.put(id, value);
        if (existing != null && !existing.identifyingFields().equals(value.identifyingFields())) {
            log.warn("Content id {} collision in tx {}: {} overwritten by {}", id, txHash(),
                    existing.eventType(), value.eventType());
        }
    }

    private void requirePhase(ReconciliationPhase expected, String action) {
        if (phase != expected) {
            throw new IllegalStateException("Cannot " + action + " in phase " + phase + " for " + txHash());
        }
    }

    private void requireOpen(String action) {
        if (phase == ReconciliationPhase.FINALIZED) {
            throw new IllegalStateException("Cannot " + action + " after finalization of " + txHash());
        }
    }
}
