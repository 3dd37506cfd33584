package com.chainindexer.ingestion.transformer;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.domain.DomainEvent;
import com.chainindexer.domain.MatchedTransfer;
import com.chainindexer.domain.Signal;
import com.chainindexer.domain.Transaction;
import com.chainindexer.domain.TransferSignal;
import com.chainindexer.ingestion.transform.TransformContext;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only window on the context's unmatched transfers for one processLogs call. Transfers, signals and
 * events claimed by an earlier log of the same call are hidden, so two logs never take the same transfer
 * before the engine merges the result.
 */
final class TransferPool {

    private final TransformContext context;
    private final String contract;
    private final Set<Integer> claimedTransfers = new HashSet<>();
    private final Set<Integer> claimedSignals = new HashSet<>();
    private final Set<String> claimedEvents = new HashSet<>();

    TransferPool(TransformContext context, String contract) {
        this.context = context;
        this.contract = EvmAddresses.normalize(contract);
    }

    String txHash() {
        return context.txHash();
    }

    Instant timestamp() {
        return context.transaction().timestamp();
    }

    Transaction transaction() {
        return context.transaction();
    }

    /** Unmatched transfers of {@code token} into this contract. */
    List<TransferSignal> into(String token) {
        return available(context.getContractTransfersUnmatched(contract).in(EvmAddresses.normalize(token)).values());
    }

    /** Unmatched transfers of {@code token} out of this contract. */
    List<TransferSignal> outOf(String token) {
        return available(context.getContractTransfersUnmatched(contract).out(EvmAddresses.normalize(token)).values());
    }

    /** Unmatched transfers of {@code token} received by {@code recipient}. */
    List<TransferSignal> receivedBy(String token, String recipient) {
        return available(context.getTokenTransfersUnmatched(token).in(EvmAddresses.normalize(recipient)).values());
    }

    /** Unmatched transfers of {@code token} sent by {@code sender}. */
    List<TransferSignal> sentBy(String token, String sender) {
        return available(context.getTokenTransfersUnmatched(token).out(EvmAddresses.normalize(sender)).values());
    }

    List<TransferSignal> mints(String token) {
        return sentBy(token, EvmAddresses.ZERO_ADDRESS);
    }

    List<TransferSignal> burns(String token) {
        return receivedBy(token, EvmAddresses.ZERO_ADDRESS);
    }

    /** Non-transfer signal at {@code logIndex} that nobody has consumed yet. */
    <T extends Signal> Optional<T> pendingSignal(int logIndex, Class<T> type) {
        if (claimedSignals.contains(logIndex) || context.isConsumed(logIndex)) {
            return Optional.empty();
        }
        return Optional.ofNullable(context.signals().get(logIndex)).filter(type::isInstance).map(type::cast);
    }

    /** Events already in the context of the given type, in insertion order, minus those claimed in this call. */
    <T extends DomainEvent> List<T> events(Class<T> type) {
        return context.events().entrySet().stream()
                .filter(e -> !claimedEvents.contains(e.getKey()))
                .map(Map.Entry::getValue)
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    Map<String, MatchedTransfer> promote(Collection<TransferSignal> transfers) {
        Map<String, MatchedTransfer> out = new LinkedHashMap<>();
        for (TransferSignal transfer : transfers) {
            MatchedTransfer matched = MatchedTransfer.promote(transfer, txHash());
            out.put(matched.contentId(), matched);
        }
        return out;
    }

    void claim(LogOutcome outcome) {
        outcome.matched().forEach(t -> claimedTransfers.add(t.logIndex()));
        claimedSignals.addAll(outcome.consumedSignals());
        claimedEvents.addAll(outcome.removedEventIds());
    }

    private List<TransferSignal> available(Collection<TransferSignal> candidates) {
        return candidates.stream().filter(t -> !claimedTransfers.contains(t.logIndex())).toList();
    }

    /**
     * The single candidate carrying exactly {@code amount}; empty when there are none or several.
     */
    static Optional<TransferSignal> exactlyOne(List<TransferSignal> candidates, BigInteger amount) {
        List<TransferSignal> exact = candidates.stream().filter(t -> t.amount().equals(amount)).toList();
        return exact.size() == 1 ? Optional.of(exact.get(0)) : Optional.empty();
    }
}
