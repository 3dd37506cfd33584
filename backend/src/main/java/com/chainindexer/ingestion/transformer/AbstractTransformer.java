package com.chainindexer.ingestion.transformer;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.ErrorType;
import com.chainindexer.domain.ProcessingError;
import com.chainindexer.domain.Signal;
import com.chainindexer.domain.Transaction;
import com.chainindexer.domain.TransferSignal;
import com.chainindexer.ingestion.transform.SignalExtraction;
import com.chainindexer.ingestion.transform.TransformContext;
import com.chainindexer.ingestion.transform.TransformResult;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Dispatches logs by event name to handlers registered by subclasses. Each log either succeeds as a whole or
 * yields exactly one ProcessingError; exceptions from a handler become processing_exception errors.
 */
@Slf4j
public abstract class AbstractTransformer implements Transformer {

    protected final String contractAddress;

    private final Map<String, TransferHandler> transferHandlers = new HashMap<>();
    private final Map<String, LogHandler> logHandlers = new HashMap<>();
    private final Map<String, GroupHandler> groupHandlers = new HashMap<>();
    private final Map<String, Function<DecodedLog, Object>> groupKeys = new HashMap<>();

    protected AbstractTransformer(String contractAddress) {
        if (!EvmAddresses.isValid(contractAddress)) {
            throw new IllegalArgumentException("Invalid contract address: " + contractAddress);
        }
        this.contractAddress = EvmAddresses.normalize(contractAddress);
    }

    @FunctionalInterface
    interface TransferHandler {
        Extracted extract(DecodedLog log, Transaction tx);
    }

    @FunctionalInterface
    interface LogHandler {
        LogOutcome handle(DecodedLog log, TransferPool pool);
    }

    @FunctionalInterface
    interface GroupHandler {
        LogOutcome handle(List<DecodedLog> logs, TransferPool pool);
    }

    @Override
    public String contractAddress() {
        return contractAddress;
    }

    void onTransfer(String logName, TransferHandler handler) {
        transferHandlers.put(logName, handler);
    }

    void onLog(String logName, LogHandler handler) {
        logHandlers.put(logName, handler);
    }

    /**
     * Logs named {@code logName} are handed over together, one call per distinct {@code key}, in order of
     * each group's first log.
     */
    void onLogGroup(String logName, Function<DecodedLog, Object> key, GroupHandler handler) {
        groupKeys.put(logName, key);
        groupHandlers.put(logName, handler);
    }

    @Override
    public SignalExtraction processTransfers(List<DecodedLog> logs, Transaction tx) {
        Map<Integer, Signal> signals = new TreeMap<>();
        Map<String, ProcessingError> errors = new LinkedHashMap<>();
        for (DecodedLog decoded : ordered(logs)) {
            TransferHandler handler = transferHandlers.get(decoded.name());
            if (handler == null) {
                continue;
            }
            Extracted extracted;
            try {
                extracted = handler.extract(decoded, tx);
            } catch (RuntimeException e) {
                extracted = Extracted.failure(exceptionError(tx.txHash(), decoded, e));
            }
            if (extracted.error() != null) {
                errors.put(extracted.error().errorId(), extracted.error());
            } else if (extracted.signal() != null) {
                signals.put(decoded.index(), extracted.signal());
            }
        }
        return new SignalExtraction(signals, errors);
    }

    @Override
    public TransformResult processLogs(List<DecodedLog> logs, TransformContext context) {
        TransferPool pool = new TransferPool(context, contractAddress);
        TransformResult.Builder result = TransformResult.builder();
        for (Unit unit : plan(logs)) {
            LogOutcome outcome;
            try {
                outcome = unit.run(pool);
            } catch (RuntimeException e) {
                outcome = LogOutcome.failure(exceptionError(context.txHash(), unit.first(), e));
            }
            if (outcome.isFailure()) {
                ProcessingError error = outcome.error();
                log.warn("{} {} at log {} of tx {} on {}: {}", name(), error.errorType().code(), error.logIndex(),
                        context.txHash(), contractAddress, error.message());
                result.error(error);
                continue;
            }
            pool.claim(outcome);
            outcome.applyTo(result, context.txHash());
        }
        return result.build();
    }

    private List<Unit> plan(List<DecodedLog> logs) {
        List<Unit> units = new ArrayList<>();
        Map<String, Map<Object, List<DecodedLog>>> groups = new LinkedHashMap<>();
        for (DecodedLog decoded : ordered(logs)) {
            if (groupHandlers.containsKey(decoded.name())) {
                Object key = groupKeys.get(decoded.name()).apply(decoded);
                List<DecodedLog> members = groups
                        .computeIfAbsent(decoded.name(), n -> new LinkedHashMap<>())
                        .get(key);
                if (members == null) {
                    members = new ArrayList<>();
                    groups.get(decoded.name()).put(key, members);
                    units.add(new Unit(groupHandlers.get(decoded.name()), null, members));
                }
                members.add(decoded);
            } else if (logHandlers.containsKey(decoded.name())) {
                units.add(new Unit(null, logHandlers.get(decoded.name()), List.of(decoded)));
            }
        }
        return units;
    }

    private static List<DecodedLog> ordered(List<DecodedLog> logs) {
        return logs.stream().sorted(Comparator.comparingInt(DecodedLog::index)).toList();
    }

    private record Unit(GroupHandler group, LogHandler single, List<DecodedLog> logs) {

        DecodedLog first() {
            return logs.get(0);
        }

        LogOutcome run(TransferPool pool) {
            return group != null ? group.handle(logs, pool) : single.handle(first(), pool);
        }
    }

    ProcessingError error(ErrorType type, String message, String txHash, DecodedLog decoded) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("log_name", decoded.name());
        context.put("tx_hash", txHash);
        return ProcessingError.of(type, message, txHash, decoded.index(), contractAddress, name(), context);
    }

    LogOutcome fail(ErrorType type, String message, TransferPool pool, DecodedLog decoded) {
        return LogOutcome.failure(error(type, message, pool.txHash(), decoded));
    }

    LogOutcome missing(LogAttributes attributes, TransferPool pool, DecodedLog decoded) {
        return fail(ErrorType.MISSING_ATTRIBUTES, "Missing attributes " + attributes.missing() + " on " + decoded.name(),
                pool, decoded);
    }

    Extracted missing(LogAttributes attributes, Transaction tx, DecodedLog decoded) {
        return Extracted.failure(error(ErrorType.MISSING_ATTRIBUTES,
                "Missing attributes " + attributes.missing() + " on " + decoded.name(), tx.txHash(), decoded));
    }

    private ProcessingError exceptionError(String txHash, DecodedLog decoded, RuntimeException e) {
        log.error("{} failed on {} log {} of tx {}", name(), decoded.name(), decoded.index(), txHash, e);
        Map<String, String> context = new LinkedHashMap<>();
        context.put("log_name", decoded.name());
        context.put("tx_hash", txHash);
        context.put("exception", e.getClass().getName());
        String message = name() + " raised " + e.getClass().getSimpleName() + ": " + Objects.toString(e.getMessage(), "");
        return ProcessingError.of(ErrorType.PROCESSING_EXCEPTION, message, txHash, decoded.index(), contractAddress,
                name(), context);
    }

    /**
     * ERC-20 style {@code Transfer(from, to, value)} as a signal issued by this contract. Zero-amount transfers
     * are dropped.
     */
    Extracted erc20Transfer(DecodedLog decoded, Transaction tx, String fromKey, String toKey, String... amountKeys) {
        LogAttributes attributes = LogAttributes.of(decoded);
        String from = attributes.address(fromKey);
        String to = attributes.address(toKey);
        BigInteger amount = attributes.integer(amountKeys);
        if (attributes.hasMissing()) {
            return missing(attributes, tx, decoded);
        }
        if (amount.signum() == 0) {
            return Extracted.none();
        }
        return Extracted.of(new TransferSignal(contractAddress, from, to, amount, decoded.index()));
    }

    /**
     * Adds the single candidate carrying exactly {@code amount} to {@code matched}, or records why it could not.
     * A zero amount needs no transfer.
     */
    static void requireExact(List<TransferSignal> candidates, BigInteger amount, String leg,
                             List<TransferSignal> matched, List<String> problems) {
        if (amount.signum() == 0) {
            return;
        }
        Optional<TransferSignal> transfer = TransferPool.exactlyOne(candidates, amount);
        if (transfer.isPresent()) {
            matched.add(transfer.get());
        } else {
            problems.add("expected exactly one " + leg + " of " + amount + ", candidates " + describe(candidates));
        }
    }

    static String describe(List<TransferSignal> candidates) {
        return candidates.stream().map(t -> t.amount() + "@" + t.logIndex()).toList().toString();
    }
}
