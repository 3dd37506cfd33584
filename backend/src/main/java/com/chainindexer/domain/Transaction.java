package com.chainindexer.domain;

import com.chainindexer.common.EvmAddresses;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Transaction metadata plus its logs keyed by log index, as handed over by the decoder.
 */
public record Transaction(
        String txHash,
        long blockNumber,
        Instant timestamp,
        String originFrom,
        String originTo,
        BigInteger value,
        boolean txSuccess,
        Map<Integer, TransactionLog> logs
) {

    public Transaction {
        Objects.requireNonNull(txHash, "txHash");
        Objects.requireNonNull(timestamp, "timestamp");
        txHash = txHash.toLowerCase();
        originFrom = EvmAddresses.normalize(originFrom);
        originTo = EvmAddresses.normalize(originTo);
        value = value == null ? BigInteger.ZERO : value;
        TreeMap<Integer, TransactionLog> ordered = new TreeMap<>();
        if (logs != null) {
            logs.forEach((index, log) -> {
                if (index == null || log == null || index != log.index()) {
                    throw new IllegalArgumentException("Log map key " + index + " does not match log " + log);
                }
                ordered.put(index, log);
            });
        }
        logs = Collections.unmodifiableMap(ordered);
    }

    /**
     * Decoded logs in log-index order.
     */
    public List<DecodedLog> decodedLogs() {
        return logs.values().stream()
                .filter(DecodedLog.class::isInstance)
                .map(DecodedLog.class::cast)
                .toList();
    }
}
