package com.chainindexer;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.LogValue;
import com.chainindexer.domain.Transaction;
import com.chainindexer.domain.TransactionLog;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for decoded logs and transactions used across engine and transformer tests.
 */
public final class TestLogs {

    public static final Instant TS = Instant.parse("2025-01-15T10:00:00Z");
    public static final String TX_HASH = "0x" + "ab".repeat(32);
    public static final long BLOCK = 1_000L;
    public static final String ZERO = EvmAddresses.ZERO_ADDRESS;

    private TestLogs() {
    }

    public static String addr(int n) {
        return String.format("0x%040x", n);
    }

    public static String txHash(int n) {
        return String.format("0x%064x", n);
    }

    /**
     * Attributes as name/value pairs. Strings become addresses, numbers integers, byte arrays bytes and lists
     * arrays; LogValue instances pass through.
     */
    public static DecodedLog log(int index, String contract, String name, Object... kv) {
        Map<String, LogValue> attributes = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            attributes.put((String) kv[i], value(kv[i + 1]));
        }
        return new DecodedLog(index, contract, name + "(...)", name, attributes);
    }

    public static DecodedLog erc20(int index, String token, String from, String to, long amount) {
        return log(index, token, "Transfer", "from", from, "to", to, "value", amount);
    }

    public static Transaction tx(TransactionLog... logs) {
        return tx(TX_HASH, BLOCK, true, logs);
    }

    public static Transaction tx(String hash, long block, boolean success, TransactionLog... logs) {
        Map<Integer, TransactionLog> byIndex = new LinkedHashMap<>();
        for (TransactionLog log : logs) {
            byIndex.put(log.index(), log);
        }
        return new Transaction(hash, block, TS, addr(0x11), addr(0x99), BigInteger.ZERO, success, byIndex);
    }

    private static LogValue value(Object value) {
        if (value instanceof LogValue logValue) {
            return logValue;
        }
        if (value instanceof String s) {
            return LogValue.address(s);
        }
        if (value instanceof BigInteger big) {
            return LogValue.integer(big);
        }
        if (value instanceof Number number) {
            return LogValue.integer(number.longValue());
        }
        if (value instanceof byte[] bytes) {
            return LogValue.bytes(bytes);
        }
        if (value instanceof Boolean bool) {
            return LogValue.bool(bool);
        }
        if (value instanceof List<?> list) {
            return LogValue.array(list.stream().map(TestLogs::value).toList());
        }
        throw new IllegalArgumentException("Unsupported attribute value " + value);
    }
}
