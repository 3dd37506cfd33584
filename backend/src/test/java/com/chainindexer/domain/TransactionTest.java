package com.chainindexer.domain;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionTest {

    private static final String CONTRACT = "0x" + "c3".repeat(20);

    @Test
    void decodedLogs_skipsEncodedLogsAndKeepsIndexOrder() {
        Map<Integer, TransactionLog> logs = new LinkedHashMap<>();
        logs.put(5, new DecodedLog(5, CONTRACT, "B()", "B", Map.of()));
        logs.put(1, new EncodedLog(1, CONTRACT, List.of("0xtopic"), "0x"));
        logs.put(2, new DecodedLog(2, CONTRACT, "A()", "A", Map.of()));

        Transaction tx = new Transaction("0xABC", 1L, Instant.EPOCH, null, null, null, true, logs);

        assertThat(tx.txHash()).isEqualTo("0xabc");
        assertThat(tx.value()).isEqualTo(BigInteger.ZERO);
        assertThat(tx.logs().keySet()).containsExactly(1, 2, 5);
        assertThat(tx.decodedLogs()).extracting(DecodedLog::name).containsExactly("A", "B");
    }

    @Test
    void logKeyMustMatchLogIndex() {
        Map<Integer, TransactionLog> logs = Map.of(3, new DecodedLog(4, CONTRACT, "A()", "A", Map.of()));

        assertThatThrownBy(() -> new Transaction("0xabc", 1L, Instant.EPOCH, null, null, null, true, logs))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
