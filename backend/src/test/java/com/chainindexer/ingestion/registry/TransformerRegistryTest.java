package com.chainindexer.ingestion.registry;

import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.Transaction;
import com.chainindexer.ingestion.transformer.ConstantProductPoolTransformer;
import com.chainindexer.ingestion.transformer.RouterTransformer;
import com.chainindexer.ingestion.transformer.TokenTransformer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static com.chainindexer.TestLogs.addr;
import static com.chainindexer.TestLogs.erc20;
import static com.chainindexer.TestLogs.log;
import static com.chainindexer.TestLogs.tx;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformerRegistryTest {

    private static final String TOKEN_A = addr(0xA1);
    private static final String TOKEN_B = addr(0xB2);
    private static final String POOL = addr(0xC3);
    private static final String ROUTER = addr(0xD4);
    private static final String UNKNOWN = addr(0xEE);
    private static final String USER = addr(0x11);

    private TransformerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TransformerRegistry();
        registry.registerContract(TOKEN_B, new TokenTransformer(TOKEN_B), Map.of("Transfer", 0), Map.of());
        registry.registerContract(TOKEN_A, new TokenTransformer(TOKEN_A), Map.of("Transfer", 0), Map.of());
        registry.registerContract(POOL, new ConstantProductPoolTransformer(POOL, TOKEN_A, TOKEN_B, TOKEN_A, null),
                Map.of("Transfer", 0), Map.of("Mint", 10, "Swap", 10));
        registry.registerContract(ROUTER, new RouterTransformer(ROUTER, List.of(TOKEN_B)),
                Map.of("Swap", 5), Map.of("Swap", 50));
    }

    @Test
    @DisplayName("transfer logs are grouped by priority, then contract address, then log index")
    void getTransfersOrdered_groupsDeterministically() {
        Transaction tx = tx(
                erc20(4, TOKEN_B, USER, POOL, 1),
                erc20(1, TOKEN_A, USER, POOL, 1),
                log(3, ROUTER, "Swap", "sender", USER),
                erc20(0, TOKEN_B, POOL, USER, 1),
                erc20(2, UNKNOWN, USER, POOL, 1));

        SortedMap<Integer, Map<String, List<DecodedLog>>> ordered = registry.getTransfersOrdered(tx);

        assertThat(ordered.keySet()).containsExactly(0, 5);
        assertThat(ordered.get(0).keySet()).containsExactly(TOKEN_A, TOKEN_B);
        assertThat(ordered.get(0).get(TOKEN_B)).extracting(DecodedLog::index).containsExactly(0, 4);
        assertThat(ordered.get(5).get(ROUTER)).extracting(DecodedLog::index).containsExactly(3);
    }

    @Test
    void getRemainingLogsOrdered_usesLogPriorities() {
        Transaction tx = tx(
                log(5, ROUTER, "Swap", "sender", USER),
                log(2, POOL, "Swap", "sender", USER),
                log(1, POOL, "Sync", "reserve0", 1),
                erc20(0, TOKEN_A, USER, POOL, 1));

        SortedMap<Integer, Map<String, List<DecodedLog>>> ordered = registry.getRemainingLogsOrdered(tx);

        assertThat(ordered.keySet()).containsExactly(10, 50);
        assertThat(ordered.get(10).get(POOL)).extracting(DecodedLog::index).containsExactly(2);
    }

    @Test
    void transformerFor_isCaseInsensitive() {
        assertThat(registry.transformerFor(POOL.toUpperCase().replace("0X", "0x"))).isPresent();
        assertThat(registry.transformerFor(UNKNOWN)).isEmpty();
    }

    @Test
    void registerContract_rejectsDuplicates() {
        assertThatThrownBy(() -> registry.registerContract(TOKEN_A, new TokenTransformer(TOKEN_A),
                Map.of("Transfer", 0), Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already registered");
    }

    @Test
    void registerContract_rejectsMismatchedAddress() {
        assertThatThrownBy(() -> registry.registerContract(UNKNOWN, new TokenTransformer(addr(0xEF)),
                Map.of(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
