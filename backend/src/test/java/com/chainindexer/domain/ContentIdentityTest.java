package com.chainindexer.domain;

import com.chainindexer.common.EvmAddresses;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContentIdentityTest {

    private static final String TX = "0x" + "ab".repeat(32);
    private static final String TOKEN = "0x" + "a1".repeat(20);
    private static final String USER = "0x" + "11".repeat(20);
    private static final String POOL = "0x" + "c3".repeat(20);

    @Test
    @DisplayName("a transfer keeps its id whether it ends up matched or plain")
    void matchedAndPlainTransferShareId() {
        TransferSignal signal = new TransferSignal(TOKEN, USER, POOL, BigInteger.TEN, 2);

        MatchedTransfer matched = MatchedTransfer.promote(signal, TX);
        Transfer plain = Transfer.unmatched(signal, TX, Instant.parse("2025-01-15T10:00:00Z"));

        assertThat(plain.contentId()).isEqualTo(matched.contentId());
    }

    @Test
    void timestampIsNotPartOfIdentity() {
        TransferSignal signal = new TransferSignal(TOKEN, USER, POOL, BigInteger.TEN, 2);

        assertThat(Transfer.unmatched(signal, TX, Instant.EPOCH).contentId())
                .isEqualTo(Transfer.unmatched(signal, TX, Instant.now()).contentId());
    }

    @Test
    @DisplayName("identical transfers at different log indices stay distinct")
    void logIndexIsPartOfIdentity() {
        TransferSignal first = new TransferSignal(TOKEN, USER, POOL, BigInteger.TEN, 2);
        TransferSignal second = new TransferSignal(TOKEN, USER, POOL, BigInteger.TEN, 3);

        assertThat(MatchedTransfer.promote(first, TX).contentId())
                .isNotEqualTo(MatchedTransfer.promote(second, TX).contentId());
    }

    @Test
    void positionIdDependsOnReceiptId() {
        Position bin1 = new Position(Instant.EPOCH, TX, 4, POOL, USER, POOL, BigInteger.ONE,
                BigInteger.TEN, BigInteger.ONE, BigInteger.TWO);
        Position bin2 = new Position(Instant.EPOCH, TX, 4, POOL, USER, POOL, BigInteger.TWO,
                BigInteger.TEN, BigInteger.ONE, BigInteger.TWO);

        assertThat(bin1.contentId()).isNotEqualTo(bin2.contentId());
    }

    @Test
    void processingErrorId_isDeterministic() {
        ProcessingError a = ProcessingError.of(ErrorType.INVALID_SWAP, "no match", TX, 3, POOL, "X", Map.of("k", "v"));
        ProcessingError b = ProcessingError.of(ErrorType.INVALID_SWAP, "no match", TX, 3, POOL, "X", Map.of());
        ProcessingError c = ProcessingError.of(ErrorType.INVALID_SWAP, "no match", TX, 4, POOL, "X", Map.of());

        assertThat(a.errorId()).isEqualTo(b.errorId());
        assertThat(a.errorId()).isNotEqualTo(c.errorId());
        assertThat(a.errorType().code()).isEqualTo("invalid_swap");
    }

    @Test
    void zeroAddressMintIsTypedAsMint() {
        TransferSignal mint = new TransferSignal(POOL, EvmAddresses.ZERO_ADDRESS, USER, BigInteger.ONE, 1);

        assertThat(MatchedTransfer.promote(mint, TX).transferType()).isEqualTo(TransferType.MINT);
    }
}
