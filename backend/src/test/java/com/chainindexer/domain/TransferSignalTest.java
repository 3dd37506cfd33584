package com.chainindexer.domain;

import com.chainindexer.common.EvmAddresses;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransferSignalTest {

    private static final String TOKEN = "0x" + "a1".repeat(20);
    private static final String USER = "0x" + "11".repeat(20);

    @Test
    void transferType_followsZeroAddress() {
        assertThat(new TransferSignal(TOKEN, EvmAddresses.ZERO_ADDRESS, USER, BigInteger.ONE, 0).transferType())
                .isEqualTo(TransferType.MINT);
        assertThat(new TransferSignal(TOKEN, USER, EvmAddresses.ZERO_ADDRESS, BigInteger.ONE, 0).transferType())
                .isEqualTo(TransferType.BURN);
        assertThat(new TransferSignal(TOKEN, USER, TOKEN, BigInteger.ONE, 0).transferType())
                .isEqualTo(TransferType.TRANSFER);
    }

    @Test
    void negativeAmount_isRejected() {
        assertThatThrownBy(() -> new TransferSignal(TOKEN, USER, TOKEN, BigInteger.ONE.negate(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addressesAreLowercased_andBatchIsSorted() {
        TransferSignal signal = new TransferSignal(TOKEN.toUpperCase().replace("0X", "0x"), USER, TOKEN,
                BigInteger.TEN, 3, Map.of(BigInteger.TWO, BigInteger.ONE, BigInteger.ONE, BigInteger.valueOf(9)));

        assertThat(signal.token()).isEqualTo(TOKEN);
        assertThat(signal.hasBatch()).isTrue();
        assertThat(signal.batch().keySet()).containsExactly(BigInteger.ONE, BigInteger.TWO);
    }
}
