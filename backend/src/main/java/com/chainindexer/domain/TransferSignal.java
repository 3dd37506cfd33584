package com.chainindexer.domain;

import com.chainindexer.common.EvmAddresses;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One raw value movement. Batch transfers (multi-id tokens) carry the per-id breakdown in {@code batch};
 * {@code amount} is then the sum over all ids.
 */
public record TransferSignal(
        String token,
        String fromAddress,
        String toAddress,
        BigInteger amount,
        int logIndex,
        Map<BigInteger, BigInteger> batch
) implements Signal {

    public TransferSignal {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(fromAddress, "fromAddress");
        Objects.requireNonNull(toAddress, "toAddress");
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Transfer amount must not be negative: " + amount + " at log " + logIndex);
        }
        token = EvmAddresses.normalize(token);
        fromAddress = EvmAddresses.normalize(fromAddress);
        toAddress = EvmAddresses.normalize(toAddress);
        batch = batch == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(batch));
    }

    public TransferSignal(String token, String fromAddress, String toAddress, BigInteger amount, int logIndex) {
        this(token, fromAddress, toAddress, amount, logIndex, Map.of());
    }

    public boolean hasBatch() {
        return !batch.isEmpty();
    }

    public TransferType transferType() {
        if (EvmAddresses.isZero(fromAddress)) {
            return TransferType.MINT;
        }
        if (EvmAddresses.isZero(toAddress)) {
            return TransferType.BURN;
        }
        return TransferType.TRANSFER;
    }
}
