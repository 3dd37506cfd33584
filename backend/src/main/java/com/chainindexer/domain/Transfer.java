package com.chainindexer.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;

/**
 * Plain value movement no higher-level event claimed. Shares its identity with {@link MatchedTransfer},
 * so a transfer keeps the same id whether it ends up matched or not.
 */
public record Transfer(
        Instant timestamp,
        String txHash,
        int logIndex,
        String token,
        String fromAddress,
        String toAddress,
        BigInteger amount,
        TransferType transferType,
        Map<BigInteger, BigInteger> batch
) implements DomainEvent {

    public Transfer {
        batch = batch == null ? Map.of() : Map.copyOf(batch);
    }

    public static Transfer unmatched(TransferSignal signal, String txHash, Instant timestamp) {
        return new Transfer(timestamp, txHash, signal.logIndex(), signal.token(), signal.fromAddress(),
                signal.toAddress(), signal.amount(), signal.transferType(), signal.batch());
    }

    @Override
    public EventType eventType() {
        return EventType.TRANSFER;
    }

    @Override
    public Map<String, Object> identifyingFields() {
        return new MatchedTransfer(txHash, logIndex, token, fromAddress, toAddress, amount, transferType, batch)
                .identifyingFields();
    }
}
