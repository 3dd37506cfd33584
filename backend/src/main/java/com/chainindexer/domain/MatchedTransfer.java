package com.chainindexer.domain;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A transfer signal after exactly one event has consumed it. Immutable; lives inside the consuming event.
 */
public record MatchedTransfer(
        String txHash,
        int logIndex,
        String token,
        String fromAddress,
        String toAddress,
        BigInteger amount,
        TransferType transferType,
        Map<BigInteger, BigInteger> batch
) implements ContentAddressable {

    public MatchedTransfer {
        batch = batch == null ? Map.of() : Map.copyOf(batch);
    }

    public static MatchedTransfer promote(TransferSignal signal, String txHash) {
        return new MatchedTransfer(txHash, signal.logIndex(), signal.token(), signal.fromAddress(),
                signal.toAddress(), signal.amount(), signal.transferType(), signal.batch());
    }

    @Override
    public Map<String, Object> identifyingFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event_type", "transfer");
        fields.put("tx_hash", txHash);
        fields.put("log_index", logIndex);
        fields.put("token", token);
        fields.put("from_address", fromAddress);
        fields.put("to_address", toAddress);
        fields.put("amount", amount);
        fields.put("transfer_type", transferType);
        return fields;
    }
}
