package com.chainindexer.domain;

import com.chainindexer.common.EvmAddresses;

import java.util.List;
import java.util.Objects;

/**
 * Log from a contract the decoder has no ABI for. Carried through untouched; the engine ignores it.
 */
public record EncodedLog(int index, String contract, List<String> topics, String data) implements TransactionLog {

    public EncodedLog {
        Objects.requireNonNull(contract, "contract");
        contract = EvmAddresses.normalize(contract);
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
