package com.chainindexer.domain;

import com.chainindexer.common.ContentIdGenerator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Recorded failure of one log (or one contract) during transformation. The id is content-addressed so a
 * replayed transaction reports the same error under the same id.
 */
public record ProcessingError(
        String errorId,
        ErrorType errorType,
        String message,
        String txHash,
        Integer logIndex,
        String contract,
        String transformerName,
        Map<String, String> context
) {

    public static final String STAGE = "transform";

    public ProcessingError {
        Objects.requireNonNull(errorId, "errorId");
        Objects.requireNonNull(errorType, "errorType");
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static ProcessingError of(ErrorType type, String message, String txHash, Integer logIndex,
                                     String contract, String transformerName, Map<String, String> context) {
        Map<String, Object> identity = new LinkedHashMap<>();
        identity.put("stage", STAGE);
        identity.put("error_type", type.code());
        identity.put("message", message);
        identity.put("tx_hash", txHash);
        identity.put("log_index", logIndex);
        identity.put("contract", contract);
        identity.put("transformer_name", transformerName);
        return new ProcessingError(ContentIdGenerator.generate(identity), type, message, txHash, logIndex,
                contract, transformerName, context);
    }
}
