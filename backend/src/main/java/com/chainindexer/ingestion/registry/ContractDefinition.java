package com.chainindexer.ingestion.registry;

import com.chainindexer.ingestion.transformer.TransformerType;

import java.util.Map;

/**
 * One configured contract: which transformer variant to build, its constructor parameters and, when given,
 * priority overrides for its phase-1 and phase-2 log names.
 */
public record ContractDefinition(
        String address,
        TransformerType type,
        Map<String, String> params,
        Map<String, Integer> transferPriorities,
        Map<String, Integer> logPriorities
) {

    public ContractDefinition {
        params = params == null ? Map.of() : Map.copyOf(params);
        transferPriorities = transferPriorities == null ? Map.of() : Map.copyOf(transferPriorities);
        logPriorities = logPriorities == null ? Map.of() : Map.copyOf(logPriorities);
    }

    public Map<String, Integer> effectiveTransferPriorities() {
        return transferPriorities.isEmpty() && type != null ? type.defaultTransferPriorities() : transferPriorities;
    }

    public Map<String, Integer> effectiveLogPriorities() {
        return logPriorities.isEmpty() && type != null ? type.defaultLogPriorities() : logPriorities;
    }
}
