package com.chainindexer.ingestion.transformer;

import java.util.Map;

/**
 * Closed set of transformer variants selectable from configuration, with the default phase-1 and phase-2
 * priorities for the log names each one handles. Lower runs first; pools run before routers and wrappers
 * that consume pool output.
 */
public enum TransformerType {
    TOKEN(Map.of("Transfer", 0), Map.of()),
    WRAPPED_NATIVE(Map.of("Transfer", 0, "Deposit", 0, "Withdrawal", 0), Map.of()),
    CONSTANT_PRODUCT_POOL(Map.of("Transfer", 0),
            Map.of("Swap", 10, "Mint", 10, "Burn", 10, "Fees", 20, "Claim", 20)),
    BIN_POOL(Map.of("TransferBatch", 0, "TransferSingle", 0),
            Map.of("Swap", 10, "DepositedToBins", 10, "WithdrawnFromBins", 10)),
    ROUTER(Map.of("Swap", 5), Map.of("Swap", 50)),
    STAKING_WRAPPER(Map.of("Transfer", 0), Map.of("Deposit", 20, "Withdraw", 20)),
    FARM(Map.of(), Map.of("Deposit", 30, "Withdraw", 30, "EmergencyWithdraw", 30, "Harvest", 30)),
    AUCTION(Map.of(), Map.of("Purchase", 30));

    private final Map<String, Integer> defaultTransferPriorities;
    private final Map<String, Integer> defaultLogPriorities;

    TransformerType(Map<String, Integer> defaultTransferPriorities, Map<String, Integer> defaultLogPriorities) {
        this.defaultTransferPriorities = defaultTransferPriorities;
        this.defaultLogPriorities = defaultLogPriorities;
    }

    public Map<String, Integer> defaultTransferPriorities() {
        return defaultTransferPriorities;
    }

    public Map<String, Integer> defaultLogPriorities() {
        return defaultLogPriorities;
    }
}
