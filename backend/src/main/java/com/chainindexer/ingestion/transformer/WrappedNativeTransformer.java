package com.chainindexer.ingestion.transformer;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.Transaction;
import com.chainindexer.domain.TransferSignal;

import java.math.BigInteger;

/**
 * WETH/WAVAX style wrapper. Uses the {@code src, dst, wad} attribute names; wrapping is a mint from the zero
 * address and unwrapping a burn to it, so pools and routers can match them like any other transfer.
 */
public class WrappedNativeTransformer extends AbstractTransformer {

    public WrappedNativeTransformer(String contractAddress) {
        super(contractAddress);
        onTransfer("Transfer", (log, tx) -> erc20Transfer(log, tx, "src", "dst", "wad"));
        onTransfer("Deposit", (log, tx) -> wrap(log, tx, true));
        onTransfer("Withdrawal", (log, tx) -> wrap(log, tx, false));
    }

    @Override
    public TransformerType type() {
        return TransformerType.WRAPPED_NATIVE;
    }

    private Extracted wrap(DecodedLog log, Transaction tx, boolean deposit) {
        LogAttributes attributes = LogAttributes.of(log);
        String account = attributes.address(deposit ? "dst" : "src");
        BigInteger amount = attributes.integer("wad");
        if (attributes.hasMissing()) {
            return missing(attributes, tx, log);
        }
        if (amount.signum() == 0) {
            return Extracted.none();
        }
        String from = deposit ? EvmAddresses.ZERO_ADDRESS : account;
        String to = deposit ? account : EvmAddresses.ZERO_ADDRESS;
        return Extracted.of(new TransferSignal(contractAddress, from, to, amount, log.index()));
    }
}
