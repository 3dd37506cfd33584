package com.chainindexer.ingestion.transformer;

/**
 * Plain ERC-20 token: only produces transfer signals.
 */
public class TokenTransformer extends AbstractTransformer {

    public TokenTransformer(String contractAddress) {
        super(contractAddress);
        onTransfer("Transfer", (log, tx) -> erc20Transfer(log, tx, "from", "to", "value", "amount"));
    }

    @Override
    public TransformerType type() {
        return TransformerType.TOKEN;
    }
}
