package com.chainindexer.ingestion.transformer;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.ErrorType;
import com.chainindexer.domain.Staking;
import com.chainindexer.domain.StakingAction;
import com.chainindexer.domain.TransferSignal;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Vault-style staking wrapper (ERC-4626 events): the underlying token goes in, shares of this contract come out.
 * The share token's own transfers are extracted here as well.
 */
public class StakingWrapperTransformer extends AbstractTransformer {

    private final String underlyingToken;

    public StakingWrapperTransformer(String contractAddress, String underlyingToken) {
        super(contractAddress);
        if (!EvmAddresses.isValid(underlyingToken)) {
            throw new IllegalArgumentException("Invalid underlying token for " + contractAddress + ": " + underlyingToken);
        }
        this.underlyingToken = EvmAddresses.normalize(underlyingToken);
        onTransfer("Transfer", (log, tx) -> erc20Transfer(log, tx, "from", "to", "value", "amount"));
        onLog("Deposit", this::deposit);
        onLog("Withdraw", this::withdraw);
    }

    @Override
    public TransformerType type() {
        return TransformerType.STAKING_WRAPPER;
    }

    private LogOutcome deposit(DecodedLog log, TransferPool pool) {
        LogAttributes attributes = LogAttributes.of(log);
        String owner = attributes.address("owner");
        BigInteger assets = attributes.integer("assets");
        BigInteger shares = attributes.integer("shares");
        if (attributes.hasMissing()) {
            return missing(attributes, pool, log);
        }
        List<TransferSignal> matched = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        requireExact(pool.into(underlyingToken), assets, "underlying deposit", matched, problems);
        requireExact(pool.mints(contractAddress).stream().filter(t -> t.toAddress().equals(owner)).toList(),
                shares, "share mint", matched, problems);
        if (!problems.isEmpty()) {
            return fail(ErrorType.INVALID_STAKING, "Deposit rejected: " + String.join("; ", problems), pool, log);
        }
        return staking(log, pool, owner, assets, shares, StakingAction.DEPOSIT, matched);
    }

    private LogOutcome withdraw(DecodedLog log, TransferPool pool) {
        LogAttributes attributes = LogAttributes.of(log);
        String receiver = attributes.address("receiver");
        String owner = attributes.address("owner");
        BigInteger assets = attributes.integer("assets");
        BigInteger shares = attributes.integer("shares");
        if (attributes.hasMissing()) {
            return missing(attributes, pool, log);
        }
        List<TransferSignal> matched = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        requireExact(pool.burns(contractAddress).stream().filter(t -> t.fromAddress().equals(owner)).toList(),
                shares, "share burn", matched, problems);
        requireExact(pool.outOf(underlyingToken).stream().filter(t -> t.toAddress().equals(receiver)).toList(),
                assets, "underlying withdrawal", matched, problems);
        if (!problems.isEmpty()) {
            return fail(ErrorType.INVALID_STAKING, "Withdraw rejected: " + String.join("; ", problems), pool, log);
        }
        return staking(log, pool, owner, assets, shares, StakingAction.WITHDRAW, matched);
    }

    private LogOutcome staking(DecodedLog log, TransferPool pool, String staker, BigInteger assets, BigInteger shares,
                               StakingAction action, List<TransferSignal> matched) {
        Staking staking = new Staking(pool.timestamp(), pool.txHash(), log.index(), contractAddress, staker,
                underlyingToken, assets, contractAddress, shares, action, pool.promote(matched));
        return LogOutcome.success().matched(matched).event(staking).build();
    }
}
