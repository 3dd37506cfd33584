package com.chainindexer.ingestion.transformer;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.ErrorType;
import com.chainindexer.domain.Reward;
import com.chainindexer.domain.RewardType;
import com.chainindexer.domain.Staking;
import com.chainindexer.domain.StakingAction;
import com.chainindexer.domain.TransferSignal;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MasterChef-style farm. Stakes are keyed by pool id; each pid maps to a staked token, falling back to a single
 * default deposit token. The farm issues no receipt token. Zero-amount deposits only trigger a harvest and
 * produce no Staking event.
 */
public class FarmTransformer extends AbstractTransformer {

    private final String defaultDepositToken;
    private final Map<BigInteger, String> poolTokens;
    private final String rewardToken;

    public FarmTransformer(String contractAddress, String defaultDepositToken, Map<BigInteger, String> poolTokens,
                           String rewardToken) {
        super(contractAddress);
        this.defaultDepositToken = EvmAddresses.normalize(defaultDepositToken);
        this.poolTokens = new HashMap<>();
        poolTokens.forEach((pid, token) -> this.poolTokens.put(pid, EvmAddresses.normalize(token)));
        this.rewardToken = EvmAddresses.normalize(rewardToken);
        onLog("Deposit", (log, pool) -> stake(log, pool, StakingAction.DEPOSIT));
        onLog("Withdraw", (log, pool) -> stake(log, pool, StakingAction.WITHDRAW));
        onLog("EmergencyWithdraw", (log, pool) -> stake(log, pool, StakingAction.WITHDRAW));
        onLog("Harvest", this::harvest);
    }

    @Override
    public TransformerType type() {
        return TransformerType.FARM;
    }

    private LogOutcome stake(DecodedLog log, TransferPool pool, StakingAction action) {
        LogAttributes attributes = LogAttributes.of(log);
        String user = attributes.address("user");
        BigInteger pid = attributes.integer("pid");
        BigInteger amount = attributes.integer("amount");
        if (attributes.hasMissing()) {
            return missing(attributes, pool, log);
        }
        if (amount.signum() == 0) {
            return LogOutcome.empty();
        }
        String token = poolTokens.getOrDefault(pid, defaultDepositToken);
        if (token == null) {
            return fail(ErrorType.INVALID_STAKING, "No staked token configured for pid " + pid, pool, log);
        }
        List<TransferSignal> candidates = action == StakingAction.DEPOSIT
                ? pool.into(token).stream().filter(t -> t.fromAddress().equals(user)).toList()
                : pool.outOf(token).stream().filter(t -> t.toAddress().equals(user)).toList();
        List<TransferSignal> matched = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        requireExact(candidates, amount, action == StakingAction.DEPOSIT ? "stake" : "unstake", matched, problems);
        if (!problems.isEmpty()) {
            return fail(ErrorType.INVALID_STAKING, log.name() + " for pid " + pid + " rejected: "
                    + String.join("; ", problems), pool, log);
        }
        Staking staking = new Staking(pool.timestamp(), pool.txHash(), log.index(), contractAddress, user, token,
                amount, null, null, action, pool.promote(matched));
        return LogOutcome.success().matched(matched).event(staking).build();
    }

    private LogOutcome harvest(DecodedLog log, TransferPool pool) {
        LogAttributes attributes = LogAttributes.of(log);
        String user = attributes.address("user");
        BigInteger amount = attributes.integer("amount");
        if (attributes.hasMissing()) {
            return missing(attributes, pool, log);
        }
        if (amount.signum() == 0) {
            return LogOutcome.empty();
        }
        List<TransferSignal> candidates = pool.outOf(rewardToken).stream()
                .filter(t -> t.toAddress().equals(user))
                .toList();
        Optional<TransferSignal> payout = TransferPool.exactlyOne(candidates, amount);
        if (payout.isEmpty()) {
            return fail(ErrorType.INVALID_FEE_COLLECTION, "Harvest of " + amount + " has no matching payout, candidates "
                    + describe(candidates), pool, log);
        }
        Reward reward = new Reward(pool.timestamp(), pool.txHash(), log.index(), contractAddress, user, rewardToken,
                amount, RewardType.CLAIM_REWARDS, pool.promote(List.of(payout.get())));
        return LogOutcome.success().matched(List.of(payout.get())).event(reward).build();
    }
}
