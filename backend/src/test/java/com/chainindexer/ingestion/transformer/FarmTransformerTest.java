package com.chainindexer.ingestion.transformer;

import com.chainindexer.TestEngine;
import com.chainindexer.domain.ErrorType;
import com.chainindexer.domain.ProcessingError;
import com.chainindexer.domain.Reward;
import com.chainindexer.domain.RewardType;
import com.chainindexer.domain.Staking;
import com.chainindexer.domain.StakingAction;
import com.chainindexer.domain.Transaction;
import com.chainindexer.ingestion.transform.TransformContext;
import com.chainindexer.ingestion.transform.TransformResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Map;

import static com.chainindexer.TestLogs.addr;
import static com.chainindexer.TestLogs.erc20;
import static com.chainindexer.TestLogs.log;
import static com.chainindexer.TestLogs.tx;
import static org.assertj.core.api.Assertions.assertThat;

class FarmTransformerTest {

    private static final String LP = addr(0xC3);
    private static final String OTHER_LP = addr(0xC5);
    private static final String REWARD = addr(0xA7);
    private static final String FARM = addr(0xF1);
    private static final String USER = addr(0x11);

    private final FarmTransformer farm = new FarmTransformer(FARM, LP, Map.of(BigInteger.TWO, OTHER_LP), REWARD);

    private TransformResult reconcile(Transaction tx) {
        TransformContext context = TestEngine.extracted(tx, new TokenTransformer(LP), new TokenTransformer(OTHER_LP),
                new TokenTransformer(REWARD), farm);
        return farm.processLogs(TestEngine.phaseTwoLogs(tx, farm), context);
    }

    @Test
    void deposit_usesDefaultTokenForUnknownPid() {
        Transaction tx = tx(
                erc20(0, LP, USER, FARM, 40),
                log(1, FARM, "Deposit", "user", USER, "pid", 0, "amount", 40));

        TransformResult result = reconcile(tx);

        Staking staking = (Staking) result.events().values().iterator().next();
        assertThat(staking.token()).isEqualTo(LP);
        assertThat(staking.action()).isEqualTo(StakingAction.DEPOSIT);
        assertThat(staking.receiptToken()).isNull();
        assertThat(result.matchedTransfers()).containsOnlyKeys(0);
    }

    @Test
    void withdraw_usesPidToken() {
        Transaction tx = tx(
                erc20(0, OTHER_LP, FARM, USER, 15),
                log(1, FARM, "Withdraw", "user", USER, "pid", 2, "amount", 15));

        TransformResult result = reconcile(tx);

        Staking staking = (Staking) result.events().values().iterator().next();
        assertThat(staking.token()).isEqualTo(OTHER_LP);
        assertThat(staking.action()).isEqualTo(StakingAction.WITHDRAW);
    }

    @Test
    void emergencyWithdraw_isAWithdrawal() {
        Transaction tx = tx(
                erc20(0, LP, FARM, USER, 40),
                log(1, FARM, "EmergencyWithdraw", "user", USER, "pid", 0, "amount", 40));

        TransformResult result = reconcile(tx);

        assertThat(((Staking) result.events().values().iterator().next()).action()).isEqualTo(StakingAction.WITHDRAW);
    }

    @Test
    @DisplayName("zero-amount deposit only harvests and yields no staking event")
    void zeroDeposit_isSkipped() {
        Transaction tx = tx(
                erc20(0, REWARD, FARM, USER, 7),
                log(1, FARM, "Deposit", "user", USER, "pid", 0, "amount", 0),
                log(2, FARM, "Harvest", "user", USER, "pid", 0, "amount", 7));

        TransformResult result = reconcile(tx);

        assertThat(result.errors()).isEmpty();
        assertThat(result.events().values()).singleElement().isInstanceOf(Reward.class);
        Reward reward = (Reward) result.events().values().iterator().next();
        assertThat(reward.rewardType()).isEqualTo(RewardType.CLAIM_REWARDS);
        assertThat(reward.token()).isEqualTo(REWARD);
    }

    @Test
    void harvest_withoutPayout_isInvalidFeeCollection() {
        Transaction tx = tx(log(2, FARM, "Harvest", "user", USER, "pid", 0, "amount", 7));

        TransformResult result = reconcile(tx);

        assertThat(result.errors().values()).extracting(ProcessingError::errorType)
                .containsExactly(ErrorType.INVALID_FEE_COLLECTION);
    }

    @Test
    void deposit_fromAnotherAccount_isInvalidStaking() {
        Transaction tx = tx(
                erc20(0, LP, addr(0x22), FARM, 40),
                log(1, FARM, "Deposit", "user", USER, "pid", 0, "amount", 40));

        TransformResult result = reconcile(tx);

        assertThat(result.errors().values()).extracting(ProcessingError::errorType)
                .containsExactly(ErrorType.INVALID_STAKING);
    }
}
