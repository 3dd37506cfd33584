package com.chainindexer.ingestion.transformer;

import com.chainindexer.TestEngine;
import com.chainindexer.domain.ErrorType;
import com.chainindexer.domain.Fee;
import com.chainindexer.domain.Liquidity;
import com.chainindexer.domain.LiquidityAction;
import com.chainindexer.domain.MatchedTransfer;
import com.chainindexer.domain.PoolSwap;
import com.chainindexer.domain.Position;
import com.chainindexer.domain.ProcessingError;
import com.chainindexer.domain.Reward;
import com.chainindexer.domain.RewardType;
import com.chainindexer.domain.SwapDirection;
import com.chainindexer.domain.Transaction;
import com.chainindexer.ingestion.transform.TransformContext;
import com.chainindexer.ingestion.transform.TransformResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.chainindexer.TestLogs.ZERO;
import static com.chainindexer.TestLogs.addr;
import static com.chainindexer.TestLogs.erc20;
import static com.chainindexer.TestLogs.log;
import static com.chainindexer.TestLogs.tx;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConstantProductPoolTransformerTest {

    private static final String WAVAX = addr(0xA1);
    private static final String USDC = addr(0xB2);
    private static final String POOL = addr(0xC3);
    private static final String COLLECTOR = addr(0xFC);
    private static final String USER = addr(0x11);
    private static final String ROUTER = addr(0xD4);

    private final TokenTransformer wavax = new TokenTransformer(WAVAX);
    private final TokenTransformer usdc = new TokenTransformer(USDC);
    private final ConstantProductPoolTransformer pool =
            new ConstantProductPoolTransformer(POOL, WAVAX, USDC, WAVAX, COLLECTOR);

    private TransformResult reconcile(Transaction tx) {
        TransformContext context = TestEngine.extracted(tx, wavax, usdc, pool);
        return pool.processLogs(TestEngine.phaseTwoLogs(tx, pool), context);
    }

    @Test
    @DisplayName("Mint matches both deposits and the LP mint")
    void mint_producesLiquidityAndPosition() {
        Transaction tx = tx(
                erc20(0, WAVAX, USER, POOL, 100),
                erc20(1, USDC, USER, POOL, 200),
                erc20(2, POOL, ZERO, USER, 50),
                log(3, POOL, "Mint", "sender", ROUTER, "amount0", 100, "amount1", 200));

        TransformResult result = reconcile(tx);

        assertThat(result.errors()).isEmpty();
        assertThat(result.matchedTransfers()).containsOnlyKeys(0, 1, 2);
        Liquidity liquidity = (Liquidity) result.events().values().iterator().next();
        assertThat(liquidity.action()).isEqualTo(LiquidityAction.ADD_LP);
        assertThat(liquidity.provider()).isEqualTo(USER);
        assertThat(liquidity.amountBase()).isEqualTo(BigInteger.valueOf(100));
        assertThat(liquidity.amountQuote()).isEqualTo(BigInteger.valueOf(200));
        assertThat(liquidity.amountReceipt()).isEqualTo(BigInteger.valueOf(50));
        assertThat(liquidity.transfers().values()).extracting(MatchedTransfer::logIndex)
                .containsExactlyInAnyOrder(0, 1, 2);
        assertThat(result.positions().values()).singleElement().satisfies(position -> {
            assertThat(position.receiptId()).isEqualTo(BigInteger.ZERO);
            assertThat(position.amountReceipt()).isEqualTo(BigInteger.valueOf(50));
        });
    }

    @Test
    @DisplayName("base and quote follow configuration, not token order")
    void mint_withBaseAsToken1_swapsSides() {
        ConstantProductPoolTransformer usdcBase = new ConstantProductPoolTransformer(POOL, WAVAX, USDC, USDC, null);
        Transaction tx = tx(
                erc20(0, WAVAX, USER, POOL, 100),
                erc20(1, USDC, USER, POOL, 200),
                erc20(2, POOL, ZERO, USER, 50),
                log(3, POOL, "Mint", "sender", ROUTER, "amount0", 100, "amount1", 200));
        TransformContext context = TestEngine.extracted(tx, wavax, usdc, usdcBase);

        TransformResult result = usdcBase.processLogs(TestEngine.phaseTwoLogs(tx, usdcBase), context);

        Liquidity liquidity = (Liquidity) result.events().values().iterator().next();
        assertThat(liquidity.baseToken()).isEqualTo(USDC);
        assertThat(liquidity.amountBase()).isEqualTo(BigInteger.valueOf(200));
        assertThat(liquidity.amountQuote()).isEqualTo(BigInteger.valueOf(100));
    }

    @Test
    void mint_ignoresMinimumLiquidityBurnedToZero() {
        Transaction tx = tx(
                erc20(0, WAVAX, USER, POOL, 100),
                erc20(1, USDC, USER, POOL, 200),
                erc20(2, POOL, ZERO, ZERO, 1000),
                erc20(3, POOL, ZERO, USER, 50),
                log(4, POOL, "Mint", "sender", ROUTER, "amount0", 100, "amount1", 200));

        TransformResult result = reconcile(tx);

        assertThat(result.errors()).isEmpty();
        assertThat(result.matchedTransfers()).containsOnlyKeys(0, 1, 3);
    }

    @Test
    @DisplayName("60 + 40 never satisfies a deposit of exactly 100")
    void mint_splitDeposit_failsWithoutConsumingAnything() {
        Transaction tx = tx(
                erc20(0, WAVAX, USER, POOL, 60),
                erc20(1, WAVAX, USER, POOL, 40),
                erc20(2, USDC, USER, POOL, 200),
                erc20(3, POOL, ZERO, USER, 50),
                log(4, POOL, "Mint", "sender", ROUTER, "amount0", 100, "amount1", 200));

        TransformResult result = reconcile(tx);

        assertThat(result.events()).isEmpty();
        assertThat(result.matchedTransfers()).isEmpty();
        assertThat(result.errors().values()).singleElement().satisfies(error -> {
            assertThat(error.errorType()).isEqualTo(ErrorType.INVALID_LIQUIDITY_DEPOSIT);
            assertThat(error.logIndex()).isEqualTo(4);
        });
    }

    @Test
    void mint_missingAmount_reportsMissingAttributes() {
        Transaction tx = tx(log(0, POOL, "Mint", "sender", ROUTER, "amount0", 100));

        TransformResult result = reconcile(tx);

        assertThat(result.errors().values()).extracting(ProcessingError::errorType)
                .containsExactly(ErrorType.MISSING_ATTRIBUTES);
    }

    @Test
    @DisplayName("Burn is a negative liquidity change attributed to whoever returned the LP tokens")
    void burn_producesNegativeLiquidity() {
        Transaction tx = tx(
                erc20(0, POOL, USER, POOL, 50),
                erc20(1, POOL, POOL, ZERO, 50),
                erc20(2, WAVAX, POOL, ROUTER, 100),
                erc20(3, USDC, POOL, ROUTER, 200),
                log(4, POOL, "Burn", "sender", ROUTER, "amount0", 100, "amount1", 200, "to", ROUTER));

        TransformResult result = reconcile(tx);

        assertThat(result.errors()).isEmpty();
        assertThat(result.matchedTransfers()).containsOnlyKeys(0, 1, 2, 3);
        Liquidity liquidity = (Liquidity) result.events().values().iterator().next();
        assertThat(liquidity.action()).isEqualTo(LiquidityAction.REMOVE_LP);
        assertThat(liquidity.provider()).isEqualTo(USER);
        assertThat(liquidity.amountBase()).isEqualTo(BigInteger.valueOf(-100));
        assertThat(liquidity.amountQuote()).isEqualTo(BigInteger.valueOf(-200));
        assertThat(liquidity.amountReceipt()).isEqualTo(BigInteger.valueOf(-50));
        assertThat(result.positions().values()).extracting(Position::amountBase)
                .containsExactly(BigInteger.valueOf(-100));
    }

    @Test
    void burn_withoutReceiptBurn_fails() {
        Transaction tx = tx(
                erc20(2, WAVAX, POOL, USER, 100),
                erc20(3, USDC, POOL, USER, 200),
                log(4, POOL, "Burn", "sender", ROUTER, "amount0", 100, "amount1", 200, "to", USER));

        TransformResult result = reconcile(tx);

        assertThat(result.errors().values()).extracting(ProcessingError::errorType)
                .containsExactly(ErrorType.INVALID_LIQUIDITY_WITHDRAWAL);
        assertThat(result.matchedTransfers()).isEmpty();
    }

    @Test
    @DisplayName("swap direction is buy when the pool's net base amount is positive")
    void swap_baseIn_isBuy() {
        Transaction tx = tx(
                erc20(0, WAVAX, USER, POOL, 100),
                erc20(1, USDC, POOL, USER, 250),
                log(2, POOL, "Swap", "sender", USER, "amount0In", 100, "amount1In", 0,
                        "amount0Out", 0, "amount1Out", 250, "to", USER));

        TransformResult result = reconcile(tx);

        PoolSwap swap = (PoolSwap) result.events().values().iterator().next();
        assertThat(swap.direction()).isEqualTo(SwapDirection.BUY);
        assertThat(swap.baseAmount()).isEqualTo(BigInteger.valueOf(100));
        assertThat(swap.quoteAmount()).isEqualTo(BigInteger.valueOf(250));
        assertThat(swap.taker()).isEqualTo(USER);
        assertThat(result.matchedTransfers()).containsOnlyKeys(0, 1);
    }

    @Test
    void swap_baseOut_isSell() {
        Transaction tx = tx(
                erc20(0, USDC, USER, POOL, 250),
                erc20(1, WAVAX, POOL, USER, 100),
                log(2, POOL, "Swap", "sender", USER, "amount0In", 0, "amount1In", 250,
                        "amount0Out", 100, "amount1Out", 0, "to", USER));

        TransformResult result = reconcile(tx);

        PoolSwap swap = (PoolSwap) result.events().values().iterator().next();
        assertThat(swap.direction()).isEqualTo(SwapDirection.SELL);
        assertThat(swap.baseAmount()).isEqualTo(BigInteger.valueOf(100));
    }

    @Test
    void swap_outputToWrongRecipient_isInvalid() {
        Transaction tx = tx(
                erc20(0, WAVAX, USER, POOL, 100),
                erc20(1, USDC, POOL, ROUTER, 250),
                log(2, POOL, "Swap", "sender", USER, "amount0In", 100, "amount1In", 0,
                        "amount0Out", 0, "amount1Out", 250, "to", USER));

        TransformResult result = reconcile(tx);

        assertThat(result.events()).isEmpty();
        assertThat(result.errors().values()).extracting(ProcessingError::errorType)
                .containsExactly(ErrorType.INVALID_SWAP);
    }

    @Test
    @DisplayName("two swaps in one call never share a transfer")
    void twoSwaps_claimDistinctTransfers() {
        Transaction tx = tx(
                erc20(0, WAVAX, USER, POOL, 100),
                erc20(1, USDC, POOL, USER, 250),
                log(2, POOL, "Swap", "sender", USER, "amount0In", 100, "amount1In", 0,
                        "amount0Out", 0, "amount1Out", 250, "to", USER),
                log(3, POOL, "Swap", "sender", USER, "amount0In", 100, "amount1In", 0,
                        "amount0Out", 0, "amount1Out", 250, "to", USER));

        TransformResult result = reconcile(tx);

        assertThat(result.events()).hasSize(1);
        assertThat(result.errors().values()).singleElement()
                .satisfies(error -> assertThat(error.logIndex()).isEqualTo(3));
    }

    @Test
    void fees_emitOneFeePerNonZeroToken() {
        Transaction tx = tx(log(0, POOL, "Fees", "sender", USER, "amount0", 3, "amount1", 0));

        TransformResult result = reconcile(tx);

        assertThat(result.events().values()).singleElement().isInstanceOfSatisfying(Fee.class, fee -> {
            assertThat(fee.token()).isEqualTo(WAVAX);
            assertThat(fee.amount()).isEqualTo(BigInteger.valueOf(3));
            assertThat(fee.payer()).isEqualTo(USER);
        });
    }

    @Test
    void claim_matchesPayoutFromFeeCollector() {
        Transaction tx = tx(
                erc20(0, WAVAX, COLLECTOR, USER, 5),
                erc20(1, USDC, COLLECTOR, USER, 7),
                log(2, POOL, "Claim", "sender", USER, "recipient", USER, "amount0", 5, "amount1", 7));

        TransformResult result = reconcile(tx);

        assertThat(result.errors()).isEmpty();
        assertThat(result.events().values()).hasSize(2).allSatisfy(event -> {
            assertThat(event).isInstanceOf(Reward.class);
            assertThat(((Reward) event).rewardType()).isEqualTo(RewardType.CLAIM_FEES);
        });
        assertThat(result.matchedTransfers()).containsOnlyKeys(0, 1);
    }

    @Test
    void claim_withoutPayout_isInvalidFeeCollection() {
        Transaction tx = tx(log(2, POOL, "Claim", "sender", USER, "recipient", USER, "amount0", 5, "amount1", 0));

        TransformResult result = reconcile(tx);

        assertThat(result.errors().values()).extracting(ProcessingError::errorType)
                .containsExactly(ErrorType.INVALID_FEE_COLLECTION);
    }

    @Test
    void baseTokenOutsideThePair_isRejected() {
        assertThatThrownBy(() -> new ConstantProductPoolTransformer(POOL, WAVAX, USDC, addr(0xEE), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
