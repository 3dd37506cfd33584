package com.chainindexer.ingestion.transformer;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.domain.BinAmounts;
import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.ErrorType;
import com.chainindexer.domain.Liquidity;
import com.chainindexer.domain.LiquidityAction;
import com.chainindexer.domain.Position;
import com.chainindexer.domain.Reward;
import com.chainindexer.domain.RewardType;
import com.chainindexer.domain.TransferSignal;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Uniswap V2 style pair: fungible LP token issued by the pair itself.
 * <ul>
 *   <li>Mint: one base deposit, one quote deposit (exact amounts) and one LP mint to the provider.</li>
 *   <li>Burn: one LP burn plus one base and one quote withdrawal to {@code to}.</li>
 *   <li>Swap: gross in/out legs, see {@link AbstractPoolTransformer}.</li>
 *   <li>Fees / Claim: Solidly-style fee accrual and fee claims.</li>
 * </ul>
 */
public class ConstantProductPoolTransformer extends AbstractPoolTransformer {

    static final BigInteger FUNGIBLE_RECEIPT_ID = BigInteger.ZERO;

    public ConstantProductPoolTransformer(String contractAddress, String token0, String token1, String baseToken,
                                          String feeCollector) {
        super(contractAddress, token0, token1, baseToken, feeCollector);
        onTransfer("Transfer", (log, tx) -> erc20Transfer(log, tx, "from", "to", "value", "amount"));
        onLog("Mint", this::mint);
        onLog("Burn", this::burn);
        onLog("Swap", this::swap);
        onLog("Fees", this::fees);
        onLog("Claim", this::claim);
    }

    @Override
    public TransformerType type() {
        return TransformerType.CONSTANT_PRODUCT_POOL;
    }

    private LogOutcome mint(DecodedLog log, TransferPool pool) {
        LogAttributes attributes = LogAttributes.of(log);
        BigInteger amount0 = attributes.integer("amount0");
        BigInteger amount1 = attributes.integer("amount1");
        if (attributes.hasMissing()) {
            return missing(attributes, pool, log);
        }
        BinAmounts amounts = toBaseQuote(amount0, amount1);
        List<TransferSignal> matched = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        requireExact(pool.into(baseToken), amounts.amountBase(), "base deposit", matched, problems);
        requireExact(pool.into(quoteToken), amounts.amountQuote(), "quote deposit", matched, problems);
        List<TransferSignal> receiptMints = pool.mints(receiptToken()).stream()
                .filter(t -> !EvmAddresses.isZero(t.toAddress()))
                .filter(t -> feeCollector == null || !t.toAddress().equals(feeCollector))
                .toList();
        if (receiptMints.size() != 1) {
            problems.add("expected exactly one receipt mint, candidates " + describe(receiptMints));
        }
        if (!problems.isEmpty()) {
            return fail(ErrorType.INVALID_LIQUIDITY_DEPOSIT, "Mint on " + contractAddress + " rejected: "
                    + String.join("; ", problems), pool, log);
        }
        TransferSignal receipt = receiptMints.get(0);
        matched.add(receipt);
        return liquidity(log, pool, receipt.toAddress(), amounts.amountBase(), amounts.amountQuote(),
                receipt.amount(), LiquidityAction.ADD_LP, matched);
    }

    private LogOutcome burn(DecodedLog log, TransferPool pool) {
        LogAttributes attributes = LogAttributes.of(log);
        BigInteger amount0 = attributes.integer("amount0");
        BigInteger amount1 = attributes.integer("amount1");
        String to = attributes.address("to");
        if (attributes.hasMissing()) {
            return missing(attributes, pool, log);
        }
        BinAmounts amounts = toBaseQuote(amount0, amount1);
        List<TransferSignal> matched = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        List<TransferSignal> receiptBurns = pool.burns(receiptToken());
        if (receiptBurns.size() != 1) {
            problems.add("expected exactly one receipt burn, candidates " + describe(receiptBurns));
        }
        requireExact(pool.outOf(baseToken).stream().filter(t -> t.toAddress().equals(to)).toList(),
                amounts.amountBase(), "base withdrawal", matched, problems);
        requireExact(pool.outOf(quoteToken).stream().filter(t -> t.toAddress().equals(to)).toList(),
                amounts.amountQuote(), "quote withdrawal", matched, problems);
        if (!problems.isEmpty()) {
            return fail(ErrorType.INVALID_LIQUIDITY_WITHDRAWAL, "Burn on " + contractAddress + " rejected: "
                    + String.join("; ", problems), pool, log);
        }
        TransferSignal receiptBurn = receiptBurns.get(0);
        matched.add(receiptBurn);
        // LP tokens are sent to the pair before it burns them; that hop names the provider
        String provider = to;
        Optional<TransferSignal> returned = TransferPool.exactlyOne(
                pool.into(receiptToken()).stream().filter(t -> !EvmAddresses.isZero(t.fromAddress())).toList(),
                receiptBurn.amount());
        if (returned.isPresent()) {
            matched.add(returned.get());
            provider = returned.get().fromAddress();
        }
        return liquidity(log, pool, provider, amounts.amountBase().negate(), amounts.amountQuote().negate(),
                receiptBurn.amount().negate(), LiquidityAction.REMOVE_LP, matched);
    }

    private LogOutcome swap(DecodedLog log, TransferPool pool) {
        LogAttributes attributes = LogAttributes.of(log);
        BigInteger amount0In = attributes.integer("amount0In");
        BigInteger amount1In = attributes.integer("amount1In");
        BigInteger amount0Out = attributes.integer("amount0Out");
        BigInteger amount1Out = attributes.integer("amount1Out");
        String to = attributes.address("to");
        if (attributes.hasMissing()) {
            return missing(attributes, pool, log);
        }
        List<String> problems = new ArrayList<>();
        LogOutcome.Builder outcome = matchSwap(log, pool, toBaseQuote(amount0In, amount1In),
                toBaseQuote(amount0Out, amount1Out), to, Map.of(), problems);
        return outcome == null ? invalidSwap(problems, pool, log) : outcome.build();
    }

    private LogOutcome fees(DecodedLog log, TransferPool pool) {
        LogAttributes attributes = LogAttributes.of(log);
        String sender = attributes.address("sender");
        BigInteger amount0 = attributes.integer("amount0");
        BigInteger amount1 = attributes.integer("amount1");
        if (attributes.hasMissing()) {
            return missing(attributes, pool, log);
        }
        LogOutcome.Builder outcome = LogOutcome.success();
        if (amount0.signum() > 0) {
            outcome.event(fee(pool, log, sender, token0, amount0));
        }
        if (amount1.signum() > 0) {
            outcome.event(fee(pool, log, sender, token1, amount1));
        }
        return outcome.build();
    }

    private LogOutcome claim(DecodedLog log, TransferPool pool) {
        LogAttributes attributes = LogAttributes.of(log);
        String recipient = attributes.address("recipient", "to");
        BigInteger amount0 = attributes.integer("amount0");
        BigInteger amount1 = attributes.integer("amount1");
        if (attributes.hasMissing()) {
            return missing(attributes, pool, log);
        }
        String payer = feeCollector != null ? feeCollector : contractAddress;
        LogOutcome.Builder outcome = LogOutcome.success();
        List<String> problems = new ArrayList<>();
        claimLeg(pool, log, payer, recipient, token0, amount0, outcome, problems);
        claimLeg(pool, log, payer, recipient, token1, amount1, outcome, problems);
        if (!problems.isEmpty()) {
            return fail(ErrorType.INVALID_FEE_COLLECTION, "Claim on " + contractAddress + " rejected: "
                    + String.join("; ", problems), pool, log);
        }
        return outcome.build();
    }

    private void claimLeg(TransferPool pool, DecodedLog log, String payer, String recipient, String token,
                          BigInteger amount, LogOutcome.Builder outcome, List<String> problems) {
        if (amount.signum() == 0) {
            return;
        }
        List<TransferSignal> candidates = pool.sentBy(token, payer).stream()
                .filter(t -> t.toAddress().equals(recipient))
                .toList();
        Optional<TransferSignal> payout = TransferPool.exactlyOne(candidates, amount);
        if (payout.isEmpty()) {
            problems.add("expected exactly one " + token + " payout of " + amount + ", candidates " + describe(candidates));
            return;
        }
        outcome.matched(List.of(payout.get()));
        outcome.event(new Reward(pool.timestamp(), pool.txHash(), log.index(), contractAddress, recipient, token,
                amount, RewardType.CLAIM_FEES, pool.promote(List.of(payout.get()))));
    }

    private LogOutcome liquidity(DecodedLog log, TransferPool pool, String provider, BigInteger amountBase,
                                 BigInteger amountQuote, BigInteger amountReceipt, LiquidityAction action,
                                 List<TransferSignal> matched) {
        Position position = new Position(pool.timestamp(), pool.txHash(), log.index(), contractAddress, provider,
                receiptToken(), FUNGIBLE_RECEIPT_ID, amountBase, amountQuote, amountReceipt);
        Liquidity liquidity = new Liquidity(pool.timestamp(), pool.txHash(), log.index(), contractAddress, provider,
                baseToken, amountBase, quoteToken, amountQuote, receiptToken(), amountReceipt, action,
                List.of(position), pool.promote(matched));
        return LogOutcome.success().matched(matched).event(liquidity).position(position).build();
    }
}
