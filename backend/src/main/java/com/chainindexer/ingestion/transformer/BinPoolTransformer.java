package com.chainindexer.ingestion.transformer;

import com.chainindexer.common.PackedAmountCodec.PackedAmounts;
import com.chainindexer.domain.BinAmounts;
import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.ErrorType;
import com.chainindexer.domain.Liquidity;
import com.chainindexer.domain.LiquidityAction;
import com.chainindexer.domain.Position;
import com.chainindexer.domain.Transaction;
import com.chainindexer.domain.TransferSignal;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Bin-based concentrated-liquidity pair (Liquidity Book style). The pair is an ERC-1155-like receipt token whose
 * ids are bin ids; deposits, withdrawals and swaps report per-bin amounts as packed bytes32 pairs
 * (token X low, token Y high).
 * <p>
 * Receipt batches must cover exactly the bins named in the deposit or withdrawal log. One Swap log is emitted per
 * bin crossed; all Swap logs with the same recipient in one transaction become a single PoolSwap.
 */
public class BinPoolTransformer extends AbstractPoolTransformer {

    public BinPoolTransformer(String contractAddress, String tokenX, String tokenY, String baseToken) {
        super(contractAddress, tokenX, tokenY, baseToken, null);
        onTransfer("TransferBatch", this::transferBatch);
        onTransfer("TransferSingle", this::transferSingle);
        onLog("DepositedToBins", (log, pool) -> binLiquidity(log, pool, true));
        onLog("WithdrawnFromBins", (log, pool) -> binLiquidity(log, pool, false));
        onLogGroup("Swap", log -> log.address("to").orElse(""), this::swaps);
    }

    @Override
    public TransformerType type() {
        return TransformerType.BIN_POOL;
    }

    private Extracted transferBatch(DecodedLog log, Transaction tx) {
        LogAttributes attributes = LogAttributes.of(log);
        String from = attributes.address("from");
        String to = attributes.address("to");
        List<BigInteger> ids = attributes.integers("ids");
        List<BigInteger> amounts = attributes.integers("amounts");
        if (attributes.hasMissing()) {
            return missing(attributes, tx, log);
        }
        if (ids.size() != amounts.size()) {
            return Extracted.failure(error(ErrorType.INVALID_LB_TRANSFER, "TransferBatch has " + ids.size()
                    + " ids but " + amounts.size() + " amounts", tx.txHash(), log));
        }
        Map<BigInteger, BigInteger> batch = new TreeMap<>();
        BigInteger total = BigInteger.ZERO;
        for (int i = 0; i < ids.size(); i++) {
            batch.merge(ids.get(i), amounts.get(i), BigInteger::add);
            total = total.add(amounts.get(i));
        }
        if (total.signum() == 0) {
            return Extracted.none();
        }
        return Extracted.of(new TransferSignal(contractAddress, from, to, total, log.index(), batch));
    }

    private Extracted transferSingle(DecodedLog log, Transaction tx) {
        LogAttributes attributes = LogAttributes.of(log);
        String from = attributes.address("from");
        String to = attributes.address("to");
        BigInteger id = attributes.integer("id");
        BigInteger amount = attributes.integer("amount", "value");
        if (attributes.hasMissing()) {
            return missing(attributes, tx, log);
        }
        if (amount.signum() == 0) {
            return Extracted.none();
        }
        return Extracted.of(new TransferSignal(contractAddress, from, to, amount, log.index(), Map.of(id, amount)));
    }

    private LogOutcome binLiquidity(DecodedLog log, TransferPool pool, boolean deposit) {
        LogAttributes attributes = LogAttributes.of(log);
        String to = attributes.address("to");
        List<BigInteger> ids = attributes.integers("ids");
        List<PackedAmounts> amounts = attributes.packedList("amounts");
        if (attributes.hasMissing()) {
            return missing(attributes, pool, log);
        }
        if (ids.size() != amounts.size()) {
            return fail(ErrorType.INVALID_LB_TRANSFER, log.name() + " has " + ids.size() + " ids but "
                    + amounts.size() + " amounts", pool, log);
        }
        Map<BigInteger, BinAmounts> bins = new TreeMap<>();
        for (int i = 0; i < ids.size(); i++) {
            PackedAmounts packed = amounts.get(i);
            bins.merge(ids.get(i), toBaseQuote(packed.amountX(), packed.amountY()), BinAmounts::add);
        }
        BinAmounts total = bins.values().stream()
                .reduce(new BinAmounts(BigInteger.ZERO, BigInteger.ZERO), BinAmounts::add);

        List<TransferSignal> matched = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        List<TransferSignal> receipts;
        if (deposit) {
            requireExact(pool.into(baseToken), total.amountBase(), "base deposit", matched, problems);
            requireExact(pool.into(quoteToken), total.amountQuote(), "quote deposit", matched, problems);
            receipts = pool.mints(receiptToken()).stream().filter(t -> t.toAddress().equals(to)).toList();
        } else {
            requireExact(pool.outOf(baseToken).stream().filter(t -> t.toAddress().equals(to)).toList(),
                    total.amountBase(), "base withdrawal", matched, problems);
            requireExact(pool.outOf(quoteToken).stream().filter(t -> t.toAddress().equals(to)).toList(),
                    total.amountQuote(), "quote withdrawal", matched, problems);
            receipts = pool.burns(receiptToken());
        }
        TransferSignal receipt = null;
        if (receipts.size() != 1) {
            problems.add("expected exactly one receipt " + (deposit ? "mint" : "burn") + ", candidates "
                    + describe(receipts));
        } else {
            receipt = receipts.get(0);
            Set<BigInteger> receiptBins = receipt.batch().keySet();
            if (!receiptBins.equals(new HashSet<>(bins.keySet()))) {
                problems.add("receipt bins " + receiptBins + " do not match log bins " + bins.keySet());
            }
        }
        if (!problems.isEmpty()) {
            ErrorType type = deposit ? ErrorType.INVALID_LIQUIDITY_DEPOSIT : ErrorType.INVALID_LIQUIDITY_WITHDRAWAL;
            return fail(type, log.name() + " on " + contractAddress + " rejected: " + String.join("; ", problems),
                    pool, log);
        }
        matched.add(receipt);

        String provider = deposit ? to : receipt.fromAddress();
        int sign = deposit ? 1 : -1;
        List<Position> positions = new ArrayList<>();
        for (Map.Entry<BigInteger, BinAmounts> bin : bins.entrySet()) {
            BinAmounts amount = bin.getValue();
            positions.add(new Position(pool.timestamp(), pool.txHash(), log.index(), contractAddress, provider,
                    receiptToken(), bin.getKey(), signed(amount.amountBase(), sign), signed(amount.amountQuote(), sign),
                    signed(receipt.batch().get(bin.getKey()), sign)));
        }
        Liquidity liquidity = new Liquidity(pool.timestamp(), pool.txHash(), log.index(), contractAddress, provider,
                baseToken, signed(total.amountBase(), sign), quoteToken, signed(total.amountQuote(), sign),
                receiptToken(), signed(receipt.amount(), sign),
                deposit ? LiquidityAction.ADD_LP : LiquidityAction.REMOVE_LP, positions, pool.promote(matched));
        LogOutcome.Builder outcome = LogOutcome.success().matched(matched).event(liquidity);
        positions.forEach(outcome::position);
        return outcome.build();
    }

    private LogOutcome swaps(List<DecodedLog> logs, TransferPool pool) {
        DecodedLog first = logs.get(0);
        String recipient = null;
        String sender = null;
        PackedAmounts totalIn = PackedAmounts.zero();
        PackedAmounts totalOut = PackedAmounts.zero();
        PackedAmounts totalFees = PackedAmounts.zero();
        Map<BigInteger, BinAmounts> bins = new TreeMap<>();
        for (DecodedLog log : logs) {
            LogAttributes attributes = LogAttributes.of(log);
            String to = attributes.address("to");
            String from = attributes.address("sender");
            BigInteger id = attributes.integer("id");
            PackedAmounts in = attributes.packed("amountsIn");
            PackedAmounts out = attributes.packed("amountsOut");
            PackedAmounts fees = attributes.packed("totalFees");
            if (attributes.hasMissing()) {
                return missing(attributes, pool, log);
            }
            recipient = to;
            sender = sender == null ? from : sender;
            totalIn = totalIn.add(in);
            totalOut = totalOut.add(out);
            totalFees = totalFees.add(fees);
            BinAmounts inBin = toBaseQuote(in.amountX(), in.amountY());
            BinAmounts outBin = toBaseQuote(out.amountX(), out.amountY());
            bins.merge(id, new BinAmounts(inBin.amountBase().subtract(outBin.amountBase()),
                    inBin.amountQuote().subtract(outBin.amountQuote())), BinAmounts::add);
        }
        List<String> problems = new ArrayList<>();
        LogOutcome.Builder outcome = matchSwap(first, pool, toBaseQuote(totalIn.amountX(), totalIn.amountY()),
                toBaseQuote(totalOut.amountX(), totalOut.amountY()), recipient, bins, problems);
        if (outcome == null) {
            return invalidSwap(problems, pool, first);
        }
        if (totalFees.amountX().signum() > 0) {
            outcome.event(fee(pool, first, sender, token0, totalFees.amountX()));
        }
        if (totalFees.amountY().signum() > 0) {
            outcome.event(fee(pool, first, sender, token1, totalFees.amountY()));
        }
        return outcome.build();
    }

    private static BigInteger signed(BigInteger amount, int sign) {
        return sign < 0 ? amount.negate() : amount;
    }
}
