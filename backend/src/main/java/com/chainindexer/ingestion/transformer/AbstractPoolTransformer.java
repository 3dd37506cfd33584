package com.chainindexer.ingestion.transformer;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.domain.BinAmounts;
import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.ErrorType;
import com.chainindexer.domain.Fee;
import com.chainindexer.domain.PoolSwap;
import com.chainindexer.domain.SwapDirection;
import com.chainindexer.domain.TransferSignal;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Two-token pool whose own address is also its receipt token. Maps the pool's token0/token1 amounts onto the
 * configured base/quote pair.
 */
public abstract class AbstractPoolTransformer extends AbstractTransformer {

    protected final String token0;
    protected final String token1;
    protected final String baseToken;
    protected final String quoteToken;
    /** Receives protocol fee mints and pays out claimed fees; null when the pool pays directly. */
    protected final String feeCollector;

    protected AbstractPoolTransformer(String contractAddress, String token0, String token1, String baseToken,
                                      String feeCollector) {
        super(contractAddress);
        this.token0 = EvmAddresses.normalize(token0);
        this.token1 = EvmAddresses.normalize(token1);
        String base = EvmAddresses.normalize(baseToken);
        if (this.token0 == null || this.token1 == null || this.token0.equals(this.token1)) {
            throw new IllegalArgumentException("Pool " + contractAddress + " needs two distinct tokens");
        }
        if (!this.token0.equals(base) && !this.token1.equals(base)) {
            throw new IllegalArgumentException("Base token " + baseToken + " is neither token0 nor token1 of " + contractAddress);
        }
        this.baseToken = base;
        this.quoteToken = base.equals(this.token0) ? this.token1 : this.token0;
        this.feeCollector = EvmAddresses.normalize(feeCollector);
    }

    protected String receiptToken() {
        return contractAddress;
    }

    protected boolean baseIsToken0() {
        return baseToken.equals(token0);
    }

    protected BinAmounts toBaseQuote(BigInteger amount0, BigInteger amount1) {
        return baseIsToken0() ? new BinAmounts(amount0, amount1) : new BinAmounts(amount1, amount0);
    }

    /**
     * Matches the inbound and outbound legs of a swap and builds the PoolSwap. Every non-zero gross amount needs
     * exactly one transfer of that amount: into the pool for {@code in}, out of the pool to {@code recipient}
     * for {@code out}.
     */
    LogOutcome.Builder matchSwap(DecodedLog first, TransferPool pool, BinAmounts in, BinAmounts out, String recipient,
                                 Map<BigInteger, BinAmounts> bins, List<String> problems) {
        List<TransferSignal> matched = new ArrayList<>();
        requireExact(pool.into(baseToken), in.amountBase(), "base deposit", matched, problems);
        requireExact(pool.into(quoteToken), in.amountQuote(), "quote deposit", matched, problems);
        requireExact(toRecipient(pool.outOf(baseToken), recipient), out.amountBase(), "base withdrawal", matched, problems);
        requireExact(toRecipient(pool.outOf(quoteToken), recipient), out.amountQuote(), "quote withdrawal", matched, problems);
        BigInteger baseDelta = in.amountBase().subtract(out.amountBase());
        BigInteger quoteDelta = in.amountQuote().subtract(out.amountQuote());
        if (baseDelta.signum() == 0 && quoteDelta.signum() == 0) {
            problems.add("swap moves no value");
        }
        if (!problems.isEmpty()) {
            return null;
        }
        PoolSwap swap = new PoolSwap(pool.timestamp(), pool.txHash(), first.index(), contractAddress, recipient,
                baseDelta.signum() > 0 ? SwapDirection.BUY : SwapDirection.SELL,
                baseToken, baseDelta.abs(), quoteToken, quoteDelta.abs(), bins, pool.promote(matched));
        return LogOutcome.success().matched(matched).event(swap);
    }

    LogOutcome invalidSwap(List<String> problems, TransferPool pool, DecodedLog first) {
        return fail(ErrorType.INVALID_SWAP, "Swap on " + contractAddress + " rejected: " + String.join("; ", problems),
                pool, first);
    }

    Fee fee(TransferPool pool, DecodedLog decoded, String payer, String token, BigInteger amount) {
        return new Fee(pool.timestamp(), pool.txHash(), decoded.index(), contractAddress, payer, token, amount);
    }

    private static List<TransferSignal> toRecipient(List<TransferSignal> candidates, String recipient) {
        if (recipient == null) {
            return candidates;
        }
        return candidates.stream().filter(t -> t.toAddress().equals(recipient)).toList();
    }
}
