package com.chainindexer.ingestion.transformer;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.ErrorType;
import com.chainindexer.domain.SwapDirection;
import com.chainindexer.domain.Trade;
import com.chainindexer.domain.TradeType;
import com.chainindexer.domain.TransferSignal;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Lot auction: a {@code Purchase} is a buy of the lot token paid in the payment token, settled directly with the
 * auction contract.
 */
public class AuctionTransformer extends AbstractTransformer {

    private final String lotToken;
    private final String paymentToken;

    public AuctionTransformer(String contractAddress, String lotToken, String paymentToken) {
        super(contractAddress);
        if (!EvmAddresses.isValid(lotToken) || !EvmAddresses.isValid(paymentToken)) {
            throw new IllegalArgumentException("Auction " + contractAddress + " needs valid lot and payment tokens");
        }
        this.lotToken = EvmAddresses.normalize(lotToken);
        this.paymentToken = EvmAddresses.normalize(paymentToken);
        onLog("Purchase", this::purchase);
    }

    @Override
    public TransformerType type() {
        return TransformerType.AUCTION;
    }

    private LogOutcome purchase(DecodedLog log, TransferPool pool) {
        LogAttributes attributes = LogAttributes.of(log);
        String buyer = attributes.address("buyer");
        BigInteger tokensBought = attributes.integer("tokensBought");
        BigInteger amountPaid = attributes.integer("amountPaid");
        if (attributes.hasMissing()) {
            return missing(attributes, pool, log);
        }
        List<TransferSignal> matched = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        requireExact(pool.into(paymentToken).stream().filter(t -> t.fromAddress().equals(buyer)).toList(),
                amountPaid, "payment", matched, problems);
        requireExact(pool.outOf(lotToken).stream().filter(t -> t.toAddress().equals(buyer)).toList(),
                tokensBought, "lot delivery", matched, problems);
        if (!problems.isEmpty()) {
            return fail(ErrorType.INVALID_SWAP, "Purchase rejected: " + String.join("; ", problems), pool, log);
        }
        Trade trade = new Trade(pool.timestamp(), pool.txHash(), log.index(), buyer, SwapDirection.BUY,
                lotToken, tokensBought, paymentToken, amountPaid, TradeType.AUCTION, List.of(), pool.promote(matched));
        return LogOutcome.success().matched(matched).event(trade).build();
    }
}
