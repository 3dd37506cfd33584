package com.chainindexer.ingestion.transformer;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.ErrorType;
import com.chainindexer.domain.PoolSwap;
import com.chainindexer.domain.RouteSignal;
import com.chainindexer.domain.SwapDirection;
import com.chainindexer.domain.Trade;
import com.chainindexer.domain.TradeType;
import com.chainindexer.domain.Transaction;
import com.chainindexer.domain.TransferSignal;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Router/aggregator. Phase 1 turns the router's summary {@code Swap} log into a {@link RouteSignal}; phase 2 runs
 * after the pools and folds the pool swaps preceding that log into one {@link Trade}, replacing them as top-level
 * events.
 * <p>
 * Base/quote orientation follows {@code quoteTokens}, earlier entries being the stronger quote: paying a quote
 * token is a buy of the other side, anything else is a sell.
 */
public class RouterTransformer extends AbstractTransformer {

    private final List<String> quoteTokens;

    public RouterTransformer(String contractAddress, List<String> quoteTokens) {
        super(contractAddress);
        this.quoteTokens = quoteTokens.stream().map(EvmAddresses::normalize).toList();
        onTransfer("Swap", this::route);
        onLog("Swap", this::trade);
    }

    @Override
    public TransformerType type() {
        return TransformerType.ROUTER;
    }

    private Extracted route(DecodedLog log, Transaction tx) {
        LogAttributes attributes = LogAttributes.of(log);
        String sender = attributes.address("sender");
        String recipient = attributes.address("recipient", "to");
        String tokenIn = attributes.address("tokenIn");
        String tokenOut = attributes.address("tokenOut");
        BigInteger amountIn = attributes.integer("amountIn");
        BigInteger amountOut = attributes.integer("amountOut");
        if (attributes.hasMissing()) {
            return missing(attributes, tx, log);
        }
        return Extracted.of(new RouteSignal(contractAddress, sender, recipient, tokenIn, amountIn, tokenOut, amountOut,
                log.index()));
    }

    private LogOutcome trade(DecodedLog log, TransferPool pool) {
        Optional<RouteSignal> pending = pool.pendingSignal(log.index(), RouteSignal.class);
        if (pending.isEmpty()) {
            // extraction already reported why there is no route for this log
            return LogOutcome.empty();
        }
        RouteSignal route = pending.get();
        List<PoolSwap> swaps = pool.events(PoolSwap.class).stream()
                .filter(s -> s.logIndex() < log.index())
                .toList();
        if (swaps.isEmpty()) {
            return fail(ErrorType.INVALID_SWAP, "Route at log " + log.index() + " has no pool swaps to aggregate",
                    pool, log);
        }
        String taker = route.recipient() != null && !route.recipient().equals(contractAddress)
                ? route.recipient()
                : pool.transaction().originFrom();

        List<TransferSignal> matched = new ArrayList<>();
        TransferPool.exactlyOne(pool.sentBy(route.tokenIn(), route.sender()), route.amountIn()).ifPresent(matched::add);
        TransferPool.exactlyOne(pool.receivedBy(route.tokenOut(), taker), route.amountOut()).ifPresent(matched::add);

        Trade trade = orient(route, pool, log, taker, swaps, matched);
        LogOutcome.Builder outcome = LogOutcome.success().matched(matched).event(trade).consumed(log.index());
        swaps.forEach(s -> outcome.removed(s.contentId()));
        return outcome.build();
    }

    private Trade orient(RouteSignal route, TransferPool pool, DecodedLog log, String taker, List<PoolSwap> swaps,
                         List<TransferSignal> matched) {
        if (route.tokenIn().equals(route.tokenOut())) {
            SwapDirection direction = route.amountOut().compareTo(route.amountIn()) >= 0 ? SwapDirection.BUY : SwapDirection.SELL;
            return new Trade(pool.timestamp(), pool.txHash(), log.index(), taker, direction,
                    route.tokenOut(), route.amountOut(), route.tokenIn(), route.amountIn(), TradeType.ARBITRAGE,
                    swaps, pool.promote(matched));
        }
        if (paysQuote(route)) {
            return new Trade(pool.timestamp(), pool.txHash(), log.index(), taker, SwapDirection.BUY,
                    route.tokenOut(), route.amountOut(), route.tokenIn(), route.amountIn(), TradeType.TRADE,
                    swaps, pool.promote(matched));
        }
        return new Trade(pool.timestamp(), pool.txHash(), log.index(), taker, SwapDirection.SELL,
                route.tokenIn(), route.amountIn(), route.tokenOut(), route.amountOut(), TradeType.TRADE,
                swaps, pool.promote(matched));
    }

    private boolean paysQuote(RouteSignal route) {
        int in = quoteTokens.indexOf(route.tokenIn());
        int out = quoteTokens.indexOf(route.tokenOut());
        if (in < 0) {
            return false;
        }
        return out < 0 || in < out;
    }
}
