package com.chainindexer.domain;

import com.chainindexer.common.EvmAddresses;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Router summary log captured in phase 1: what the user paid in and received back across all hops.
 */
public record RouteSignal(
        String router,
        String sender,
        String recipient,
        String tokenIn,
        BigInteger amountIn,
        String tokenOut,
        BigInteger amountOut,
        int logIndex
) implements Signal {

    public RouteSignal {
        Objects.requireNonNull(tokenIn, "tokenIn");
        Objects.requireNonNull(tokenOut, "tokenOut");
        Objects.requireNonNull(amountIn, "amountIn");
        Objects.requireNonNull(amountOut, "amountOut");
        router = EvmAddresses.normalize(router);
        sender = EvmAddresses.normalize(sender);
        recipient = EvmAddresses.normalize(recipient);
        tokenIn = EvmAddresses.normalize(tokenIn);
        tokenOut = EvmAddresses.normalize(tokenOut);
    }
}
