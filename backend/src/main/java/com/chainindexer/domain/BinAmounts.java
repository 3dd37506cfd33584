package com.chainindexer.domain;

import java.math.BigInteger;

/**
 * Base and quote amounts attributed to one bin.
 */
public record BinAmounts(BigInteger amountBase, BigInteger amountQuote) {

    public BinAmounts add(BinAmounts other) {
        return new BinAmounts(amountBase.add(other.amountBase), amountQuote.add(other.amountQuote));
    }
}
