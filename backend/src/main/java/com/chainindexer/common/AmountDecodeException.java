package com.chainindexer.common;

/**
 * Thrown when a packed amount field does not have the expected 256-bit shape.
 */
public class AmountDecodeException extends RuntimeException {

    public AmountDecodeException(String message) {
        super(message);
    }
}
