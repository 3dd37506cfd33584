package com.chainindexer.common;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Decodes the bytes32 amount pairs emitted by bin-based pools.
 * Layout is one big-endian 256-bit word: amount X in the low 128 bits, amount Y in the high 128 bits.
 */
public final class PackedAmountCodec {

    public static final int PACKED_LENGTH = 32;

    private static final int HALF_BITS = 128;
    private static final BigInteger LOW_MASK = BigInteger.ONE.shiftLeft(HALF_BITS).subtract(BigInteger.ONE);

    private PackedAmountCodec() {
    }

    public static PackedAmounts decode(byte[] packed) {
        if (packed == null) {
            throw new AmountDecodeException("Packed amount is null");
        }
        if (packed.length != PACKED_LENGTH) {
            throw new AmountDecodeException("Packed amount must be " + PACKED_LENGTH + " bytes, got " + packed.length);
        }
        return split(new BigInteger(1, packed));
    }

    /**
     * Some decoders hand bytes32 over as an unsigned integer; accepts that form as well.
     */
    public static PackedAmounts decode(BigInteger packed) {
        if (packed == null) {
            throw new AmountDecodeException("Packed amount is null");
        }
        if (packed.signum() < 0 || packed.bitLength() > PACKED_LENGTH * 8) {
            throw new AmountDecodeException("Packed amount out of 256-bit unsigned range: " + packed);
        }
        return split(packed);
    }

    public static byte[] encode(BigInteger amountX, BigInteger amountY) {
        Objects.requireNonNull(amountX, "amountX");
        Objects.requireNonNull(amountY, "amountY");
        if (amountX.signum() < 0 || amountX.bitLength() > HALF_BITS
                || amountY.signum() < 0 || amountY.bitLength() > HALF_BITS) {
            throw new AmountDecodeException("Amounts must be unsigned 128-bit values");
        }
        byte[] raw = amountY.shiftLeft(HALF_BITS).or(amountX).toByteArray();
        byte[] out = new byte[PACKED_LENGTH];
        int copy = Math.min(raw.length, PACKED_LENGTH);
        System.arraycopy(raw, raw.length - copy, out, PACKED_LENGTH - copy, copy);
        return out;
    }

    private static PackedAmounts split(BigInteger word) {
        return new PackedAmounts(word.and(LOW_MASK), word.shiftRight(HALF_BITS));
    }

    public record PackedAmounts(BigInteger amountX, BigInteger amountY) {

        public PackedAmounts add(PackedAmounts other) {
            return new PackedAmounts(amountX.add(other.amountX), amountY.add(other.amountY));
        }

        public static PackedAmounts zero() {
            return new PackedAmounts(BigInteger.ZERO, BigInteger.ZERO);
        }
    }
}
