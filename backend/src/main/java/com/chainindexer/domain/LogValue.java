package com.chainindexer.domain;

import com.chainindexer.common.EvmAddresses;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * ABI-decoded log argument. Closed set of shapes: integer, address, bytes, bool, string and nested array.
 */
public interface LogValue {

    static LogValue integer(long value) {
        return new IntegerValue(BigInteger.valueOf(value));
    }

    static LogValue integer(BigInteger value) {
        return new IntegerValue(value);
    }

    static LogValue address(String value) {
        return new AddressValue(value);
    }

    static LogValue bytes(byte[] value) {
        return new BytesValue(value);
    }

    static LogValue bool(boolean value) {
        return new BoolValue(value);
    }

    static LogValue string(String value) {
        return new StringValue(value);
    }

    static LogValue array(List<LogValue> values) {
        return new ArrayValue(values);
    }

    static LogValue integers(List<BigInteger> values) {
        return new ArrayValue(values.stream().map(LogValue::integer).toList());
    }

    record IntegerValue(BigInteger value) implements LogValue {
        public IntegerValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record AddressValue(String value) implements LogValue {
        public AddressValue {
            Objects.requireNonNull(value, "value");
            value = EvmAddresses.normalize(value);
        }
    }

    record BytesValue(byte[] value) implements LogValue {
        public BytesValue {
            Objects.requireNonNull(value, "value");
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BytesValue other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesValue[0x" + HexFormat.of().formatHex(value) + "]";
        }
    }

    record BoolValue(boolean value) implements LogValue {
    }

    record StringValue(String value) implements LogValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record ArrayValue(List<LogValue> values) implements LogValue {
        public ArrayValue {
            values = List.copyOf(values);
        }
    }
}
