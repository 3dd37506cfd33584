package com.chainindexer.ingestion.transformer;

import com.chainindexer.common.PackedAmountCodec;
import com.chainindexer.common.PackedAmountCodec.PackedAmounts;
import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.LogValue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads typed attributes off a decoded log and remembers which ones were absent, so a handler can read
 * everything it needs first and then fail once with a single missing_attributes error.
 */
final class LogAttributes {

    private final DecodedLog log;
    private final Set<String> missing = new LinkedHashSet<>();

    private LogAttributes(DecodedLog log) {
        this.log = log;
    }

    static LogAttributes of(DecodedLog log) {
        return new LogAttributes(log);
    }

    /**
     * First present integer among {@code names} (ABIs disagree on e.g. {@code value} vs {@code amount}).
     */
    BigInteger integer(String... names) {
        for (String name : names) {
            Optional<BigInteger> value = log.integer(name);
            if (value.isPresent()) {
                return value.get();
            }
        }
        missing.add(String.join("|", names));
        return null;
    }

    String address(String... names) {
        for (String name : names) {
            Optional<String> value = log.address(name);
            if (value.isPresent()) {
                return value.get();
            }
        }
        missing.add(String.join("|", names));
        return null;
    }

    List<BigInteger> integers(String name) {
        Optional<List<BigInteger>> values = log.integers(name);
        if (values.isEmpty()) {
            missing.add(name);
            return null;
        }
        return values.get();
    }

    /**
     * bytes32 amount pair, given either as raw bytes or as an unsigned integer.
     */
    PackedAmounts packed(String name) {
        Optional<LogValue> value = log.attribute(name);
        if (value.isEmpty()) {
            missing.add(name);
            return null;
        }
        PackedAmounts decoded = decodePacked(value.get());
        if (decoded == null) {
            missing.add(name);
        }
        return decoded;
    }

    List<PackedAmounts> packedList(String name) {
        Optional<List<LogValue>> values = log.array(name);
        if (values.isEmpty()) {
            missing.add(name);
            return null;
        }
        List<PackedAmounts> out = new ArrayList<>(values.get().size());
        for (LogValue value : values.get()) {
            PackedAmounts decoded = decodePacked(value);
            if (decoded == null) {
                missing.add(name);
                return null;
            }
            out.add(decoded);
        }
        return out;
    }

    boolean hasMissing() {
        return !missing.isEmpty();
    }

    Set<String> missing() {
        return missing;
    }

    private static PackedAmounts decodePacked(LogValue value) {
        if (value instanceof LogValue.BytesValue bytes) {
            return PackedAmountCodec.decode(bytes.value());
        }
        if (value instanceof LogValue.IntegerValue integer) {
            return PackedAmountCodec.decode(integer.value());
        }
        return null;
    }
}
