package com.chainindexer.domain;

import com.chainindexer.common.EvmAddresses;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One ABI-decoded event emission. Attribute access is fetch-by-name and returns empty when the
 * attribute is absent or has a different shape.
 */
public record DecodedLog(int index, String contract, String signature, String name, Map<String, LogValue> attributes)
        implements TransactionLog {

    public DecodedLog {
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(name, "name");
        if (index < 0) {
            throw new IllegalArgumentException("Log index must be non-negative: " + index);
        }
        contract = EvmAddresses.normalize(contract);
        attributes = attributes == null ? Map.of() : copyAttributes(attributes);
    }

    public Optional<LogValue> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public Optional<BigInteger> integer(String key) {
        return attribute(key)
                .filter(LogValue.IntegerValue.class::isInstance)
                .map(v -> ((LogValue.IntegerValue) v).value());
    }

    public Optional<String> address(String key) {
        return attribute(key)
                .filter(LogValue.AddressValue.class::isInstance)
                .map(v -> ((LogValue.AddressValue) v).value());
    }

    public Optional<byte[]> bytes(String key) {
        return attribute(key)
                .filter(LogValue.BytesValue.class::isInstance)
                .map(v -> ((LogValue.BytesValue) v).value());
    }

    public Optional<List<LogValue>> array(String key) {
        return attribute(key)
                .filter(LogValue.ArrayValue.class::isInstance)
                .map(v -> ((LogValue.ArrayValue) v).values());
    }

    /**
     * Integer array attribute; empty if the attribute is missing or any element is not an integer.
     */
    public Optional<List<BigInteger>> integers(String key) {
        Optional<List<LogValue>> values = array(key);
        if (values.isEmpty()) {
            return Optional.empty();
        }
        List<BigInteger> out = new ArrayList<>(values.get().size());
        for (LogValue value : values.get()) {
            if (!(value instanceof LogValue.IntegerValue integer)) {
                return Optional.empty();
            }
            out.add(integer.value());
        }
        return Optional.of(out);
    }

    private static Map<String, LogValue> copyAttributes(Map<String, LogValue> source) {
        Map<String, LogValue> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
