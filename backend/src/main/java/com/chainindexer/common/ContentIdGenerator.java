package com.chainindexer.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Short content-addressed identifiers: SHA-256 over a canonical JSON encoding of the identifying
 * fields, truncated to {@link #ID_LENGTH} hex characters.
 * Keys are sorted and big integers are written as decimal strings so the encoding never depends
 * on insertion order or number formatting.
 */
public final class ContentIdGenerator {

    public static final int ID_LENGTH = 12;

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private ContentIdGenerator() {
    }

    public static String generate(Map<String, ?> identifyingFields) {
        if (identifyingFields == null || identifyingFields.isEmpty()) {
            throw new IllegalArgumentException("Identifying fields must not be empty");
        }
        byte[] encoded;
        try {
            encoded = CANONICAL.writeValueAsBytes(canonical(identifyingFields));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode identifying fields " + identifyingFields.keySet(), e);
        }
        return HexFormat.of().formatHex(sha256(encoded)).substring(0, ID_LENGTH);
    }

    private static Object canonical(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonical(v)));
            return sorted;
        }
        if (value instanceof Collection<?> values) {
            List<Object> out = new ArrayList<>(values.size());
            values.forEach(v -> out.add(canonical(v)));
            return out;
        }
        if (value instanceof BigInteger big) {
            return big.toString();
        }
        if (value instanceof Enum<?> e) {
            return e.name().toLowerCase();
        }
        return value;
    }

    private static byte[] sha256(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
