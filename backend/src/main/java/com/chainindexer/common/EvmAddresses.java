package com.chainindexer.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Address helpers. All addresses inside the engine are lower-cased so map lookups are case-insensitive.
 */
public final class EvmAddresses {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private EvmAddresses() {
    }

    public static String normalize(String address) {
        return address == null ? null : address.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isZero(String address) {
        return ZERO_ADDRESS.equals(normalize(address));
    }

    public static boolean isValid(String address) {
        return address != null && EVM_ADDRESS.matcher(address.trim()).matches();
    }

    public static boolean same(String a, String b) {
        return a != null && b != null && normalize(a).equals(normalize(b));
    }
}
