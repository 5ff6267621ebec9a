package com.sharesgate.common;

import java.util.Locale;

/**
 * Canonical on-chain address form shared by every chain: lower-case hex without a {@code 0x} prefix.
 * Ledger keys, identity mappings and community records are all stored in this form.
 */
public final class Addresses {

    private Addresses() {
    }

    public static String normalize(String address) {
        if (address == null) {
            return null;
        }
        String trimmed = address.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith("0x") ? trimmed.substring(2) : trimmed;
    }

    public static String withPrefix(String address) {
        String normalized = normalize(address);
        return normalized == null ? null : "0x" + normalized;
    }

    /** True when the value is exactly {@code hexChars} hex digits after normalization. */
    public static boolean isHex(String address, int hexChars) {
        String normalized = normalize(address);
        if (normalized == null || normalized.length() != hexChars) {
            return false;
        }
        for (int i = 0; i < normalized.length(); i++) {
            if (Character.digit(normalized.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /** Left-pads a normalized address to a 32-byte ABI word. */
    public static String toWord(String address) {
        String normalized = normalize(address);
        return "0".repeat(Math.max(0, 64 - normalized.length())) + normalized;
    }
}
