package com.txlens.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Hex and ABI word helpers for JSON-RPC payloads: quantities, 32-byte words, addresses and ABI strings.
 */
public final class EvmHex {

    private EvmHex() {}

    private static final String DYNAMIC_STRING_OFFSET = "0000000000000000000000000000000000000000000000000000000000000020";

    /**
     * Parses a JSON-RPC quantity ("0x1a") or a 32-byte word. Null, blank or malformed input yields null.
     */
    public static BigInteger toBigInteger(String hex) {
        String raw = strip0x(hex);
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return new BigInteger(raw, 16);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Long toLong(String hex) {
        BigInteger value = toBigInteger(hex);
        return value == null || value.bitLength() > 63 ? null : value.longValue();
    }

    /** Last 20 bytes of a 32-byte word as a lower-case 0x address. */
    public static String wordToAddress(String word) {
        String raw = strip0x(word);
        if (raw == null || raw.length() < 40) {
            return null;
        }
        return "0x" + raw.substring(raw.length() - 40).toLowerCase(Locale.ROOT);
    }

    /**
     * The n-th 32-byte word of an ABI data blob, without 0x; null when the blob is too short.
     */
    public static String word(String data, int index) {
        String raw = strip0x(data);
        if (raw == null) {
            return null;
        }
        int start = index * 64;
        if (raw.length() < start + 64) {
            return null;
        }
        return raw.substring(start, start + 64);
    }

    /**
     * Decodes an eth_call result holding a string: either ABI dynamic (offset, length, bytes) or a
     * NUL-padded bytes32 as returned by older tokens. Unreadable input yields an empty string.
     */
    public static String decodeAbiString(String hex) {
        String raw = strip0x(hex);
        if (raw == null || raw.length() < 64) {
            return "";
        }
        try {
            if (raw.length() >= 128 && raw.startsWith(DYNAMIC_STRING_OFFSET)) {
                int len = Integer.parseInt(raw.substring(64, 128), 16);
                if (len <= 0 || raw.length() < 128 + len * 2) {
                    return "";
                }
                return new String(hexToBytes(raw.substring(128, 128 + len * 2)), StandardCharsets.UTF_8).trim();
            }
            byte[] bytes = hexToBytes(raw.substring(0, 64));
            int end = 0;
            while (end < bytes.length && bytes[end] != 0) end++;
            return new String(bytes, 0, end, StandardCharsets.UTF_8).trim();
        } catch (NumberFormatException e) {
            return "";
        }
    }

    /** {@code raw / 10^decimals}, stripped of trailing zeros. */
    public static BigDecimal scale(BigInteger raw, int decimals) {
        if (raw == null) {
            return null;
        }
        BigDecimal scaled = new BigDecimal(raw).movePointLeft(Math.max(0, decimals)).stripTrailingZeros();
        return scaled.scale() < 0 ? scaled.setScale(0) : scaled;
    }

    public static byte[] hexToBytes(String hex) {
        String raw = strip0x(hex);
        int len = raw.length();
        byte[] out = new byte[len / 2];
        for (int i = 0; i + 1 < len; i += 2) {
            out[i / 2] = (byte) Integer.parseInt(raw.substring(i, i + 2), 16);
        }
        return out;
    }

    public static String strip0x(String hex) {
        if (hex == null) {
            return null;
        }
        String trimmed = hex.strip();
        return trimmed.startsWith("0x") || trimmed.startsWith("0X") ? trimmed.substring(2) : trimmed;
    }
}
