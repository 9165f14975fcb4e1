package com.distributedsystems.archon.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

public final class CryptoUtil {

    private static final HexFormat HEX = HexFormat.of();

    private CryptoUtil() {
    }

    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String toHex(byte[] data) {
        return HEX.formatHex(data);
    }

    public static byte[] fromHex(String hex) {
        return HEX.parseHex(hex);
    }

    public static boolean isHex(String value, int expectedLength) {
        if (value == null || value.length() != expectedLength) return false;
        for (int i = 0; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) return false;
        }
        return true;
    }

    /** 33-byte compressed secp256k1 point in hex: {@code 02|03} followed by the x coordinate. */
    public static boolean isCompressedPubkey(String value) {
        return isHex(value, 66) && (value.startsWith("02") || value.startsWith("03"));
    }

    public static String normalizeHex(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    /** First 10 hex chars, used as a log prefix. */
    public static String shortKey(String pubkey) {
        if (pubkey == null || pubkey.isEmpty()) return "?";
        return pubkey.length() <= 10 ? pubkey : pubkey.substring(0, 10);
    }
}
