package com.delta.catalogcrawler.crawl.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class HashUtils {
    private static final char PART_SEPARATOR = '\u001f';

    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Hash of several fields joined by a unit separator, so ("ab", "c") and ("a", "bc") differ.
     */
    public static String sha256Hex(String first, String... rest) {
        StringBuilder joined = new StringBuilder(first == null ? "" : first);
        for (String part : rest) {
            joined.append(PART_SEPARATOR).append(part == null ? "" : part);
        }
        return sha256Hex(joined.toString());
    }
}
