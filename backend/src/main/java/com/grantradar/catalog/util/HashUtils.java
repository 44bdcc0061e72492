package com.grantradar.catalog.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtils {
    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /** Short stable identifier for a listing that arrives without one. */
    public static String listingId(String prefix, String title, String url) {
        String payload = (title == null ? "" : title.trim()) + "\n" + (url == null ? "" : url.trim());
        return prefix + "-" + sha256Hex(payload).substring(0, 12);
    }
}
