package com.bloomcart.scoring.util;

import com.bloomcart.scoring.model.RawProduct;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Canonical cache/dedup key for a scraped product.
 */
public final class ProductKeys {
    public static final String TITLE_PREFIX = "title:";

    private ProductKeys() {}

    /**
     * Trimmed, upper-cased ASIN when present; otherwise {@code title:} + SHA-256 of the trimmed title.
     */
    public static String of(RawProduct raw) {
        if (raw == null) return TITLE_PREFIX + sha256Hex("");
        return of(raw.getProductKey(), raw.getTitle());
    }

    public static String of(String productKey, String title) {
        if (productKey != null && !productKey.isBlank()) {
            return productKey.trim().toUpperCase(Locale.ROOT);
        }
        return TITLE_PREFIX + sha256Hex(title == null ? "" : title.trim());
    }

    /**
     * Normalizes a key received from a URL path the same way {@link #of(String, String)} does
     * for ASINs; title-derived keys pass through unchanged.
     */
    public static String canonical(String key) {
        if (key == null) return null;
        String k = key.trim();
        return k.startsWith(TITLE_PREFIX) ? k : k.toUpperCase(Locale.ROOT);
    }

    public static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
