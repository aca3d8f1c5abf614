package com.esmp.crypto;

import java.util.Base64;

/**
 * Public keys travel as standard base64, but URL paths and query strings may carry the
 * URL-safe alphabet instead, and padding may be dropped. All spellings name the same key.
 */
public final class PublicKeys {

    private PublicKeys() {}

    /**
     * Padded standard base64 form of {@code key}; input that is not base64 is returned unchanged.
     * A '+' decoded from a query string arrives as a space and is restored.
     */
    public static String normalize(String key) {
        if (key == null) {
            return null;
        }
        key = key.trim().replace(' ', '+');
        String standard = key.replace('-', '+').replace('_', '/');
        try {
            return Base64.getEncoder().encodeToString(Base64.getDecoder().decode(standard));
        } catch (IllegalArgumentException e) {
            return key;
        }
    }
}
