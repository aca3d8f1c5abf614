package com.esmp.envelope;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A {@code localpart#domain} identifier. Equality is exact string equality of both parts.
 */
public record Address(String localpart, String domain) implements Comparable<Address> {

    public Address {
        if (!isPart(localpart) || !isPart(domain)) {
            throw new IllegalArgumentException("Address parts must be non-empty and free of '#' and whitespace");
        }
    }

    public static Address parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Address is null");
        }
        int hash = text.indexOf('#');
        if (hash < 0) {
            throw new IllegalArgumentException("Address must have the form localpart#domain: " + text);
        }
        return new Address(text.substring(0, hash), text.substring(hash + 1));
    }

    private static boolean isPart(String part) {
        if (part == null || part.isEmpty()) {
            return false;
        }
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c == '#' || Character.isWhitespace(c) || Character.isISOControl(c)) {
                return false;
            }
        }
        return true;
    }

    @JsonValue
    @Override
    public String toString() {
        return localpart + "#" + domain;
    }

    @Override
    public int compareTo(Address other) {
        return toString().compareTo(other.toString());
    }
}
