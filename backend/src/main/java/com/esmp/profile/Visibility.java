package com.esmp.profile;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum Visibility {
    PUBLIC("public"),
    PRIVATE("private");

    private final String wireName;

    Visibility(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<Visibility> fromWire(String name) {
        for (Visibility visibility : values()) {
            if (visibility.wireName.equals(name)) {
                return Optional.of(visibility);
            }
        }
        return Optional.empty();
    }
}
