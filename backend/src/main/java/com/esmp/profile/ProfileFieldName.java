package com.esmp.profile;

import java.util.Optional;

/** The editable profile fields, by their wire names. */
public enum ProfileFieldName {
    FIRST_NAME("first_name"),
    MIDDLE_NAME("middle_name"),
    LAST_NAME("last_name"),
    DISPLAY_PICTURE("display_picture"),
    ADDRESS("address");

    private final String wireName;

    ProfileFieldName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isName() {
        return this == FIRST_NAME || this == MIDDLE_NAME || this == LAST_NAME;
    }

    public static Optional<ProfileFieldName> fromWire(String name) {
        for (ProfileFieldName field : values()) {
            if (field.wireName.equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
