package com.esmp.envelope;

import java.util.Optional;

/**
 * The {@code subtype} values of system envelopes.
 */
public enum SystemSubtype {

    GROUP_CREATED("group_created"),
    JOINED("joined"),
    LEFT("left"),
    REMOVED("removed"),
    ADMIN_ASSIGNED("admin_assigned"),
    ADMIN_REVOKED("admin_revoked"),
    GROUP_RENAMED("group_renamed"),
    DESCRIPTION_UPDATED("description_updated"),
    DP_UPDATED("dp_updated"),
    PROFILE_UPDATED("profile_updated");

    private final String wireName;

    SystemSubtype(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Every subtype except {@code profile_updated} acts on a group. */
    public boolean affectsGroup() {
        return this != PROFILE_UPDATED;
    }

    public static Optional<SystemSubtype> fromWire(String name) {
        for (SystemSubtype subtype : values()) {
            if (subtype.wireName.equals(name)) {
                return Optional.of(subtype);
            }
        }
        return Optional.empty();
    }
}
