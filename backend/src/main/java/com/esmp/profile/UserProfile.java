package com.esmp.profile;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Stored profile of one public key. The {@code address} field holds ciphertext.
 *
 * @param updatedAt timestamp of the last applied update, null for a profile that was never written
 */
public record UserProfile(String pubkey, Map<ProfileFieldName, ProfileField> fields, Instant updatedAt) {

    public UserProfile {
        EnumMap<ProfileFieldName, ProfileField> copy = new EnumMap<>(ProfileFieldName.class);
        copy.putAll(fields);
        fields = Collections.unmodifiableMap(copy);
    }

    public static UserProfile empty(String pubkey) {
        return new UserProfile(pubkey, new EnumMap<>(ProfileFieldName.class), null);
    }

    public ProfileField field(ProfileFieldName name) {
        return fields.getOrDefault(name, ProfileField.empty());
    }

    /** Listed fields replace the stored ones; the rest are kept. */
    public UserProfile merge(Map<ProfileFieldName, ProfileField> changes, Instant timestamp) {
        EnumMap<ProfileFieldName, ProfileField> merged = new EnumMap<>(ProfileFieldName.class);
        merged.putAll(fields);
        merged.putAll(changes);
        return new UserProfile(pubkey, merged, timestamp);
    }
}
