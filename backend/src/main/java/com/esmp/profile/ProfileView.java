package com.esmp.profile;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.function.Predicate;

/**
 * A profile as shown to one reader. Fields the reader may not see are left out entirely.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProfileView(
        String pubkey,
        ViewField firstName,
        ViewField middleName,
        ViewField lastName,
        ViewField displayPicture,
        ViewField address,
        Instant updatedAt
) {

    public record ViewField(String value, Visibility visibility) {}

    /** Everything, with {@code plainAddress} in place of the stored ciphertext. */
    static ProfileView owner(UserProfile profile, String plainAddress) {
        ProfileField address = profile.field(ProfileFieldName.ADDRESS);
        return new ProfileView(
                profile.pubkey(),
                visible(profile, ProfileFieldName.FIRST_NAME, field -> true),
                visible(profile, ProfileFieldName.MIDDLE_NAME, field -> true),
                visible(profile, ProfileFieldName.LAST_NAME, field -> true),
                visible(profile, ProfileFieldName.DISPLAY_PICTURE, field -> true),
                address.isSet() ? new ViewField(plainAddress, Visibility.PRIVATE) : null,
                profile.updatedAt());
    }

    /** Public fields only; the address is never public. */
    static ProfileView publicView(UserProfile profile) {
        return new ProfileView(
                profile.pubkey(),
                visible(profile, ProfileFieldName.FIRST_NAME, ProfileField::isPublic),
                visible(profile, ProfileFieldName.MIDDLE_NAME, ProfileField::isPublic),
                visible(profile, ProfileFieldName.LAST_NAME, ProfileField::isPublic),
                visible(profile, ProfileFieldName.DISPLAY_PICTURE, ProfileField::isPublic),
                null,
                profile.updatedAt());
    }

    private static ViewField visible(UserProfile profile, ProfileFieldName name, Predicate<ProfileField> allowed) {
        ProfileField field = profile.field(name);
        if (!field.isSet() || !allowed.test(field)) {
            return null;
        }
        return new ViewField(field.value(), field.visibility());
    }
}
