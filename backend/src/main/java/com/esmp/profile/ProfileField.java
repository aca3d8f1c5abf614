package com.esmp.profile;

/**
 * One profile value with its visibility. {@code value} is null when the field is unset.
 */
public record ProfileField(String value, Visibility visibility) {

    private static final ProfileField EMPTY = new ProfileField(null, Visibility.PRIVATE);

    public ProfileField {
        if (visibility == null) {
            visibility = Visibility.PRIVATE;
        }
    }

    public static ProfileField empty() {
        return EMPTY;
    }

    public boolean isSet() {
        return value != null;
    }

    public boolean isPublic() {
        return visibility == Visibility.PUBLIC;
    }

    public ProfileField withValue(String newValue) {
        return new ProfileField(newValue, visibility);
    }
}
