package com.esmp.profile;

import com.esmp.error.EsmpException;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Parses and validates a profile change set. The address comes out in plaintext; encrypting it is
 * the store's job.
 */
public final class ProfileUpdate {

    static final int MAX_NAME_LENGTH = 50;
    static final int MAX_ADDRESS_LENGTH = 200;

    private ProfileUpdate() {}

    /**
     * @param changes object keyed by field wire name; each value is a bare string, null, or
     *                {@code {"value": ..., "visibility": "public"|"private"}}
     * @throws EsmpException INVALID_FIELD for unknown keys and values breaking a field rule
     */
    public static Map<ProfileFieldName, ProfileField> parse(JsonNode changes) {
        if (changes == null || !changes.isObject()) {
            throw EsmpException.schema("fields", "must be an object");
        }
        EnumMap<ProfileFieldName, ProfileField> result = new EnumMap<>(ProfileFieldName.class);
        Iterator<Map.Entry<String, JsonNode>> entries = changes.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            ProfileFieldName name = ProfileFieldName.fromWire(entry.getKey())
                    .orElseThrow(() -> EsmpException.invalidField(entry.getKey(), "unknown profile field"));
            ProfileField field = field(name, entry.getValue());
            validate(name, field);
            result.put(name, field);
        }
        return Collections.unmodifiableMap(result);
    }

    private static ProfileField field(ProfileFieldName name, JsonNode node) {
        if (node == null || node.isNull()) {
            return ProfileField.empty();
        }
        if (node.isTextual()) {
            return new ProfileField(node.textValue(), Visibility.PRIVATE);
        }
        if (!node.isObject()) {
            throw EsmpException.invalidField(name.wireName(), "must be a string or an object with value and visibility");
        }
        JsonNode value = node.get("value");
        if (value != null && !value.isNull() && !value.isTextual()) {
            throw EsmpException.invalidField(name.wireName(), "value must be a string");
        }
        JsonNode visibilityNode = node.get("visibility");
        Visibility visibility = Visibility.PRIVATE;
        if (visibilityNode != null && !visibilityNode.isNull()) {
            visibility = Visibility.fromWire(visibilityNode.asText())
                    .orElseThrow(() -> EsmpException.invalidField(name.wireName(),
                            "visibility must be 'public' or 'private'"));
        }
        // Address is always private.
        if (name == ProfileFieldName.ADDRESS) {
            visibility = Visibility.PRIVATE;
        }
        return new ProfileField(value == null || value.isNull() ? null : value.textValue(), visibility);
    }

    private static void validate(ProfileFieldName name, ProfileField field) {
        if (!field.isSet()) {
            return;
        }
        String value = field.value();
        if (name.isName()) {
            validateName(name, value);
        } else if (name == ProfileFieldName.DISPLAY_PICTURE) {
            validateUrl(value);
        } else if (name == ProfileFieldName.ADDRESS
                && value.codePointCount(0, value.length()) > MAX_ADDRESS_LENGTH) {
            throw EsmpException.invalidField(name.wireName(), "must be at most " + MAX_ADDRESS_LENGTH + " characters");
        }
    }

    private static void validateName(ProfileFieldName name, String value) {
        if (value.codePointCount(0, value.length()) > MAX_NAME_LENGTH) {
            throw EsmpException.invalidField(name.wireName(), "must be at most " + MAX_NAME_LENGTH + " characters");
        }
        boolean allowed = value.codePoints()
                .allMatch(c -> Character.isLetter(c) || c == ' ' || c == '-' || c == '\'');
        if (!allowed) {
            throw EsmpException.invalidField(name.wireName(),
                    "may only contain letters, spaces, hyphens and apostrophes");
        }
    }

    private static void validateUrl(String value) {
        try {
            URI uri = new URI(value);
            if (!uri.isAbsolute() || uri.getHost() == null) {
                throw EsmpException.invalidField("display_picture", "must be an absolute URL");
            }
            uri.toURL();
        } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
            throw EsmpException.invalidField("display_picture", "is not a valid URL");
        }
    }
}
