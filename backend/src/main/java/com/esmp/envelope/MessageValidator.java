package com.esmp.envelope;

import com.esmp.crypto.PublicKeys;
import com.esmp.error.EsmpException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a signature-verified JSON object into a typed {@link Envelope}, enforcing the
 * required fields of its declared type and subtype. Pure; consults no server state.
 *
 * <p>Ordering against group state (stale timestamps) is checked later, inside the group's
 * critical section.
 */
@Component
public class MessageValidator {

    public Envelope validate(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw EsmpException.schema("envelope", "must be a JSON object");
        }
        String typeName = optionalText(raw, "type")
                .orElseThrow(() -> EsmpException.schema("type", "is required"));
        MessageType type = MessageType.fromWire(typeName)
                .orElseThrow(() -> EsmpException.schema("type", "unknown type '" + typeName + "'"));

        Set<Address> to = addresses(raw, "to");
        Set<Address> cc = addresses(raw, "cc");
        Optional<String> groupId = optionalText(raw, "group_id");
        String senderPubkey = PublicKeys.normalize(raw.path("sender_pubkey").asText());
        String signature = raw.path("signature").asText();

        if (type == MessageType.TEXT) {
            if (to.isEmpty() && groupId.isEmpty()) {
                throw EsmpException.schema("to", "a text message needs recipients or a group_id");
            }
            Optional<Address> from = optionalText(raw, "from").map(value -> address("from", value));
            JsonNode body = raw.has("body") ? raw.get("body") : NullNode.getInstance();
            return new TextEnvelope(to, cc, groupId, from, body, senderPubkey, signature, raw);
        }

        String subtypeName = optionalText(raw, "subtype")
                .orElseThrow(() -> EsmpException.schema("subtype", "is required for system messages"));
        SystemSubtype subtype = SystemSubtype.fromWire(subtypeName)
                .orElseThrow(() -> EsmpException.schema("subtype", "unknown subtype '" + subtypeName + "'"));
        Address actor = requiredAddress(raw, "actor");
        Instant timestamp = Timestamps.parse(raw.get("timestamp"), "timestamp");
        if (subtype.affectsGroup() && groupId.isEmpty()) {
            throw EsmpException.schema("group_id", "is required for " + subtype.wireName());
        }

        SystemEvent event = event(subtype, raw);
        return new SystemEnvelope(to, cc, groupId, actor, timestamp, event, senderPubkey, signature, raw);
    }

    private SystemEvent event(SystemSubtype subtype, JsonNode raw) {
        switch (subtype) {
            case GROUP_CREATED:
                return new SystemEvent.GroupCreated(
                        optionalText(raw, "new_name").orElse(null),
                        optionalText(raw, "new_description").orElse(null),
                        optionalText(raw, "new_dp_url").orElse(null));
            case JOINED:
                return new SystemEvent.Joined();
            case LEFT:
                return new SystemEvent.Left();
            case REMOVED:
                return new SystemEvent.Removed(requiredAddress(raw, "target"));
            case ADMIN_ASSIGNED:
                return new SystemEvent.AdminAssigned(requiredAddress(raw, "target"));
            case ADMIN_REVOKED:
                return new SystemEvent.AdminRevoked(requiredAddress(raw, "target"));
            case GROUP_RENAMED:
                return new SystemEvent.GroupRenamed(requiredText(raw, "new_name"));
            case DESCRIPTION_UPDATED:
                return new SystemEvent.DescriptionUpdated(requiredText(raw, "new_description"));
            case DP_UPDATED:
                return new SystemEvent.DpUpdated(requiredText(raw, "new_dp_url"));
            case PROFILE_UPDATED:
                JsonNode changes = raw.get("changes");
                if (changes == null || !changes.isObject()) {
                    throw EsmpException.schema("changes", "must be an object for profile_updated");
                }
                return new SystemEvent.ProfileUpdated(changes);
            default:
                throw new IllegalStateException("Unhandled subtype " + subtype);
        }
    }

    private static Optional<String> optionalText(JsonNode raw, String field) {
        JsonNode node = raw.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isTextual()) {
            throw EsmpException.schema(field, "must be a string");
        }
        if (node.textValue().isBlank()) {
            throw EsmpException.schema(field, "must not be blank");
        }
        return Optional.of(node.textValue());
    }

    private static String requiredText(JsonNode raw, String field) {
        return optionalText(raw, field).orElseThrow(() -> EsmpException.schema(field, "is required"));
    }

    private static Address requiredAddress(JsonNode raw, String field) {
        return address(field, requiredText(raw, field));
    }

    private static Address address(String field, String value) {
        try {
            return Address.parse(value);
        } catch (IllegalArgumentException e) {
            throw EsmpException.schema(field, "invalid address '" + value + "'");
        }
    }

    private static Set<Address> addresses(JsonNode raw, String field) {
        JsonNode node = raw.get(field);
        if (node == null || node.isNull()) {
            return Collections.emptySortedSet();
        }
        if (!node.isArray()) {
            throw EsmpException.schema(field, "must be an array of addresses");
        }
        TreeSet<Address> result = new TreeSet<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw EsmpException.schema(field, "must contain only address strings");
            }
            result.add(address(field, element.textValue()));
        }
        return Collections.unmodifiableSortedSet(result);
    }
}
