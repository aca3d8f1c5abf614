package com.esmp.envelope;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The subtype-specific part of a system envelope. One variant per subtype, each carrying exactly
 * the fields that subtype requires.
 */
public sealed interface SystemEvent {

    SystemSubtype subtype();

    /** Optional metadata seeds the new group; any of them may be null. */
    record GroupCreated(String name, String description, String dpUrl) implements SystemEvent {
        public SystemSubtype subtype() { return SystemSubtype.GROUP_CREATED; }
    }

    record Joined() implements SystemEvent {
        public SystemSubtype subtype() { return SystemSubtype.JOINED; }
    }

    record Left() implements SystemEvent {
        public SystemSubtype subtype() { return SystemSubtype.LEFT; }
    }

    record Removed(Address target) implements SystemEvent {
        public SystemSubtype subtype() { return SystemSubtype.REMOVED; }
    }

    record AdminAssigned(Address target) implements SystemEvent {
        public SystemSubtype subtype() { return SystemSubtype.ADMIN_ASSIGNED; }
    }

    record AdminRevoked(Address target) implements SystemEvent {
        public SystemSubtype subtype() { return SystemSubtype.ADMIN_REVOKED; }
    }

    record GroupRenamed(String newName) implements SystemEvent {
        public SystemSubtype subtype() { return SystemSubtype.GROUP_RENAMED; }
    }

    record DescriptionUpdated(String newDescription) implements SystemEvent {
        public SystemSubtype subtype() { return SystemSubtype.DESCRIPTION_UPDATED; }
    }

    record DpUpdated(String newDpUrl) implements SystemEvent {
        public SystemSubtype subtype() { return SystemSubtype.DP_UPDATED; }
    }

    /** {@code changes} is handed to the profile store as-is; field rules are enforced there. */
    record ProfileUpdated(JsonNode changes) implements SystemEvent {
        public SystemSubtype subtype() { return SystemSubtype.PROFILE_UPDATED; }
    }
}
