package com.esmp.thread;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Names one append-only thread: {@code group:<group_id>} for group threads,
 * {@code direct:<a>|<b>} (participants in sorted order) for direct threads.
 */
public record ThreadKey(String value) {

    private static final String GROUP_PREFIX = "group:";
    private static final String DIRECT_PREFIX = "direct:";

    public ThreadKey {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Thread key must not be blank");
        }
    }

    public static ThreadKey group(String groupId) {
        return new ThreadKey(GROUP_PREFIX + groupId);
    }

    /** The same key whichever participant is named first. */
    public static ThreadKey direct(String participant, String otherParticipant) {
        boolean ordered = participant.compareTo(otherParticipant) <= 0;
        String first = ordered ? participant : otherParticipant;
        String second = ordered ? otherParticipant : participant;
        return new ThreadKey(DIRECT_PREFIX + first + "|" + second);
    }

    public boolean isGroup() {
        return value.startsWith(GROUP_PREFIX);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
