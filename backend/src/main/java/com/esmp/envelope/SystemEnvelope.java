package com.esmp.envelope;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

public record SystemEnvelope(
        Set<Address> to,
        Set<Address> cc,
        Optional<String> groupId,
        Address actor,
        Instant timestamp,
        SystemEvent event,
        String senderPubkey,
        String signature,
        JsonNode raw
) implements Envelope {

    @Override
    public MessageType type() {
        return MessageType.SYSTEM;
    }

    public SystemSubtype subtype() {
        return event.subtype();
    }
}
