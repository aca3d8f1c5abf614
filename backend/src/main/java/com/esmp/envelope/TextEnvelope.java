package com.esmp.envelope;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.Set;

/**
 * @param body opaque payload; never inspected, only signed over and transported
 * @param from optional sender address used to name direct threads
 */
public record TextEnvelope(
        Set<Address> to,
        Set<Address> cc,
        Optional<String> groupId,
        Optional<Address> from,
        JsonNode body,
        String senderPubkey,
        String signature,
        JsonNode raw
) implements Envelope {

    @Override
    public MessageType type() {
        return MessageType.TEXT;
    }

    /** The identity a direct thread is keyed by on the sender's side. */
    public String senderIdentity() {
        return from.map(Address::toString).orElse(senderPubkey);
    }
}
