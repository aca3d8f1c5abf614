package com.esmp.envelope;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A signature-verified, shape-validated envelope. {@link #raw()} is the JSON object exactly as
 * received; it is what gets persisted, so a stored envelope can always be re-verified.
 */
public sealed interface Envelope permits TextEnvelope, SystemEnvelope {

    Set<Address> to();

    Set<Address> cc();

    Optional<String> groupId();

    String senderPubkey();

    String signature();

    JsonNode raw();

    MessageType type();

    /** {@code to} and {@code cc} together, ordered. */
    default Set<Address> recipients() {
        Set<Address> all = new TreeSet<>(to());
        all.addAll(cc());
        return all;
    }
}
