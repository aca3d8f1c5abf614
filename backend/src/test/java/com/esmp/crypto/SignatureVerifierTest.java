package com.esmp.crypto;

import com.esmp.crypto.SigningTestUtils.Identity;
import com.esmp.envelope.TestEnvelopes;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class SignatureVerifierTest {

    private final Canonicalizer canonicalizer = new Canonicalizer();
    private final SignatureVerifier verifier = new SignatureVerifier();
    private final Identity alice = SigningTestUtils.newIdentity();

    private boolean verify(ObjectNode envelope) {
        return verifier.verify(canonicalizer.canonicalize(envelope),
                envelope.get("signature").asText(), envelope.get("sender_pubkey").asText());
    }

    @Test
    void signedEnvelopeVerifies() {
        ObjectNode envelope = alice.sign(TestEnvelopes.groupCreated("g1", "alice#x", "2024-01-01T00:00:00Z"));

        assertTrue(verify(envelope));
    }

    @Test
    void tamperingAnySignedFieldBreaksTheSignature() {
        ObjectNode envelope = alice.sign(TestEnvelopes.groupCreated("g1", "alice#x", "2024-01-01T00:00:00Z"));

        assertFalse(verify(envelope.deepCopy().put("actor", "mallory#x")));
        assertFalse(verify(envelope.deepCopy().put("timestamp", "2024-01-01T00:00:01Z")));
        assertFalse(verify(envelope.deepCopy().put("extra", "field")));
        ObjectNode withoutName = envelope.deepCopy();
        withoutName.remove("new_name");
        assertFalse(verify(withoutName));
    }

    @Test
    void reorderedEnvelopeStillVerifies() {
        ObjectNode envelope = alice.sign(TestEnvelopes.groupCreated("g1", "alice#x", "2024-01-01T00:00:00Z"));
        ObjectNode reordered = envelope.objectNode();
        envelope.properties().stream()
                .sorted((a, b) -> b.getKey().compareTo(a.getKey()))
                .forEach(entry -> reordered.set(entry.getKey(), entry.getValue()));

        assertTrue(verify(reordered));
    }

    @Test
    void otherKeyDoesNotVerify() {
        ObjectNode envelope = alice.sign(TestEnvelopes.groupCreated("g1", "alice#x", "2024-01-01T00:00:00Z"));
        envelope.put("sender_pubkey", SigningTestUtils.newIdentity().pubkey());

        assertFalse(verify(envelope));
    }

    @Test
    void garbageKeysAndSignaturesFailInsteadOfThrowing() {
        byte[] message = "{}".getBytes();
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);
        String signature = alice.signBytes(message);

        assertFalse(verifier.verify(message, signature, shortKey));
        assertFalse(verifier.verify(message, "not base64!", alice.pubkey()));
        assertFalse(verifier.verify(message, Base64.getEncoder().encodeToString(new byte[10]), alice.pubkey()));
        assertFalse(verifier.verify(message, null, alice.pubkey()));
        assertTrue(verifier.verify(message, signature, alice.pubkey()));
    }
}
