package com.esmp.crypto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PublicKeysTest {

    private final String key = SigningTestUtils.newIdentity().pubkey();

    @Test
    void everySpellingOfAKeyNormalisesToPaddedStandardBase64() {
        String unpadded = key.replace("=", "");
        String urlSafe = unpadded.replace('+', '-').replace('/', '_');
        String fromQueryString = key.replace('+', ' ');

        assertEquals(key, PublicKeys.normalize(key));
        assertEquals(key, PublicKeys.normalize(unpadded));
        assertEquals(key, PublicKeys.normalize(urlSafe));
        assertEquals(key, PublicKeys.normalize(fromQueryString));
    }

    @Test
    void nonBase64IsLeftAlone() {
        assertEquals("alice#x", PublicKeys.normalize("alice#x"));
        assertNull(PublicKeys.normalize(null));
    }
}
