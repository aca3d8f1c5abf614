package com.esmp.profile;

import com.esmp.config.EsmpProperties;
import com.esmp.crypto.AddressCipher;
import com.esmp.crypto.Canonicalizer;
import com.esmp.crypto.SignatureVerifier;
import com.esmp.crypto.SigningTestUtils;
import com.esmp.crypto.SigningTestUtils.Identity;
import com.esmp.error.ErrorKind;
import com.esmp.error.EsmpException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Profile store behaviour with an in-memory repository: ownership, visibility,
 * field rules, ordering and address encryption.
 */
@ExtendWith(MockitoExtension.class)
class ProfileServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private ProfileRepository repository;

    private final Map<String, ProfileEntity> stored = new ConcurrentHashMap<>();
    private final Canonicalizer canonicalizer = new Canonicalizer();
    private final Identity alice = SigningTestUtils.newIdentity();
    private final Identity mallory = SigningTestUtils.newIdentity();

    private ProfileService profileService;

    @BeforeEach
    void setup() {
        EsmpProperties properties = new EsmpProperties(
                new EsmpProperties.Tcp(false, "127.0.0.1", 0, 65536),
                new EsmpProperties.Profile(null, Duration.ofMinutes(5)));
        AddressCipher cipher = new AddressCipher("0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8));
        profileService = new ProfileService(repository, cipher, canonicalizer, new SignatureVerifier(),
                properties, Clock.fixed(NOW, ZoneOffset.UTC));

        lenient().when(repository.findById(anyString()))
                .thenAnswer(invocation -> Mono.justOrEmpty(stored.get(invocation.<String>getArgument(0))));
        lenient().when(repository.save(any(ProfileEntity.class))).thenAnswer(invocation -> {
            ProfileEntity entity = invocation.getArgument(0);
            stored.put(entity.getPubkey(), entity);
            return Mono.just(entity);
        });
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static ObjectNode body(String timestamp) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.putObject("fields");
        body.put("timestamp", timestamp);
        return body;
    }

    private static ObjectNode fullBody(String timestamp) {
        ObjectNode body = body(timestamp);
        ObjectNode fields = (ObjectNode) body.get("fields");
        fields.putObject("first_name").put("value", "Alice").put("visibility", "public");
        fields.putObject("last_name").put("value", "Smith").put("visibility", "private");
        fields.put("address", "1 Main Street");
        return body;
    }

    private OwnerProof proof(Identity owner, Instant at) {
        String timestamp = at.toString();
        ObjectNode signed = JsonNodeFactory.instance.objectNode()
                .put("as", owner.pubkey())
                .put("pubkey", owner.pubkey())
                .put("timestamp", timestamp);
        return new OwnerProof(timestamp, owner.signBytes(canonicalizer.canonicalize(signed)));
    }

    private static void assertKind(ErrorKind kind, Throwable e) {
        assertEquals(kind, assertInstanceOf(EsmpException.class, e).kind());
    }

    // ── Tests ─────────────────────────────────────────────────────────────────

    @Test
    void visibilityDependsOnTheReader() {
        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(fullBody("2024-06-01T11:00:00Z"))))
                .assertNext(view -> assertEquals("1 Main Street", view.address().value()))
                .verifyComplete();

        StepVerifier.create(profileService.getProfile(alice.pubkey(), mallory.pubkey(), new OwnerProof(null, null)))
                .assertNext(view -> {
                    assertEquals("Alice", view.firstName().value());
                    assertNull(view.lastName());
                    assertNull(view.address());
                })
                .verifyComplete();

        StepVerifier.create(profileService.getProfile(alice.pubkey(), alice.pubkey(), proof(alice, NOW)))
                .assertNext(view -> {
                    assertEquals("Alice", view.firstName().value());
                    assertEquals("Smith", view.lastName().value());
                    assertEquals(Visibility.PRIVATE, view.lastName().visibility());
                    assertEquals("1 Main Street", view.address().value());
                    assertEquals(Instant.parse("2024-06-01T11:00:00Z"), view.updatedAt());
                })
                .verifyComplete();
    }

    @Test
    void addressIsStoredEncrypted() {
        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(fullBody("2024-06-01T11:00:00Z"))))
                .expectNextCount(1)
                .verifyComplete();

        String atRest = stored.get(alice.pubkey()).getValues().get("address");
        assertNotNull(atRest);
        assertFalse(atRest.contains("Main"));
        assertEquals("private", stored.get(alice.pubkey()).getVisibility().get("address"));
    }

    @Test
    void tooLongNameCreatesNothing() {
        ObjectNode body = body("2024-06-01T11:00:00Z");
        ((ObjectNode) body.get("fields")).putObject("first_name").put("value", "a".repeat(51)).put("visibility", "public");

        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(body)))
                .expectErrorSatisfies(e -> assertKind(ErrorKind.INVALID_FIELD, e))
                .verify();

        verify(repository, never()).save(any());
        assertTrue(stored.isEmpty());
    }

    @Test
    void onlyTheOwnerMayWrite() {
        ObjectNode signedByMallory = mallory.signBody(fullBody("2024-06-01T11:00:00Z"));

        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), signedByMallory))
                .expectErrorSatisfies(e -> assertKind(ErrorKind.FORBIDDEN, e))
                .verify();

        ObjectNode unsigned = fullBody("2024-06-01T11:00:00Z");
        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), unsigned))
                .expectErrorSatisfies(e -> assertKind(ErrorKind.FORBIDDEN, e))
                .verify();

        ObjectNode tampered = alice.signBody(fullBody("2024-06-01T11:00:00Z"));
        ((ObjectNode) tampered.get("fields")).put("first_name", "Mallory");
        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), tampered))
                .expectErrorSatisfies(e -> assertKind(ErrorKind.FORBIDDEN, e))
                .verify();
    }

    @Test
    void missingTimestampIsASchemaViolation() {
        ObjectNode body = fullBody("unused");
        body.remove("timestamp");

        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(body)))
                .expectErrorSatisfies(e -> assertKind(ErrorKind.SCHEMA_VIOLATION, e))
                .verify();
    }

    @Test
    void updatesMustMoveForward() {
        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(fullBody("2024-06-01T11:00:00Z"))))
                .expectNextCount(1)
                .verifyComplete();

        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(fullBody("2024-06-01T11:00:00Z"))))
                .expectErrorSatisfies(e -> assertKind(ErrorKind.STALE_MUTATION, e))
                .verify();
        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(fullBody("2024-06-01T10:00:00Z"))))
                .expectErrorSatisfies(e -> assertKind(ErrorKind.STALE_MUTATION, e))
                .verify();
    }

    @Test
    void replayWithinTheStoredMillisecondIsStale() {
        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(fullBody("2024-06-01T11:00:00.0005Z"))))
                .expectNextCount(1)
                .verifyComplete();
        ProfileEntity entity = stored.values().iterator().next();
        assertEquals(Instant.parse("2024-06-01T11:00:00Z"), entity.getUpdatedAt());
        assertEquals(entity.getUpdatedAt(), entity.toProfile().updatedAt());

        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(fullBody("2024-06-01T11:00:00.0009Z"))))
                .expectErrorSatisfies(e -> assertKind(ErrorKind.STALE_MUTATION, e))
                .verify();
        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(fullBody("2024-06-01T11:00:00.0005Z"))))
                .expectErrorSatisfies(e -> assertKind(ErrorKind.STALE_MUTATION, e))
                .verify();
        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(fullBody("2024-06-01T11:00:00.001Z"))))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    void updatesMergeWithStoredFields() {
        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(fullBody("2024-06-01T11:00:00Z"))))
                .expectNextCount(1)
                .verifyComplete();

        ObjectNode second = body("2024-06-01T11:30:00Z");
        ((ObjectNode) second.get("fields")).put("middle_name", "Jane");
        ((ObjectNode) second.get("fields")).putNull("last_name");

        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(second)))
                .assertNext(view -> {
                    assertEquals("Alice", view.firstName().value());
                    assertEquals("Jane", view.middleName().value());
                    assertNull(view.lastName());
                    assertEquals("1 Main Street", view.address().value());
                })
                .verifyComplete();
    }

    @Test
    void ownerReadsNeedAFreshSignature() {
        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(fullBody("2024-06-01T11:00:00Z"))))
                .expectNextCount(1)
                .verifyComplete();

        StepVerifier.create(profileService.getProfile(alice.pubkey(), alice.pubkey(), new OwnerProof(null, null)))
                .expectErrorSatisfies(e -> assertKind(ErrorKind.FORBIDDEN, e))
                .verify();
        StepVerifier.create(profileService.getProfile(alice.pubkey(), alice.pubkey(), proof(alice, NOW.minusSeconds(600))))
                .expectErrorSatisfies(e -> assertKind(ErrorKind.FORBIDDEN, e))
                .verify();
        StepVerifier.create(profileService.getProfile(alice.pubkey(), alice.pubkey(), proof(mallory, NOW)))
                .expectErrorSatisfies(e -> assertKind(ErrorKind.FORBIDDEN, e))
                .verify();
    }

    @Test
    void urlSafeKeyNamesTheSameProfile() {
        StepVerifier.create(profileService.applySignedUpdate(alice.pubkey(), alice.signBody(fullBody("2024-06-01T11:00:00Z"))))
                .expectNextCount(1)
                .verifyComplete();
        String urlSafe = alice.pubkey().replace('+', '-').replace('/', '_');

        StepVerifier.create(profileService.getProfile(urlSafe, null, new OwnerProof(null, null)))
                .assertNext(view -> assertEquals(alice.pubkey(), view.pubkey()))
                .verifyComplete();
    }

    @Test
    void profileUpdatedMessageWritesTheSendersProfile() {
        ObjectNode changes = JsonNodeFactory.instance.objectNode().put("first_name", "Alice");

        StepVerifier.create(profileService.applyUpdate(alice.pubkey(), changes, NOW))
                .assertNext(profile -> {
                    assertEquals(alice.pubkey(), profile.pubkey());
                    assertEquals("Alice", profile.field(ProfileFieldName.FIRST_NAME).value());
                    assertEquals(NOW, profile.updatedAt());
                })
                .verifyComplete();
    }

    @Test
    void neverWrittenProfileIsEmpty() {
        StepVerifier.create(profileService.getProfile(alice.pubkey(), null, new OwnerProof(null, null)))
                .verifyComplete();
    }
}
