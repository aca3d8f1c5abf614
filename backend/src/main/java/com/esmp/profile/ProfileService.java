package com.esmp.profile;

import com.esmp.config.EsmpProperties;
import com.esmp.crypto.AddressCipher;
import com.esmp.crypto.Canonicalizer;
import com.esmp.crypto.PublicKeys;
import com.esmp.crypto.SignatureVerifier;
import com.esmp.envelope.Timestamps;
import com.esmp.error.ErrorKind;
import com.esmp.error.EsmpException;
import com.esmp.support.KeyedSerializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Profile store keyed by public key.
 *
 * <p>Only the owning key can write a profile. Updates to one key are serialised and must carry
 * strictly increasing timestamps. The address is encrypted before it is stored and decrypted only
 * for a read proven to come from the owner.
 */
@Service
public class ProfileService {

    private static final Logger logger = LoggerFactory.getLogger(ProfileService.class);

    private static final Set<String> BODY_UNSIGNED = Set.of("signature");

    private final ProfileRepository repository;
    private final AddressCipher addressCipher;
    private final Canonicalizer canonicalizer;
    private final SignatureVerifier verifier;
    private final Duration readSkew;
    private final Clock clock;

    private final KeyedSerializer serializer = new KeyedSerializer();

    public ProfileService(ProfileRepository repository, AddressCipher addressCipher, Canonicalizer canonicalizer,
                          SignatureVerifier verifier, EsmpProperties properties, Clock clock) {
        this.repository = repository;
        this.addressCipher = addressCipher;
        this.canonicalizer = canonicalizer;
        this.verifier = verifier;
        this.readSkew = properties.profile().readSkew();
        this.clock = clock;
    }

    /**
     * Merges {@code changes} into the profile of {@code pubkey}. The caller has already established
     * that the change was signed by {@code pubkey}.
     */
    public Mono<UserProfile> applyUpdate(String pubkey, JsonNode changes, Instant timestamp) {
        String owner = PublicKeys.normalize(pubkey);
        return Mono.fromCallable(() -> ProfileUpdate.parse(changes))
                .flatMap(parsed -> serializer.submit(owner, () -> load(owner)
                        .flatMap(current -> {
                            if (current.updatedAt() != null && !timestamp.isAfter(current.updatedAt())) {
                                return Mono.error(new EsmpException(ErrorKind.STALE_MUTATION,
                                        "timestamp: must be after " + current.updatedAt()));
                            }
                            UserProfile next = current.merge(encryptAddress(owner, parsed), timestamp);
                            return repository.save(ProfileEntity.from(next)).thenReturn(next);
                        })))
                .doOnNext(profile -> logger.debug("Profile {} updated at {}", owner, timestamp));
    }

    /**
     * Handles {@code PUT /users/{pubkey}/profile}: verifies the body signature against the path key,
     * applies the update and returns the owner's view.
     */
    public Mono<ProfileView> applySignedUpdate(String pathPubkey, ObjectNode body) {
        String owner = PublicKeys.normalize(pathPubkey);
        return Mono.defer(() -> {
            JsonNode signature = body.get("signature");
            if (signature == null || !signature.isTextual()) {
                return Mono.error(new EsmpException(ErrorKind.FORBIDDEN, "signature: is required"));
            }
            byte[] canonical = canonicalizer.canonicalize(body, BODY_UNSIGNED);
            if (!verifier.verify(canonical, signature.textValue(), owner)) {
                return Mono.error(new EsmpException(ErrorKind.FORBIDDEN,
                        "signature does not match the profile key"));
            }
            JsonNode fields = body.get("fields");
            if (fields == null || !fields.isObject()) {
                return Mono.error(EsmpException.schema("fields", "is required"));
            }
            Instant timestamp = Timestamps.parse(body.get("timestamp"), "timestamp");
            return applyUpdate(owner, fields, timestamp);
        }).map(this::ownerView);
    }

    /**
     * Profile of {@code pubkey} as seen by {@code as}. A reader naming the profile key itself must
     * prove it with {@code proof}; any other reader gets the public view.
     */
    public Mono<ProfileView> getProfile(String pubkey, String as, OwnerProof proof) {
        String owner = PublicKeys.normalize(pubkey);
        String requester = PublicKeys.normalize(as);
        boolean ownerRead = owner.equals(requester);
        return Mono.defer(() -> {
            if (ownerRead) {
                checkOwnerProof(owner, proof);
            }
            return repository.findById(owner)
                    .map(ProfileEntity::toProfile)
                    .map(profile -> ownerRead ? ownerView(profile) : ProfileView.publicView(profile));
        });
    }

    private void checkOwnerProof(String owner, OwnerProof proof) {
        if (proof == null || !proof.isPresent()) {
            throw new EsmpException(ErrorKind.FORBIDDEN, "owner reads must be signed");
        }
        Instant signedAt;
        try {
            signedAt = Timestamps.parse(proof.timestamp(), OwnerProof.TIMESTAMP_HEADER);
        } catch (EsmpException e) {
            throw new EsmpException(ErrorKind.FORBIDDEN, e.getMessage());
        }
        if (Duration.between(signedAt, clock.instant()).abs().compareTo(readSkew) > 0) {
            throw new EsmpException(ErrorKind.FORBIDDEN, "read signature has expired");
        }
        ObjectNode signed = JsonNodeFactory.instance.objectNode()
                .put("as", owner)
                .put("pubkey", owner)
                .put("timestamp", proof.timestamp());
        if (!verifier.verify(canonicalizer.canonicalize(signed), proof.signature(), owner)) {
            throw new EsmpException(ErrorKind.FORBIDDEN, "read signature does not match the profile key");
        }
    }

    private Mono<UserProfile> load(String pubkey) {
        return repository.findById(pubkey)
                .map(ProfileEntity::toProfile)
                .defaultIfEmpty(UserProfile.empty(pubkey));
    }

    private Map<ProfileFieldName, ProfileField> encryptAddress(String owner, Map<ProfileFieldName, ProfileField> parsed) {
        ProfileField address = parsed.get(ProfileFieldName.ADDRESS);
        if (address == null || !address.isSet()) {
            return parsed;
        }
        EnumMap<ProfileFieldName, ProfileField> result = new EnumMap<>(ProfileFieldName.class);
        result.putAll(parsed);
        result.put(ProfileFieldName.ADDRESS, address.withValue(addressCipher.encrypt(owner, address.value())));
        return result;
    }

    private ProfileView ownerView(UserProfile profile) {
        ProfileField address = profile.field(ProfileFieldName.ADDRESS);
        String plain = address.isSet() ? addressCipher.decrypt(profile.pubkey(), address.value()) : null;
        return ProfileView.owner(profile, plain);
    }
}
