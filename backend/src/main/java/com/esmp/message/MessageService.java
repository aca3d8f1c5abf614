package com.esmp.message;

import com.esmp.crypto.Canonicalizer;
import com.esmp.crypto.SignatureVerifier;
import com.esmp.envelope.Address;
import com.esmp.envelope.Envelope;
import com.esmp.envelope.MessageValidator;
import com.esmp.envelope.SystemEnvelope;
import com.esmp.envelope.SystemEvent;
import com.esmp.envelope.TextEnvelope;
import com.esmp.envelope.WireFormat;
import com.esmp.error.ErrorKind;
import com.esmp.error.EsmpException;
import com.esmp.group.GroupAppend;
import com.esmp.group.GroupService;
import com.esmp.profile.ProfileService;
import com.esmp.thread.ThreadKey;
import com.esmp.thread.ThreadLog;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Entry point for every envelope, whichever transport it arrived on.
 *
 * <p>Pipeline: parse strictly, canonicalise, verify the Ed25519 signature, validate the shape,
 * then route to the owner of the affected state. Nothing is looked at before the signature
 * verifies, and a rejected envelope leaves no trace in any store.
 */
@Service
public class MessageService {

    private static final Logger logger = LoggerFactory.getLogger(MessageService.class);

    private final WireFormat wireFormat;
    private final Canonicalizer canonicalizer;
    private final SignatureVerifier verifier;
    private final MessageValidator validator;
    private final GroupService groupService;
    private final ProfileService profileService;
    private final ThreadLog threadLog;

    public MessageService(WireFormat wireFormat, Canonicalizer canonicalizer, SignatureVerifier verifier,
                          MessageValidator validator, GroupService groupService, ProfileService profileService,
                          ThreadLog threadLog) {
        this.wireFormat = wireFormat;
        this.canonicalizer = canonicalizer;
        this.verifier = verifier;
        this.validator = validator;
        this.groupService = groupService;
        this.profileService = profileService;
        this.threadLog = threadLog;
    }

    /** Processes one serialised envelope (one TCP line or one POST body). */
    public Mono<Acceptance> submit(byte[] payload) {
        return Mono.defer(() -> {
                    Envelope envelope = authenticate(wireFormat.readObject(payload));
                    return route(envelope)
                            .doOnNext(acceptance -> logger.debug("Accepted {} from {} into {}",
                                    describe(envelope), envelope.senderPubkey(), acceptance.positions()));
                })
                .doOnError(EsmpException.class, e -> logger.info("Rejected envelope: {} {}", e.kind(), e.getMessage()));
    }

    /** Verifies the signature, then validates. */
    Envelope authenticate(ObjectNode raw) {
        String signature = textOrNull(raw.get("signature"));
        String senderPubkey = textOrNull(raw.get("sender_pubkey"));
        if (signature == null || senderPubkey == null) {
            throw new EsmpException(ErrorKind.SIGNATURE_INVALID, "signature and sender_pubkey are required");
        }
        byte[] canonical = canonicalizer.canonicalize(raw);
        if (!verifier.verify(canonical, signature, senderPubkey)) {
            throw new EsmpException(ErrorKind.SIGNATURE_INVALID, "signature does not verify against sender_pubkey");
        }
        return validator.validate(raw);
    }

    private Mono<Acceptance> route(Envelope envelope) {
        if (envelope instanceof SystemEnvelope system) {
            if (system.event() instanceof SystemEvent.ProfileUpdated update) {
                return profileService.applyUpdate(system.senderPubkey(), update.changes(), system.timestamp())
                        .thenReturn(new Acceptance(List.of(), system.recipients()));
            }
            return groupService.apply(system).map(appended -> groupAcceptance(appended, system));
        }
        TextEnvelope text = (TextEnvelope) envelope;
        if (text.groupId().isPresent()) {
            return groupService.appendText(text).map(appended -> groupAcceptance(appended, text));
        }
        return appendDirect(text);
    }

    // Recipients that are not known to this server are still logged, for later delivery.
    private Mono<Acceptance> appendDirect(TextEnvelope text) {
        Set<Address> recipients = text.recipients();
        String sender = text.senderIdentity();
        return Flux.fromIterable(recipients)
                .concatMap(recipient -> {
                    ThreadKey key = ThreadKey.direct(sender, recipient.toString());
                    return threadLog.append(key, text).map(seq -> new LogPosition(key, seq));
                })
                .collectList()
                .map(positions -> new Acceptance(positions, recipients));
    }

    private static Acceptance groupAcceptance(GroupAppend appended, Envelope envelope) {
        Set<Address> recipients = new TreeSet<>(appended.group().members());
        recipients.addAll(envelope.recipients());
        return new Acceptance(List.of(new LogPosition(appended.threadKey(), appended.seq())), recipients);
    }

    private static String describe(Envelope envelope) {
        if (envelope instanceof SystemEnvelope system) {
            return "system/" + system.subtype().wireName();
        }
        return "text";
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() && !node.textValue().isEmpty() ? node.textValue() : null;
    }
}
