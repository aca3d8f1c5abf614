package com.esmp.group;

import com.esmp.envelope.Envelope;
import com.esmp.envelope.MessageValidator;
import com.esmp.envelope.SystemEnvelope;
import com.esmp.envelope.TextEnvelope;
import com.esmp.error.ErrorKind;
import com.esmp.error.EsmpException;
import com.esmp.support.KeyedSerializer;
import com.esmp.thread.ThreadEntry;
import com.esmp.thread.ThreadKey;
import com.esmp.thread.ThreadLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns all group state.
 *
 * <p>Every mutation for a group runs inside that group's queue: load the current state, compute
 * the next state, append the envelope to the group thread, and only then publish the new state.
 * If the append fails nothing changes. The snapshot written afterwards is an optimisation;
 * when it is missing or behind, loading replays the thread from the snapshot's sequence number.
 */
@Service
public class GroupService {

    private static final Logger logger = LoggerFactory.getLogger(GroupService.class);

    private final GroupRepository repository;
    private final ThreadLog threadLog;
    private final GroupStateMachine stateMachine;
    private final MessageValidator validator;

    private final KeyedSerializer serializer = new KeyedSerializer();
    private final ConcurrentHashMap<String, GroupMetadata> groups = new ConcurrentHashMap<>();

    public GroupService(GroupRepository repository, ThreadLog threadLog,
                        GroupStateMachine stateMachine, MessageValidator validator) {
        this.repository = repository;
        this.threadLog = threadLog;
        this.stateMachine = stateMachine;
        this.validator = validator;
    }

    /** Applies a group system message and logs it, atomically with respect to the group. */
    public Mono<GroupAppend> apply(SystemEnvelope envelope) {
        String groupId = requireGroupId(envelope);
        ThreadKey threadKey = ThreadKey.group(groupId);
        return serializer.submit(groupId, () -> load(groupId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(current -> {
                    GroupMetadata next = stateMachine.apply(current.orElse(null), envelope);
                    return threadLog.append(threadKey, envelope).map(next::withLastSeq);
                })
                .doOnNext(committed -> {
                    groups.put(groupId, committed);
                    logger.debug("Group {} applied {} at seq {}", groupId, envelope.subtype().wireName(),
                            committed.lastSeq());
                })
                .flatMap(committed -> saveSnapshot(committed)
                        .thenReturn(new GroupAppend(committed, threadKey, committed.lastSeq()))));
    }

    /** Logs a text message into an existing group's thread. */
    public Mono<GroupAppend> appendText(TextEnvelope envelope) {
        String groupId = requireGroupId(envelope);
        ThreadKey threadKey = ThreadKey.group(groupId);
        return serializer.submit(groupId, () -> load(groupId)
                .switchIfEmpty(Mono.error(() -> unknown(groupId)))
                .flatMap(group -> threadLog.append(threadKey, envelope)
                        .map(seq -> new GroupAppend(group, threadKey, seq))));
    }

    /** Current state, or empty if the group was never created. */
    public Mono<GroupMetadata> find(String groupId) {
        GroupMetadata cached = groups.get(groupId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return serializer.submit(groupId, () -> load(groupId));
    }

    public Flux<ThreadEntry> messages(String groupId, long fromSeq, long toSeq) {
        return find(groupId)
                .switchIfEmpty(Mono.error(() -> unknown(groupId)))
                .flatMapMany(group -> threadLog.read(ThreadKey.group(groupId), fromSeq, toSeq));
    }

    /** Must only be called from inside the group's queue. */
    private Mono<GroupMetadata> load(String groupId) {
        GroupMetadata cached = groups.get(groupId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return repository.findById(groupId)
                .map(GroupEntity::toMetadata)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(snapshot -> replay(groupId, snapshot))
                .doOnNext(group -> groups.put(groupId, group));
    }

    private Mono<GroupMetadata> replay(String groupId, Optional<GroupMetadata> snapshot) {
        long fromSeq = snapshot.map(GroupMetadata::lastSeq).orElse(0L) + 1;
        return threadLog.read(ThreadKey.group(groupId), fromSeq, Long.MAX_VALUE)
                .reduce(snapshot, this::replayEntry)
                .flatMap(Mono::justOrEmpty);
    }

    private Optional<GroupMetadata> replayEntry(Optional<GroupMetadata> state, ThreadEntry entry) {
        Envelope envelope;
        try {
            envelope = validator.validate(entry.envelope());
        } catch (EsmpException e) {
            logger.warn("Skipping unreadable entry {} of {}: {}", entry.seq(), entry.threadKey(), e.getMessage());
            return state;
        }
        if (!(envelope instanceof SystemEnvelope system)) {
            return state;
        }
        try {
            return Optional.of(stateMachine.apply(state.orElse(null), system).withLastSeq(entry.seq()));
        } catch (EsmpException e) {
            logger.warn("Logged transition {} of {} no longer applies: {}", entry.seq(), entry.threadKey(), e.getMessage());
            return state;
        }
    }

    private Mono<Void> saveSnapshot(GroupMetadata group) {
        return repository.save(GroupEntity.from(group))
                .then()
                .onErrorResume(e -> {
                    logger.warn("Snapshot of group {} at seq {} not saved; it will be rebuilt from the log",
                            group.groupId(), group.lastSeq(), e);
                    return Mono.empty();
                });
    }

    private static String requireGroupId(Envelope envelope) {
        return envelope.groupId().orElseThrow(() -> EsmpException.schema("group_id", "is required"));
    }

    private static EsmpException unknown(String groupId) {
        return new EsmpException(ErrorKind.UNKNOWN_GROUP, "Group " + groupId + " does not exist");
    }
}
