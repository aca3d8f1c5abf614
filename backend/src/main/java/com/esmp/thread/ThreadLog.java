package com.esmp.thread;

import com.esmp.envelope.Envelope;
import com.esmp.envelope.WireFormat;
import com.esmp.support.KeyedSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only, per-thread ordered persistence of accepted envelopes.
 *
 * <p>Sequence numbers start at 1 and grow by one per append within a thread. Appends to one
 * thread are serialised; the last sequence number is cached and re-read from storage whenever
 * a write fails, so a number is never handed out twice.
 * The log never looks inside an envelope beyond storing it.
 */
@Service
public class ThreadLog {

    private static final Logger logger = LoggerFactory.getLogger(ThreadLog.class);

    private final ThreadLogRepository repository;
    private final WireFormat wireFormat;
    private final Clock clock;

    private final KeyedSerializer serializer = new KeyedSerializer();
    private final ConcurrentHashMap<String, Long> lastSeq = new ConcurrentHashMap<>();

    public ThreadLog(ThreadLogRepository repository, WireFormat wireFormat, Clock clock) {
        this.repository = repository;
        this.wireFormat = wireFormat;
        this.clock = clock;
    }

    public Mono<Long> append(ThreadKey key, Envelope envelope) {
        return serializer.submit(key.value(), () -> currentSeq(key).flatMap(last -> {
            long next = last + 1;
            ThreadEntryEntity entity = new ThreadEntryEntity(
                    new ThreadEntryKey(key.value(), next),
                    wireFormat.write(envelope.raw()),
                    envelope.senderPubkey(),
                    clock.instant());
            return repository.insert(entity)
                    .doOnSuccess(saved -> lastSeq.put(key.value(), next))
                    .doOnError(e -> {
                        lastSeq.remove(key.value());
                        logger.warn("Append to {} failed at seq {}", key, next, e);
                    })
                    .thenReturn(next);
        }));
    }

    /** Entries with {@code fromSeq <= seq <= toSeq}, in sequence order. */
    public Flux<ThreadEntry> read(ThreadKey key, long fromSeq, long toSeq) {
        if (fromSeq > toSeq) {
            return Flux.empty();
        }
        return repository.findRange(key.value(), Math.max(fromSeq, 1), toSeq)
                .map(entity -> new ThreadEntry(
                        key,
                        entity.getKey().seq(),
                        wireFormat.readStored(entity.getEnvelope()),
                        entity.getAppendedAt()));
    }

    private Mono<Long> currentSeq(ThreadKey key) {
        Long cached = lastSeq.get(key.value());
        if (cached != null) {
            return Mono.just(cached);
        }
        return repository.findLatest(key.value())
                .map(entity -> entity.getKey().seq())
                .defaultIfEmpty(0L);
    }
}
