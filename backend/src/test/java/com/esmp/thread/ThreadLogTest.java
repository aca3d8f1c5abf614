package com.esmp.thread;

import com.esmp.crypto.SigningTestUtils;
import com.esmp.envelope.Envelope;
import com.esmp.envelope.MessageValidator;
import com.esmp.envelope.TestEnvelopes;
import com.esmp.envelope.WireFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ThreadLogTest {

    private static final ThreadKey DIRECT = ThreadKey.direct("bob#y", "alice#x");
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ThreadLogRepository repository;

    private final WireFormat wireFormat = new WireFormat(new ObjectMapper());
    private ThreadLog threadLog;
    private Envelope envelope;

    @BeforeEach
    void setup() {
        threadLog = new ThreadLog(repository, wireFormat, Clock.fixed(NOW, ZoneOffset.UTC));
        envelope = new MessageValidator().validate(SigningTestUtils.newIdentity()
                .sign(TestEnvelopes.directText("alice#x", "hello", "bob#y")));
    }

    private static ThreadEntryEntity stored(long seq) {
        return new ThreadEntryEntity(new ThreadEntryKey(DIRECT.value(), seq), "{\"type\":\"text\"}", "pk", NOW);
    }

    @Test
    void directKeyIsOrderIndependent() {
        assertEquals(ThreadKey.direct("alice#x", "bob#y"), DIRECT);
        assertEquals("direct:alice#x|bob#y", DIRECT.value());
        assertFalse(DIRECT.isGroup());
        assertTrue(ThreadKey.group("g1").isGroup());
    }

    @Test
    void sequenceStartsAtOneAndIsCached() {
        when(repository.findLatest(DIRECT.value())).thenReturn(Mono.empty());
        when(repository.insert(any(ThreadEntryEntity.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(threadLog.append(DIRECT, envelope)).expectNext(1L).verifyComplete();
        StepVerifier.create(threadLog.append(DIRECT, envelope)).expectNext(2L).verifyComplete();

        verify(repository, times(1)).findLatest(DIRECT.value());
    }

    @Test
    void storedEnvelopeIsTheRawJson() {
        when(repository.findLatest(DIRECT.value())).thenReturn(Mono.just(stored(41)));
        ArgumentCaptor<ThreadEntryEntity> captor = ArgumentCaptor.forClass(ThreadEntryEntity.class);
        when(repository.insert(captor.capture())).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(threadLog.append(DIRECT, envelope)).expectNext(42L).verifyComplete();

        ThreadEntryEntity entity = captor.getValue();
        assertEquals(42L, entity.getKey().seq());
        assertEquals(DIRECT.value(), entity.getKey().threadKey());
        assertEquals(envelope.raw(), wireFormat.readStored(entity.getEnvelope()));
        assertEquals(envelope.senderPubkey(), entity.getSenderPubkey());
        assertEquals(NOW, entity.getAppendedAt());
    }

    @Test
    void failedWriteNeverConsumesASequenceNumber() {
        when(repository.findLatest(DIRECT.value())).thenReturn(Mono.empty());
        when(repository.insert(any(ThreadEntryEntity.class)))
                .thenReturn(Mono.error(new IllegalStateException("write timeout")))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(threadLog.append(DIRECT, envelope)).expectErrorMessage("write timeout").verify();
        StepVerifier.create(threadLog.append(DIRECT, envelope)).expectNext(1L).verifyComplete();

        verify(repository, times(2)).findLatest(DIRECT.value());
    }

    @Test
    void readReturnsEntriesInOrder() {
        when(repository.findRange(DIRECT.value(), 1L, 2L)).thenReturn(Flux.just(stored(1), stored(2)));

        StepVerifier.create(threadLog.read(DIRECT, 1, 2))
                .assertNext(entry -> {
                    assertEquals(1L, entry.seq());
                    assertEquals("text", entry.envelope().get("type").asText());
                    assertEquals(DIRECT, entry.threadKey());
                })
                .assertNext(entry -> assertEquals(2L, entry.seq()))
                .verifyComplete();
    }

    @Test
    void emptyRangeSkipsStorage() {
        StepVerifier.create(threadLog.read(DIRECT, 5, 4)).verifyComplete();

        verify(repository, never()).findRange(any(), anyLong(), anyLong());
    }
}
