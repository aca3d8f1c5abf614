package com.esmp.support;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeyedSerializerTest {

    private final KeyedSerializer serializer = new KeyedSerializer();

    @Test
    void sameKeyRunsOneAtATime() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Integer> order = new CopyOnWriteArrayList<>();

        Flux<Integer> tasks = Flux.range(0, 20)
                .flatMap(i -> serializer.submit("g1", () -> Mono.fromCallable(() -> {
                            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                            return i;
                        })
                        .delayElement(Duration.ofMillis(2))
                        .doOnNext(value -> {
                            order.add(value);
                            running.decrementAndGet();
                        })), 20);

        StepVerifier.create(tasks).expectNextCount(20).verifyComplete();

        assertEquals(1, maxRunning.get());
        assertEquals(20, order.size());
        assertEquals(0, serializer.activeKeys());
    }

    @Test
    void differentKeysRunInParallel() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        Flux<String> tasks = Flux.just("a", "b", "c", "d")
                .flatMap(key -> serializer.submit(key, () -> Mono.fromCallable(() -> {
                            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                            return key;
                        })
                        .delayElement(Duration.ofMillis(50))
                        .doOnNext(value -> running.decrementAndGet())));

        StepVerifier.create(tasks).expectNextCount(4).verifyComplete();

        assertTrue(maxRunning.get() > 1);
    }

    @Test
    void failureDoesNotBlockTheQueue() {
        Mono<String> failing = serializer.submit("g1", () -> Mono.error(new IllegalStateException("boom")));
        Mono<String> next = serializer.submit("g1", () -> Mono.just("ok"));

        StepVerifier.create(failing).expectErrorMessage("boom").verify();
        StepVerifier.create(next).expectNext("ok").verifyComplete();
    }

    @Test
    void cancelledTaskStillRunsToCompletion() {
        AtomicInteger completed = new AtomicInteger();

        serializer.submit("g1", () -> Mono.delay(Duration.ofMillis(50))
                        .subscribeOn(Schedulers.parallel())
                        .doOnNext(tick -> completed.incrementAndGet()))
                .subscribe()
                .dispose();

        StepVerifier.create(serializer.submit("g1", () -> Mono.fromCallable(completed::get)))
                .expectNext(1)
                .verifyComplete();
    }
}
