package com.esmp.support;

import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Single-writer queue per key.
 *
 * <p>Tasks submitted under the same key run strictly one after another, in subscription order;
 * tasks under different keys run independently. A task starts once its predecessor has finished
 * (successfully or not) and always runs to completion, even if the subscriber cancels, so a
 * mutation is never left half-applied.
 */
public final class KeyedSerializer {

    private final ConcurrentHashMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> submit(String key, Supplier<Mono<T>> task) {
        return Mono.defer(() -> {
            CompletableFuture<Void> turn = new CompletableFuture<>();
            CompletableFuture<Void> previous = tails.put(key, turn);
            CompletableFuture<Void> ready = previous == null
                    ? CompletableFuture.completedFuture(null)
                    : previous;

            CompletableFuture<T> outcome = ready.thenCompose(ignored -> task.get().toFuture());
            outcome.whenComplete((value, error) -> {
                tails.remove(key, turn);
                turn.complete(null);
            });
            return Mono.fromFuture(outcome, true);
        });
    }

    /** Number of keys with queued or running work. */
    public int activeKeys() {
        return tails.size();
    }
}
