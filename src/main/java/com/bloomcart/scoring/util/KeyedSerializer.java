package com.bloomcart.scoring.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs reactive tasks one at a time per key, in arrival order. Tasks for
 * different keys never wait on each other.
 *
 * <p>Each key keeps only the tail of its queue; the entry is dropped once the
 * tail finishes. A task runs to completion even if its subscriber cancels, so a
 * queued successor never starts on top of a half-applied update.
 */
public class KeyedSerializer {
    private static final Logger log = LoggerFactory.getLogger(KeyedSerializer.class);

    private final Map<String, CompletableFuture<Object>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> run(String key, Supplier<Mono<T>> task) {
        return Mono.defer(() -> {
            CompletableFuture<T> result = new CompletableFuture<>();
            CompletableFuture<Object> done = new CompletableFuture<>();
            CompletableFuture<Object> previous = tails.put(key, done);
            Runnable release = () -> {
                tails.remove(key, done);
                done.complete(null);
            };
            if (previous == null) {
                start(key, task, result, release);
            } else {
                previous.whenComplete((v, e) -> start(key, task, result, release));
            }
            return Mono.fromFuture(result.copy());
        });
    }

    private static <T> void start(String key, Supplier<Mono<T>> task, CompletableFuture<T> result, Runnable release) {
        try {
            task.get().subscribe(
                    v -> {
                        release.run();
                        result.complete(v);
                    },
                    e -> {
                        release.run();
                        result.completeExceptionally(e);
                    },
                    () -> {
                        if (!result.isDone()) {
                            release.run();
                            result.complete(null);
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Serialized task for key {} failed to start: {}", key, e.toString());
            release.run();
            result.completeExceptionally(e);
        }
    }

    int pendingKeys() {
        return tails.size();
    }
}
