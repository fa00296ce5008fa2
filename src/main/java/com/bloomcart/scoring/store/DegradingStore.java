package com.bloomcart.scoring.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Persistent store with a process-local fallback.
 *
 * <p>Reads go to the persistent store first; a miss there also checks the local
 * store, which may hold records written while the persistent store was down.
 * Any persistent error switches the operation to the local store. Callers never
 * see a store error. The switch to and from degraded mode is logged once per
 * transition.
 */
public class DegradingStore<T> implements KeyValueStore<T> {
    private static final Logger log = LoggerFactory.getLogger(DegradingStore.class);

    private final String name;
    private final KeyValueStore<T> persistent;
    private final KeyValueStore<T> local;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    public DegradingStore(String name, KeyValueStore<T> persistent, KeyValueStore<T> local) {
        this.name = name;
        this.persistent = persistent;
        this.local = local;
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    @Override
    public Mono<T> find(String key) {
        return persistent.find(key)
                .doOnSuccess(v -> markHealthy())
                .switchIfEmpty(Mono.defer(() -> local.find(key)))
                .onErrorResume(e -> {
                    markDegraded("find", e);
                    return local.find(key);
                });
    }

    @Override
    public Mono<Void> upsert(String key, T value) {
        return persistent.upsert(key, value)
                .doOnSuccess(v -> markHealthy())
                .onErrorResume(e -> {
                    markDegraded("upsert", e);
                    return local.upsert(key, value);
                });
    }

    @Override
    public Mono<Boolean> delete(String key) {
        Mono<Boolean> remote = persistent.delete(key)
                .doOnSuccess(v -> markHealthy())
                .onErrorResume(e -> {
                    markDegraded("delete", e);
                    return Mono.just(false);
                });
        return Mono.zip(remote.defaultIfEmpty(false), local.delete(key).defaultIfEmpty(false))
                .map(t -> t.getT1() || t.getT2());
    }

    private void markDegraded(String op, Throwable e) {
        if (degraded.compareAndSet(false, true)) {
            log.warn("Store '{}' unavailable during {}, falling back to local store: {}", name, op, e.toString());
        } else {
            log.debug("Store '{}' still unavailable during {}: {}", name, op, e.toString());
        }
    }

    private void markHealthy() {
        if (degraded.compareAndSet(true, false)) {
            log.info("Store '{}' reachable again, leaving degraded mode", name);
        }
    }
}
