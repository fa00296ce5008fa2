package com.bloomcart.scoring.store;

import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Process-local, bounded store. Oldest entries are evicted first once the
 * bound is reached.
 */
public class LocalStore<T> implements KeyValueStore<T> {
    private final Map<String, T> entries;

    public LocalStore(int maxEntries) {
        this.entries = Collections.synchronizedMap(new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, T> eldest) {
                return this.size() > maxEntries;
            }
        });
    }

    @Override
    public Mono<T> find(String key) {
        return Mono.fromSupplier(() -> entries.get(key));
    }

    @Override
    public Mono<Void> upsert(String key, T value) {
        return Mono.fromRunnable(() -> entries.put(key, value));
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return Mono.fromSupplier(() -> entries.remove(key) != null);
    }

    public int size() {
        return entries.size();
    }
}
