package com.bloomcart.scoring.store;

import reactor.core.publisher.Mono;

/**
 * Keyed record storage. A missing key is an empty {@code Mono}, not an error.
 *
 * @param <T> Stored record type
 */
public interface KeyValueStore<T> {

    Mono<T> find(String key);

    Mono<Void> upsert(String key, T value);

    /**
     * @return true if a record was removed
     */
    Mono<Boolean> delete(String key);
}
