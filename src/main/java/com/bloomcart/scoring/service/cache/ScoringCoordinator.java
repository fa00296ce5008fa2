package com.bloomcart.scoring.service.cache;

import com.bloomcart.scoring.model.ProductEvaluation;
import com.bloomcart.scoring.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Serves product evaluations from the store and computes each missing one at
 * most once at a time per product key.
 *
 * <p>The first caller for an uncached key registers an in-flight future and
 * starts store lookup, computation and write-through; later callers for the
 * same key attach to that future. The computation is detached from its callers:
 * a caller that cancels only stops waiting, and the result is still stored.
 * The registry entry is removed when the future completes, after the write.
 */
@Service
public class ScoringCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ScoringCoordinator.class);

    /**
     * An evaluation and whether it came from the store rather than a computation
     * started on behalf of this request or one it joined.
     */
    public static final class Result {
        private final ProductEvaluation evaluation;
        private final boolean cached;

        public Result(ProductEvaluation evaluation, boolean cached) {
            this.evaluation = evaluation;
            this.cached = cached;
        }

        public ProductEvaluation getEvaluation() { return evaluation; }
        public boolean isCached() { return cached; }
    }

    private final KeyValueStore<ProductEvaluation> store;
    private final Map<String, CompletableFuture<Result>> inFlight = new ConcurrentHashMap<>();

    public ScoringCoordinator(@Qualifier("evaluationStore") KeyValueStore<ProductEvaluation> store) {
        this.store = store;
    }

    /**
     * Returns the stored evaluation for the key, or computes, stores and returns it.
     *
     * @param productKey Canonical product key
     * @param computeFn Produces the evaluation for a key; invoked at most once per in-flight key
     */
    public Mono<Result> getOrCompute(String productKey, Function<String, Mono<ProductEvaluation>> computeFn) {
        return Mono.defer(() -> {
            CompletableFuture<Result> created = new CompletableFuture<>();
            CompletableFuture<Result> existing = inFlight.putIfAbsent(productKey, created);
            if (existing != null) {
                log.debug("Joining in-flight evaluation for {}", productKey);
                return Mono.fromFuture(existing.copy());
            }
            store.find(productKey)
                    .map(ev -> new Result(ev, true))
                    .switchIfEmpty(Mono.defer(() -> computeAndStore(productKey, computeFn)))
                    .subscribe(r -> settle(productKey, created, r, null), e -> settle(productKey, created, null, e), () -> {
                        if (!created.isDone()) {
                            settle(productKey, created, null, new IllegalStateException("No evaluation produced for " + productKey));
                        }
                    });
            return Mono.fromFuture(created.copy());
        });
    }

    /**
     * Batch variant of {@link #getOrCompute}. Results are emitted in the order of
     * {@code productKeys}; each key goes through the same single-flight registry,
     * so it also joins any single-item request already in flight.
     */
    public Flux<Result> getOrComputeBatch(List<String> productKeys, Function<String, Mono<ProductEvaluation>> computeFn,
                                          int concurrency) {
        return Flux.fromIterable(productKeys)
                .flatMapSequential(key -> getOrCompute(key, computeFn), Math.max(1, concurrency));
    }

    public Mono<ProductEvaluation> lookup(String productKey) {
        return store.find(productKey);
    }

    /**
     * Drops the stored evaluation so the next request recomputes it. A computation
     * already in flight is not interrupted and will store its result.
     */
    public Mono<Boolean> evict(String productKey) {
        return store.delete(productKey)
                .doOnNext(removed -> log.info("Evicted evaluation for {}: removed={}", productKey, removed));
    }

    boolean isInFlight(String productKey) {
        return inFlight.containsKey(productKey);
    }

    // Unregister before completing so a woken caller never sees a stale in-flight entry
    private void settle(String productKey, CompletableFuture<Result> future, Result result, Throwable error) {
        inFlight.remove(productKey, future);
        if (error != null) future.completeExceptionally(error);
        else future.complete(result);
    }

    private Mono<Result> computeAndStore(String productKey, Function<String, Mono<ProductEvaluation>> computeFn) {
        log.debug("Cache miss for {}, computing", productKey);
        return computeFn.apply(productKey)
                .flatMap(ev -> store.upsert(productKey, ev).thenReturn(new Result(ev, false)));
    }
}
