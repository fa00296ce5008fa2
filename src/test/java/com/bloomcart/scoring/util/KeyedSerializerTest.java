package com.bloomcart.scoring.util;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class KeyedSerializerTest {

    @Test
    public void tasksForOneKeyNeverOverlap() {
        KeyedSerializer serializer = new KeyedSerializer();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        AtomicInteger counter = new AtomicInteger();

        List<Integer> results = Flux.range(0, 20)
                .flatMap(i -> serializer.run("acct", () -> Mono.fromCallable(() -> {
                            int now = running.incrementAndGet();
                            maxRunning.accumulateAndGet(now, Math::max);
                            return counter.get();
                        })
                        .delayElement(Duration.ofMillis(2))
                        .map(seen -> {
                            // read-modify-write that would lose updates if interleaved
                            counter.set(seen + 1);
                            running.decrementAndGet();
                            return seen + 1;
                        })
                        .subscribeOn(Schedulers.parallel())), 20)
                .collectList()
                .block(Duration.ofSeconds(10));

        assertEquals(20, results.size());
        assertEquals(20, counter.get());
        assertEquals(1, maxRunning.get());
        assertEquals(0, serializer.pendingKeys());
    }

    @Test
    public void failureDoesNotBlockTheQueue() {
        KeyedSerializer serializer = new KeyedSerializer();

        Mono<String> failing = serializer.run("k", () -> Mono.error(new IllegalStateException("boom")));
        assertThrows(IllegalStateException.class, failing::block);

        assertEquals("ok", serializer.run("k", () -> Mono.just("ok")).block(Duration.ofSeconds(5)));
    }

    @Test
    public void supplierThrowingIsReportedAsError() {
        KeyedSerializer serializer = new KeyedSerializer();
        Mono<String> m = serializer.run("k", () -> { throw new IllegalArgumentException("bad"); });
        assertThrows(IllegalArgumentException.class, m::block);
        assertEquals(0, serializer.pendingKeys());
    }
}
