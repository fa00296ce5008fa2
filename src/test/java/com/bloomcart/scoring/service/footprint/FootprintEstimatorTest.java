package com.bloomcart.scoring.service.footprint;

import com.bloomcart.scoring.model.FootprintResult;
import com.bloomcart.scoring.model.FootprintSource;
import com.bloomcart.scoring.model.NormalizedProduct;
import com.bloomcart.scoring.model.ProductCategory;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class FootprintEstimatorTest {

    static class StubPrimary implements EmissionFactorProvider {
        private final Mono<ProviderOutcome<EmissionFactorMatch>> suggestion;
        private final Mono<ProviderOutcome<FootprintResult>> estimate;
        final AtomicInteger estimateCalls = new AtomicInteger();

        StubPrimary(Mono<ProviderOutcome<EmissionFactorMatch>> suggestion, Mono<ProviderOutcome<FootprintResult>> estimate) {
            this.suggestion = suggestion;
            this.estimate = estimate;
        }

        @Override public boolean isEnabled() { return true; }
        @Override public Mono<ProviderOutcome<EmissionFactorMatch>> suggest(String text) { return suggestion; }

        @Override
        public Mono<ProviderOutcome<FootprintResult>> estimate(EmissionFactorMatch match, double weightKg) {
            estimateCalls.incrementAndGet();
            return estimate;
        }
    }

    static class StubSecondary implements AiFootprintEstimator {
        private final boolean enabled;
        private final Mono<ProviderOutcome<FootprintResult>> response;
        final AtomicInteger calls = new AtomicInteger();

        StubSecondary(boolean enabled, Mono<ProviderOutcome<FootprintResult>> response) {
            this.enabled = enabled;
            this.response = response;
        }

        @Override public boolean isEnabled() { return enabled; }

        @Override
        public Mono<ProviderOutcome<FootprintResult>> estimate(NormalizedProduct product) {
            calls.incrementAndGet();
            return response;
        }
    }

    private static final EmissionFactorMatch MATCH = new EmissionFactorMatch("sugg-1", "consumer electronics", 2.0);

    private final NormalizedProduct earbuds =
            new NormalizedProduct("Wireless Earbuds", ProductCategory.ELECTRONICS, 0.4, Set.of("mixed"), "Wireless Earbuds");

    private FootprintEstimator estimator(EmissionFactorProvider primary, AiFootprintEstimator secondary) {
        return new FootprintEstimator(primary, secondary, new HeuristicFootprintEstimator(), new DataQualityGate(2.5));
    }

    @Test
    public void goodQualityPrimaryIsUsed() {
        StubPrimary primary = new StubPrimary(Mono.just(ProviderOutcome.ok(MATCH)),
                Mono.just(ProviderOutcome.ok(FootprintResult.primary(4.2, 1.0, "sugg-1"))));
        StubSecondary secondary = new StubSecondary(true, Mono.error(new IllegalStateException("unused")));

        FootprintResult r = estimator(primary, secondary).estimate(earbuds).block();

        assertEquals(FootprintSource.PRIMARY, r.getSource());
        assertEquals(4.2, r.getCo2eKg(), 1e-9);
        assertEquals(0, secondary.calls.get());
    }

    @Test
    public void poorQualityPrimaryFallsThroughToSecondary() {
        StubPrimary primary = new StubPrimary(Mono.just(ProviderOutcome.ok(MATCH)),
                Mono.just(ProviderOutcome.ok(FootprintResult.primary(4.2, 3.0, "sugg-1"))));
        StubSecondary secondary = new StubSecondary(true,
                Mono.just(ProviderOutcome.ok(FootprintResult.secondary(5.5, "gemini-1.5-flash"))));

        FootprintResult r = estimator(primary, secondary).estimate(earbuds).block();

        assertEquals(FootprintSource.SECONDARY, r.getSource());
        assertEquals(5.5, r.getCo2eKg(), 1e-9);
        assertNull(r.getDataQuality());
    }

    @Test
    public void primaryWithoutQualityRatingIsUsed() {
        EmissionFactorMatch unrated = new EmissionFactorMatch("sugg-1", "consumer electronics", null);
        StubPrimary primary = new StubPrimary(Mono.just(ProviderOutcome.ok(unrated)),
                Mono.just(ProviderOutcome.ok(new FootprintResult(4.2, null, FootprintSource.PRIMARY, "sugg-1"))));

        FootprintResult r = estimator(primary, null).estimate(earbuds).block();

        assertEquals(FootprintSource.PRIMARY, r.getSource());
        assertEquals(4.2, r.getCo2eKg(), 1e-9);
        assertNull(r.getDataQuality());
    }

    @Test
    public void categoricalBadRatingIsRejected() {
        StubPrimary primary = new StubPrimary(Mono.just(ProviderOutcome.ok(MATCH)),
                Mono.just(ProviderOutcome.ok(FootprintResult.primary(4.2, 3.0, "sugg-1"))));

        ProviderOutcome<FootprintResult> outcome = estimator(primary, null).callPrimary(earbuds).block();

        assertEquals(ProviderOutcome.Kind.REJECTED, outcome.getKind());
    }

    @Test
    public void noSuggestionSkipsEstimate() {
        StubPrimary primary = new StubPrimary(Mono.just(ProviderOutcome.rejected("no emission factor matched")),
                Mono.error(new IllegalStateException("unused")));

        ProviderOutcome<FootprintResult> outcome = estimator(primary, null).callPrimary(earbuds).block();

        assertEquals(ProviderOutcome.Kind.REJECTED, outcome.getKind());
        assertEquals(0, primary.estimateCalls.get());
    }

    @Test
    public void allProvidersFailingYieldsHeuristic() {
        StubPrimary primary = new StubPrimary(Mono.error(new RuntimeException("connection refused")), Mono.empty());
        StubSecondary secondary = new StubSecondary(true, Mono.error(new RuntimeException("timeout")));

        FootprintResult r = estimator(primary, secondary).estimate(earbuds).block();

        assertEquals(FootprintSource.HEURISTIC, r.getSource());
        assertEquals(3.0, r.getCo2eKg(), 1e-9);
    }

    @Test
    public void noProvidersConfiguredYieldsHeuristic() {
        FootprintResult r = estimator(null, new StubSecondary(false, Mono.empty())).estimate(earbuds).block();

        assertEquals(FootprintSource.HEURISTIC, r.getSource());
    }

    @Test
    public void secondaryRejectionYieldsHeuristic() {
        StubSecondary secondary = new StubSecondary(true, Mono.just(ProviderOutcome.unavailable("estimatedCO2e missing")));

        FootprintResult r = estimator(null, secondary).estimate(earbuds).block();

        assertEquals(FootprintSource.HEURISTIC, r.getSource());
        assertEquals(1, secondary.calls.get());
    }
}
