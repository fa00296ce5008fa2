package com.bloomcart.scoring.service;

import com.bloomcart.scoring.config.AppProperties;
import com.bloomcart.scoring.model.FootprintSource;
import com.bloomcart.scoring.model.ProductCategory;
import com.bloomcart.scoring.model.ProductEvaluation;
import com.bloomcart.scoring.model.RawProduct;
import com.bloomcart.scoring.service.cache.ScoringCoordinator;
import com.bloomcart.scoring.service.footprint.DataQualityGate;
import com.bloomcart.scoring.service.footprint.FootprintEstimator;
import com.bloomcart.scoring.service.footprint.HeuristicFootprintEstimator;
import com.bloomcart.scoring.service.normalize.NormalizationService;
import com.bloomcart.scoring.service.normalize.Normalizer;
import com.bloomcart.scoring.service.scoring.GradeScale;
import com.bloomcart.scoring.service.scoring.PercentileRanker;
import com.bloomcart.scoring.service.scoring.SustainabilityScorer;
import com.bloomcart.scoring.store.LocalStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ProductEvaluationServiceTest {

    private final LocalStore<ProductEvaluation> store = new LocalStore<>(100);

    // No providers configured: normalization is rule-based and footprints are heuristic
    private ProductEvaluationService service() {
        return new ProductEvaluationService(
                new NormalizationService(new Normalizer(), null, Duration.ofSeconds(1)),
                new FootprintEstimator(null, null, new HeuristicFootprintEstimator(), new DataQualityGate(2.5)),
                new SustainabilityScorer(GradeScale.defaults()),
                new PercentileRanker(),
                new ScoringCoordinator(store),
                new AppProperties());
    }

    private RawProduct raw(String asin, String title) {
        RawProduct r = new RawProduct();
        r.setProductKey(asin);
        r.setTitle(title);
        return r;
    }

    @Test
    public void earbudsEndToEnd() {
        ScoringCoordinator.Result r = service().evaluate(raw("b0earbuds1", "Wireless Bluetooth Earbuds")).block();
        ProductEvaluation ev = r.getEvaluation();

        assertFalse(r.isCached());
        assertEquals("B0EARBUDS1", ev.getProductKey());
        assertEquals(ProductCategory.ELECTRONICS, ev.getProduct().getCategory());
        assertEquals(0.4, ev.getProduct().getWeightKg(), 1e-9);
        assertEquals(FootprintSource.HEURISTIC, ev.getFootprint().getSource());
        assertEquals(3.0, ev.getFootprint().getCo2eKg(), 1e-9);
        assertEquals(97.0, ev.getBreakdown().getCarbon().getScore(), 1e-9);
        assertEquals(12.0, ev.getEquivalents().get("drivingKm"), 1e-9);
        assertNotNull(ev.getPercentiles());
        assertNotNull(ev.getEvaluatedAt());
    }

    @Test
    public void secondRequestIsServedFromStore() {
        ProductEvaluationService svc = service();
        svc.evaluate(raw("B0REPEAT", "Cotton T-Shirt")).block();

        ScoringCoordinator.Result again = svc.evaluate(raw(" b0repeat ", "Cotton T-Shirt (renamed)")).block();

        assertTrue(again.isCached());
        assertEquals("Cotton T-Shirt", again.getEvaluation().getProduct().getTitle());
        assertNotNull(svc.lookup("b0repeat").block());
    }

    @Test
    public void batchKeepsInputOrder() {
        List<String> keys = service().evaluateBatch(List.of(
                        raw("B01", "Steel Water Bottle"),
                        raw(null, "Bamboo Toothbrush"),
                        raw("B01", "Steel Water Bottle"),
                        raw("B02", "Paperback Novel")))
                .map(r -> r.getEvaluation().getProductKey())
                .collectList()
                .block();

        assertEquals(4, keys.size());
        assertEquals("B01", keys.get(0));
        assertTrue(keys.get(1).startsWith("title:"));
        assertEquals("B01", keys.get(2));
        assertEquals("B02", keys.get(3));
        assertEquals(3, keys.stream().collect(Collectors.toSet()).size());
    }

    @Test
    public void evictThenEvaluateRecomputes() {
        ProductEvaluationService svc = service();
        svc.evaluate(raw("B0EVICT", "Glass Jar")).block();

        assertTrue(svc.evict("b0evict").block());
        assertNull(svc.lookup("B0EVICT").block());
        assertFalse(svc.evaluate(raw("B0EVICT", "Glass Jar")).block().isCached());
    }
}
