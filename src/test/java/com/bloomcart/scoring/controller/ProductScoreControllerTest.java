package com.bloomcart.scoring.controller;

import com.bloomcart.scoring.config.AppProperties;
import com.bloomcart.scoring.model.ProductEvaluation;
import com.bloomcart.scoring.model.RawProduct;
import com.bloomcart.scoring.service.ProductEvaluationService;
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

import static org.junit.jupiter.api.Assertions.*;

public class ProductScoreControllerTest {

    private final LocalStore<ProductEvaluation> store = new LocalStore<>(10);
    private final ProductScoreController controller;

    public ProductScoreControllerTest() {
        AppProperties props = new AppProperties();
        props.setAdminKey("secret");
        ProductEvaluationService svc = new ProductEvaluationService(
                new NormalizationService(new Normalizer(), null, Duration.ofSeconds(1)),
                new FootprintEstimator(null, null, new HeuristicFootprintEstimator(), new DataQualityGate(2.5)),
                new SustainabilityScorer(GradeScale.defaults()),
                new PercentileRanker(),
                new ScoringCoordinator(store),
                props);
        controller = new ProductScoreController(svc, props);
    }

    private RawProduct raw(String asin, String title) {
        RawProduct r = new RawProduct();
        r.setProductKey(asin);
        r.setTitle(title);
        return r;
    }

    @Test
    public void recordWithoutKeyOrTitleIsRejected() {
        assertFalse(ProductScoreController.isIdentifiable(raw(null, " ")));
        assertTrue(ProductScoreController.isIdentifiable(raw(null, "Mug")));
        assertEquals(400, controller.evaluate(raw(null, null)).block().getStatusCode().value());
    }

    @Test
    public void scoreLookupIsNotFoundUntilEvaluated() {
        assertEquals(404, controller.getScore("B0MUG").block().getStatusCode().value());
        controller.evaluate(raw("B0MUG", "Ceramic Mug")).block();
        assertEquals(200, controller.getScore("b0mug").block().getStatusCode().value());
    }

    @Test
    public void evictRequiresAdminKey() {
        controller.evaluate(raw("B0MUG", "Ceramic Mug")).block();

        assertEquals(401, controller.evict(null, "B0MUG").block().getStatusCode().value());
        assertEquals(401, controller.evict("wrong", "B0MUG").block().getStatusCode().value());
        assertEquals(200, controller.evict("secret", "B0MUG").block().getStatusCode().value());
        assertNull(store.find("B0MUG").block());
    }
}
