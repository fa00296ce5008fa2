package com.bloomcart.scoring.service.scoring;

import com.bloomcart.scoring.model.FactorScore;
import com.bloomcart.scoring.model.FootprintResult;
import com.bloomcart.scoring.model.Grade;
import com.bloomcart.scoring.model.NormalizedProduct;
import com.bloomcart.scoring.model.ProductCategory;
import com.bloomcart.scoring.model.ScoreBreakdown;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SustainabilityScorerTest {

    private final SustainabilityScorer scorer = new SustainabilityScorer(GradeScale.defaults());

    private NormalizedProduct product(ProductCategory cat, Set<String> materials, String description,
                                      String origin, String shipping) {
        return new NormalizedProduct("Test Product", cat, 1.0, materials, description, origin, shipping, null, null);
    }

    private static void assertInRange(FactorScore f) {
        assertTrue(f.getScore() >= 0 && f.getScore() <= 100, "score out of range: " + f.getScore());
    }

    @Test
    public void weightsSumToOne() {
        double sum = SustainabilityScorer.WEIGHTS.values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, sum, 1e-9);
    }

    @Test
    public void overallIsTheWeightedSumOfFactors() {
        for (double co2e : List.of(0.0, 0.5, 3.0, 42.0, 250.0, 10_000.0)) {
            ScoreBreakdown b = scorer.score(
                    product(ProductCategory.CLOTHING, Set.of("cotton", "polyester"), "recyclable packaging", "China", "Air"),
                    FootprintResult.heuristic(co2e));

            double expected = 0.30 * b.getCarbon().getScore() + 0.15 * b.getWater().getScore()
                    + 0.15 * b.getEnergy().getScore() + 0.15 * b.getTransport().getScore()
                    + 0.15 * b.getEndOfLife().getScore() + 0.10 * b.getPackaging().getScore();
            assertEquals(expected, b.getOverallScore(), 1e-6);
            for (FactorScore f : List.of(b.getCarbon(), b.getWater(), b.getEnergy(), b.getTransport(), b.getEndOfLife(), b.getPackaging())) {
                assertInRange(f);
            }
            assertTrue(b.getOverallScore() >= 0 && b.getOverallScore() <= 100);
        }
    }

    @Test
    public void carbonScoreFallsWithFootprint() {
        NormalizedProduct p = product(ProductCategory.DEFAULT, Set.of("mixed"), "", null, null);
        assertEquals(97.0, scorer.score(p, FootprintResult.heuristic(3.0)).getCarbon().getScore(), 1e-9);
        assertEquals(0.0, scorer.score(p, FootprintResult.heuristic(150.0)).getCarbon().getScore(), 1e-9);
        assertEquals(100.0, scorer.score(p, FootprintResult.heuristic(0.0)).getCarbon().getScore(), 1e-9);
    }

    @Test
    public void gradeNeverImprovesAsFootprintGrows() {
        NormalizedProduct p = product(ProductCategory.ELECTRONICS, Set.of("plastic"), "", null, null);
        Grade previous = Grade.A;
        for (double co2e = 0; co2e <= 200; co2e += 2.5) {
            Grade g = scorer.score(p, FootprintResult.heuristic(co2e)).getGrade();
            assertTrue(g.ordinal() >= previous.ordinal(), "grade improved at co2e=" + co2e);
            previous = g;
        }
    }

    @Test
    public void waterAndEnergyScaleWithCategory() {
        FactorScore clothing = SustainabilityScorer.scoreWater(10.0, ProductCategory.CLOTHING);
        FactorScore books = SustainabilityScorer.scoreWater(10.0, ProductCategory.BOOKS);
        assertEquals(1500.0, clothing.getValue(), 1e-9);
        assertEquals(300.0, books.getValue(), 1e-9);
        assertEquals(70.0, clothing.getScore(), 1e-9);

        assertEquals(8.0, SustainabilityScorer.scoreEnergy(10.0, ProductCategory.ELECTRONICS).getValue(), 1e-9);
        assertEquals(5.0, SustainabilityScorer.scoreEnergy(10.0, ProductCategory.TOYS).getValue(), 1e-9);
    }

    @Test
    public void transportRewardsNearOriginAndSlowShipping() {
        FactorScore local = SustainabilityScorer.scoreTransport("Local workshop", "Ground");
        FactorScore far = SustainabilityScorer.scoreTransport("China", "Express Air");
        FactorScore unknown = SustainabilityScorer.scoreTransport(null, null);

        assertEquals(80.0, local.getScore(), 1e-9);
        assertEquals(15.0, far.getScore(), 1e-9);
        assertEquals(50.0, unknown.getScore(), 1e-9);
        assertEquals(150.0, local.getValue(), 1e-9);
        assertEquals(9000.0, far.getValue(), 1e-9);
        assertEquals(SustainabilityScorer.UNKNOWN_DISTANCE_KM, unknown.getValue(), 1e-9);
        assertEquals("Unknown", unknown.getDetail());
    }

    @Test
    public void endOfLifeAveragesMaterialRecyclability() {
        FactorScore metals = SustainabilityScorer.scoreEndOfLife(product(ProductCategory.KITCHEN, Set.of("aluminum", "glass"), "", null, null));
        FactorScore unseen = SustainabilityScorer.scoreEndOfLife(product(ProductCategory.KITCHEN, Set.of("kevlar"), "", null, null));
        FactorScore mixed = SustainabilityScorer.scoreEndOfLife(product(ProductCategory.KITCHEN, Set.of(), "", null, null));

        assertEquals(92.5, metals.getScore(), 1e-9);
        assertEquals(30.0, unseen.getScore(), 1e-9);
        assertEquals(20.0, mixed.getScore(), 1e-9);
    }

    @Test
    public void packagingKeywordsAdjustScore() {
        FactorScore eco = SustainabilityScorer.scorePackaging(product(ProductCategory.BOOKS, Set.of("paper"),
                "Ships in plastic-free, recyclable and compostable packaging", null, null));
        FactorScore adverse = SustainabilityScorer.scorePackaging(product(ProductCategory.ELECTRONICS, Set.of("plastic"),
                "Individually wrapped single-use pods in non-recyclable blister", null, null));

        assertEquals(95.0, eco.getScore(), 1e-9);
        assertEquals("Minimal", eco.getDetail());
        assertEquals(10.0, adverse.getScore(), 1e-9);
        assertEquals("Excessive", adverse.getDetail());
    }

    @Test
    public void rejectsContractViolations() {
        NormalizedProduct p = product(ProductCategory.DEFAULT, Set.of("mixed"), "", null, null);
        assertThrows(IllegalArgumentException.class, () -> scorer.score(null, FootprintResult.heuristic(1.0)));
        assertThrows(IllegalArgumentException.class, () -> scorer.score(p, null));
        assertThrows(IllegalArgumentException.class, () -> FootprintResult.heuristic(-1.0));
        assertThrows(IllegalArgumentException.class, () -> FootprintResult.heuristic(Double.POSITIVE_INFINITY));
    }

    @Test
    public void factorsCarryRatings() {
        ScoreBreakdown b = scorer.score(product(ProductCategory.BOOKS, Set.of("paper"), "", "USA", "Ground"),
                FootprintResult.heuristic(0.4));
        assertNotNull(b.getCarbon().getRating());
        assertEquals(Grade.A, b.getGrade());
    }
}
