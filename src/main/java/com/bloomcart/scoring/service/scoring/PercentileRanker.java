package com.bloomcart.scoring.service.scoring;

import com.bloomcart.scoring.model.PercentileRanking;
import com.bloomcart.scoring.model.ProductCategory;
import com.bloomcart.scoring.model.ScoreBreakdown;
import org.springframework.stereotype.Service;

/**
 * Places a product's absolute metrics within its category's benchmark
 * distribution. All percentiles are in [1, 99], higher meaning better than more
 * of the category.
 */
@Service
public class PercentileRanker {

    static final double W_CARBON = 0.35;
    static final double W_WATER = 0.25;
    static final double W_ENERGY = 0.25;
    static final double W_RECYCLABILITY = 0.15;

    /**
     * Absolute values ranked against a category benchmark.
     */
    public static final class Metrics {
        private final double co2eKg;
        private final double waterLiters;
        private final double energyKwh;
        private final double recyclability;

        public Metrics(double co2eKg, double waterLiters, double energyKwh, double recyclability) {
            this.co2eKg = co2eKg;
            this.waterLiters = waterLiters;
            this.energyKwh = energyKwh;
            this.recyclability = recyclability;
        }

        public static Metrics of(ScoreBreakdown breakdown) {
            return new Metrics(breakdown.getCarbon().getValue(), breakdown.getWater().getValue(),
                    breakdown.getEnergy().getValue(), breakdown.getEndOfLife().getValue());
        }

        public double getCo2eKg() { return co2eKg; }
        public double getWaterLiters() { return waterLiters; }
        public double getEnergyKwh() { return energyKwh; }
        public double getRecyclability() { return recyclability; }
    }

    public PercentileRanking rank(ScoreBreakdown breakdown, ProductCategory category) {
        return rank(Metrics.of(breakdown), category);
    }

    public PercentileRanking rank(Metrics metrics, ProductCategory category) {
        CategoryBenchmarks.Benchmark b = CategoryBenchmarks.forCategory(category);
        int carbon = lowerIsBetter(metrics.getCo2eKg(), b.getAvgCo2e(), b.getStdDevCo2e());
        int water = lowerIsBetter(metrics.getWaterLiters(), b.getAvgWater(), b.getStdDevWater());
        int energy = lowerIsBetter(metrics.getEnergyKwh(), b.getAvgEnergy(), b.getStdDevEnergy());
        int recyclability = clampPercentile((int) Math.round(metrics.getRecyclability()));
        int overall = clampPercentile((int) Math.round(
                W_CARBON * carbon + W_WATER * water + W_ENERGY * energy + W_RECYCLABILITY * recyclability));
        return new PercentileRanking(overall, carbon, water, energy, recyclability);
    }

    /**
     * Percentile of a metric where a smaller value is better: {@code 100 - round(cdf(z) * 100)},
     * clamped to [1, 99]; 50 when the benchmark has no spread.
     */
    static int lowerIsBetter(double value, double mean, double stdDev) {
        if (stdDev == 0) return 50;
        double z = (value - mean) / stdDev;
        int raw = (int) Math.round(normalCdf(z) * 100.0);
        return clampPercentile(100 - raw);
    }

    /**
     * Standard normal CDF, Abramowitz-Stegun 26.2.17 (absolute error below 7.5e-8).
     */
    static double normalCdf(double z) {
        double t = 1.0 / (1.0 + 0.2316419 * Math.abs(z));
        double d = 0.3989422804014327 * Math.exp(-z * z / 2.0);
        double p = d * t * (0.3193815 + t * (-0.3565638 + t * (1.781478 + t * (-1.821256 + t * 1.330274))));
        return z > 0 ? 1.0 - p : p;
    }

    static int clampPercentile(int p) {
        return Math.max(1, Math.min(99, p));
    }
}
