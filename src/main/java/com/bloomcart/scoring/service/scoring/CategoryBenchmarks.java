package com.bloomcart.scoring.service.scoring;

import com.bloomcart.scoring.model.ProductCategory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-category reference distributions (mean and standard deviation) of the
 * absolute metrics, used to place a product within its category.
 */
public final class CategoryBenchmarks {

    public static final class Benchmark {
        private final double avgCo2e;
        private final double avgWater;
        private final double avgEnergy;
        private final double avgRecyclability;
        private final double stdDevCo2e;
        private final double stdDevWater;
        private final double stdDevEnergy;

        public Benchmark(double avgCo2e, double avgWater, double avgEnergy, double avgRecyclability,
                         double stdDevCo2e, double stdDevWater, double stdDevEnergy) {
            this.avgCo2e = avgCo2e;
            this.avgWater = avgWater;
            this.avgEnergy = avgEnergy;
            this.avgRecyclability = avgRecyclability;
            this.stdDevCo2e = stdDevCo2e;
            this.stdDevWater = stdDevWater;
            this.stdDevEnergy = stdDevEnergy;
        }

        public double getAvgCo2e() { return avgCo2e; }
        public double getAvgWater() { return avgWater; }
        public double getAvgEnergy() { return avgEnergy; }
        public double getAvgRecyclability() { return avgRecyclability; }
        public double getStdDevCo2e() { return stdDevCo2e; }
        public double getStdDevWater() { return stdDevWater; }
        public double getStdDevEnergy() { return stdDevEnergy; }
    }

    // co2e kg, water L, energy kWh, recyclability %, then the three standard deviations
    private static final Map<ProductCategory, Benchmark> TABLE = new EnumMap<>(ProductCategory.class);
    static {
        TABLE.put(ProductCategory.ELECTRONICS, new Benchmark(50, 12000, 70, 50, 30, 6000, 40));
        TABLE.put(ProductCategory.CLOTHING, new Benchmark(15, 2700, 15, 30, 10, 1500, 10));
        TABLE.put(ProductCategory.FURNITURE, new Benchmark(100, 8000, 40, 65, 50, 4000, 25));
        TABLE.put(ProductCategory.FOOD, new Benchmark(5, 1000, 3, 75, 4, 800, 2.5));
        TABLE.put(ProductCategory.BOOKS, new Benchmark(2, 400, 2, 75, 1.5, 250, 1.5));
        TABLE.put(ProductCategory.TOYS, new Benchmark(10, 3000, 8, 40, 7, 2000, 5));
        TABLE.put(ProductCategory.BEAUTY, new Benchmark(8, 2000, 5, 40, 5, 1200, 3));
        TABLE.put(ProductCategory.KITCHEN, new Benchmark(25, 5000, 20, 70, 15, 3000, 12));
        TABLE.put(ProductCategory.SPORTS, new Benchmark(18, 3500, 12, 35, 12, 2000, 8));
        TABLE.put(ProductCategory.HOME, new Benchmark(20, 4000, 15, 55, 14, 2500, 10));
        TABLE.put(ProductCategory.OFFICE, new Benchmark(15, 2500, 10, 60, 10, 1500, 7));
        TABLE.put(ProductCategory.DEFAULT, new Benchmark(20, 3000, 10, 50, 12, 2000, 7));
    }

    private CategoryBenchmarks() {}

    /** Benchmark row for the category; the default row when the category is null or unknown. */
    public static Benchmark forCategory(ProductCategory category) {
        Benchmark b = category == null ? null : TABLE.get(category);
        return b != null ? b : TABLE.get(ProductCategory.DEFAULT);
    }
}
