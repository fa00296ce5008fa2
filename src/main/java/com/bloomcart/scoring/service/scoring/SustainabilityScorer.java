package com.bloomcart.scoring.service.scoring;

import com.bloomcart.scoring.model.FactorScore;
import com.bloomcart.scoring.model.FootprintResult;
import com.bloomcart.scoring.model.NormalizedProduct;
import com.bloomcart.scoring.model.ProductCategory;
import com.bloomcart.scoring.model.ScoreBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Expands a footprint estimate plus normalized attributes into six factor
 * scores, their weighted overall score and a grade.
 *
 * <p>Every factor score is clamped to [0, 100], higher meaning more sustainable.
 * The overall score is the unrounded weighted sum of the factors with
 * {@link #WEIGHTS}, which add up to 1.0.
 *
 * <h3>Factors</h3>
 * <ul>
 *   <li><strong>carbon</strong> - {@code 100 - min(100, co2eKg)}</li>
 *   <li><strong>water</strong> - liters estimated from co2e and a category multiplier, 5000 L scores 0</li>
 *   <li><strong>energy</strong> - kWh estimated from co2e, 50 kWh scores 0</li>
 *   <li><strong>transport</strong> - origin and shipping-method keywords around a neutral 50</li>
 *   <li><strong>endOfLife</strong> - mean recyclability of the materials</li>
 *   <li><strong>packaging</strong> - category baseline plus packaging keywords around a neutral 50</li>
 * </ul>
 */
@Service
public class SustainabilityScorer {
    private static final Logger log = LoggerFactory.getLogger(SustainabilityScorer.class);

    public static final double W_CARBON = 0.30;
    public static final double W_WATER = 0.15;
    public static final double W_ENERGY = 0.15;
    public static final double W_TRANSPORT = 0.15;
    public static final double W_END_OF_LIFE = 0.15;
    public static final double W_PACKAGING = 0.10;

    /** Factor name to weight, in breakdown order */
    public static final Map<String, Double> WEIGHTS;
    static {
        Map<String, Double> w = new LinkedHashMap<>();
        w.put("carbon", W_CARBON);
        w.put("water", W_WATER);
        w.put("energy", W_ENERGY);
        w.put("transport", W_TRANSPORT);
        w.put("endOfLife", W_END_OF_LIFE);
        w.put("packaging", W_PACKAGING);
        WEIGHTS = Collections.unmodifiableMap(w);
    }

    static final double WATER_ZERO_SCORE_LITERS = 5000.0;
    static final double ENERGY_ZERO_SCORE_KWH = 50.0;
    static final double DEFAULT_WATER_MULTIPLIER = 75.0;
    static final double UNSEEN_MATERIAL_RECYCLABILITY = 30.0;

    // liters of water per kg CO2e
    private static final Map<ProductCategory, Double> WATER_MULTIPLIERS = new EnumMap<>(ProductCategory.class);
    static {
        WATER_MULTIPLIERS.put(ProductCategory.CLOTHING, 150.0);
        WATER_MULTIPLIERS.put(ProductCategory.FOOD, 100.0);
        WATER_MULTIPLIERS.put(ProductCategory.ELECTRONICS, 50.0);
        WATER_MULTIPLIERS.put(ProductCategory.FURNITURE, 80.0);
        WATER_MULTIPLIERS.put(ProductCategory.BEAUTY, 60.0);
        WATER_MULTIPLIERS.put(ProductCategory.BOOKS, 30.0);
        WATER_MULTIPLIERS.put(ProductCategory.TOYS, 60.0);
        WATER_MULTIPLIERS.put(ProductCategory.KITCHEN, 50.0);
    }

    // 0..100, share of the material that is typically recovered
    private static final Map<String, Double> RECYCLABILITY = new LinkedHashMap<>();
    static {
        RECYCLABILITY.put("aluminum", 95.0);
        RECYCLABILITY.put("steel", 90.0);
        RECYCLABILITY.put("glass", 90.0);
        RECYCLABILITY.put("metal", 85.0);
        RECYCLABILITY.put("cardboard", 80.0);
        RECYCLABILITY.put("paper", 75.0);
        RECYCLABILITY.put("wood", 65.0);
        RECYCLABILITY.put("bamboo", 65.0);
        RECYCLABILITY.put("electronic", 50.0);
        RECYCLABILITY.put("ceramic", 45.0);
        RECYCLABILITY.put("plastic", 40.0);
        RECYCLABILITY.put("rubber", 35.0);
        RECYCLABILITY.put("textile", 30.0);
        RECYCLABILITY.put("cotton", 30.0);
        RECYCLABILITY.put("fabric", 30.0);
        RECYCLABILITY.put("polyester", 30.0);
        RECYCLABILITY.put("wool", 30.0);
        RECYCLABILITY.put("leather", 25.0);
        RECYCLABILITY.put("mixed", 20.0);
    }

    // origin keyword -> rough shipping distance in km; first match wins
    private static final Map<String, Double> ORIGIN_DISTANCE_KM = new LinkedHashMap<>();
    static {
        ORIGIN_DISTANCE_KM.put("local", 150.0);
        ORIGIN_DISTANCE_KM.put("domestic", 1200.0);
        ORIGIN_DISTANCE_KM.put("usa", 1200.0);
        ORIGIN_DISTANCE_KM.put("united states", 1200.0);
        ORIGIN_DISTANCE_KM.put("europe", 6000.0);
        ORIGIN_DISTANCE_KM.put("china", 9000.0);
        ORIGIN_DISTANCE_KM.put("asia", 9000.0);
    }
    static final double UNKNOWN_DISTANCE_KM = 5000.0;

    private static final List<String> NEAR_ORIGINS = List.of("local", "domestic", "usa", "united states");
    private static final List<String> FAR_ORIGINS = List.of("china", "asia", "vietnam", "india", "bangladesh", "taiwan");
    private static final List<String> SLOW_SHIPPING = List.of("ground", "sea", "ocean", "rail", "ship");
    private static final List<String> FAST_SHIPPING = List.of("air", "express", "overnight", "next day");

    private static final List<Pattern> ECO_PACKAGING = List.of(
            Pattern.compile("(?<!non-)(?<!non )\\brecyclable\\b"),
            Pattern.compile("\\bminimal packaging\\b"),
            Pattern.compile("\\bplastic-free\\b"),
            Pattern.compile("\\bbiodegradable\\b"),
            Pattern.compile("\\bcompostable\\b"));
    private static final List<Pattern> ADVERSE_PACKAGING = List.of(
            Pattern.compile("\\bexcessive packaging\\b"),
            Pattern.compile("\\bsingle-use\\b"),
            Pattern.compile("\\bnon-?recyclable\\b"));

    private final GradeScale gradeScale;

    public SustainabilityScorer(GradeScale gradeScale) {
        this.gradeScale = gradeScale;
    }

    /**
     * Scores one product.
     *
     * @param product Normalized product; weight must be finite and positive
     * @param footprint Footprint estimate; co2e must be finite and non-negative
     * @return The complete breakdown
     * @throws IllegalArgumentException if either input violates its invariant
     */
    public ScoreBreakdown score(NormalizedProduct product, FootprintResult footprint) {
        if (product == null || footprint == null) {
            throw new IllegalArgumentException("product and footprint are required");
        }
        if (!Double.isFinite(product.getWeightKg()) || product.getWeightKg() <= 0) {
            throw new IllegalArgumentException("weightKg must be finite and > 0, got " + product.getWeightKg());
        }
        double co2e = footprint.getCo2eKg();
        if (!Double.isFinite(co2e) || co2e < 0) {
            throw new IllegalArgumentException("co2eKg must be finite and >= 0, got " + co2e);
        }

        ProductCategory category = product.getCategory();
        FactorScore carbon = FactorScore.of(clamp(100.0 - Math.min(100.0, co2e)), co2e, "kg CO2e");
        FactorScore water = scoreWater(co2e, category);
        FactorScore energy = scoreEnergy(co2e, category);
        FactorScore transport = scoreTransport(product.getOrigin(), product.getShippingMethod());
        FactorScore endOfLife = scoreEndOfLife(product);
        FactorScore packaging = scorePackaging(product);

        double overall = W_CARBON * carbon.getScore()
                + W_WATER * water.getScore()
                + W_ENERGY * energy.getScore()
                + W_TRANSPORT * transport.getScore()
                + W_END_OF_LIFE * endOfLife.getScore()
                + W_PACKAGING * packaging.getScore();

        ScoreBreakdown out = new ScoreBreakdown(carbon, water, energy, transport, endOfLife, packaging,
                overall, gradeScale.gradeFor(overall));
        log.debug("Scored '{}': carbon={} water={} energy={} transport={} endOfLife={} packaging={} overall={} grade={}",
                product.getTitle(), carbon.getScore(), water.getScore(), energy.getScore(), transport.getScore(),
                endOfLife.getScore(), packaging.getScore(), overall, out.getGrade());
        return out;
    }

    static FactorScore scoreWater(double co2e, ProductCategory category) {
        double liters = co2e * waterMultiplier(category);
        double score = clamp(100.0 - Math.min(100.0, liters / WATER_ZERO_SCORE_LITERS * 100.0));
        return FactorScore.of(score, liters, "liters");
    }

    static FactorScore scoreEnergy(double co2e, ProductCategory category) {
        double kwh = co2e * (category == ProductCategory.ELECTRONICS ? 0.8 : 0.5);
        double score = clamp(100.0 - Math.min(100.0, kwh / ENERGY_ZERO_SCORE_KWH * 100.0));
        return FactorScore.of(score, kwh, "kWh");
    }

    static FactorScore scoreTransport(String origin, String shippingMethod) {
        String o = origin == null ? "" : origin.toLowerCase(Locale.ROOT);
        String s = shippingMethod == null ? "" : shippingMethod.toLowerCase(Locale.ROOT);

        double score = 50.0;
        if (containsAny(o, NEAR_ORIGINS)) score += 20;
        else if (containsAny(o, FAR_ORIGINS)) score -= 20;
        if (containsAny(s, FAST_SHIPPING)) score -= 15;
        else if (containsAny(s, SLOW_SHIPPING)) score += 10;

        double distance = UNKNOWN_DISTANCE_KM;
        for (Map.Entry<String, Double> e : ORIGIN_DISTANCE_KM.entrySet()) {
            if (o.contains(e.getKey())) {
                distance = e.getValue();
                break;
            }
        }
        String label = origin == null || origin.isBlank() ? "Unknown" : origin.trim();
        return FactorScore.of(clamp(score), distance, "km", label);
    }

    static FactorScore scoreEndOfLife(NormalizedProduct product) {
        double sum = 0;
        int n = 0;
        for (String m : product.getMaterials()) {
            sum += RECYCLABILITY.getOrDefault(m.toLowerCase(Locale.ROOT), UNSEEN_MATERIAL_RECYCLABILITY);
            n++;
        }
        double avg = n == 0 ? RECYCLABILITY.get("mixed") : sum / n;
        return FactorScore.of(clamp(avg), avg, "% recyclable");
    }

    static FactorScore scorePackaging(NormalizedProduct product) {
        double score = 50.0;
        switch (product.getCategory()) {
            case ELECTRONICS -> score -= 10;
            case BOOKS -> score += 15;
            case FOOD -> score -= 5;
            default -> { }
        }
        String text = (product.getTitle() + " " + product.getDescription()).toLowerCase(Locale.ROOT);
        for (Pattern p : ECO_PACKAGING) {
            if (p.matcher(text).find()) score += 10;
        }
        for (Pattern p : ADVERSE_PACKAGING) {
            if (p.matcher(text).find()) score -= 15;
        }
        score = clamp(score);
        String label = score > 70 ? "Minimal" : score > 40 ? "Moderate" : "Excessive";
        return FactorScore.of(score, score, "points", label);
    }

    static double waterMultiplier(ProductCategory category) {
        return WATER_MULTIPLIERS.getOrDefault(category, DEFAULT_WATER_MULTIPLIER);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(100.0, v));
    }
}
