package com.bloomcart.scoring.service.footprint;

import com.bloomcart.scoring.model.FootprintResult;
import com.bloomcart.scoring.model.NormalizedProduct;
import com.bloomcart.scoring.model.ProductCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Last-resort footprint estimate computed from local tables only:
 * {@code weightKg x materialMultiplier x productTypeAdjustment}, rounded to two decimals.
 *
 * <p>Pure and deterministic; never fails for a valid {@link NormalizedProduct}.
 */
public class HeuristicFootprintEstimator {
    private static final Logger log = LoggerFactory.getLogger(HeuristicFootprintEstimator.class);

    public static final double DEFAULT_MULTIPLIER = 3.0;

    // kg CO2e per kg of product, first matching material group wins
    private static final Map<List<String>, Double> MATERIAL_MULTIPLIERS = new LinkedHashMap<>();
    static {
        MATERIAL_MULTIPLIERS.put(List.of("plastic", "silicone"), 6.0);
        MATERIAL_MULTIPLIERS.put(List.of("metal", "steel", "aluminum"), 8.0);
        MATERIAL_MULTIPLIERS.put(List.of("cotton", "fabric", "polyester", "wool", "leather"), 4.0);
        MATERIAL_MULTIPLIERS.put(List.of("wood", "bamboo"), 1.5);
        MATERIAL_MULTIPLIERS.put(List.of("glass", "ceramic"), 2.0);
        MATERIAL_MULTIPLIERS.put(List.of("paper", "cardboard"), 1.0);
    }

    static final double ELECTRONICS_FACTOR = 2.5;
    static final double ECO_FACTOR = 0.7;
    static final double DISPOSABLE_FACTOR = 1.8;

    // "eco" as a word or prefix of "eco-friendly", not inside "decor" or "second"
    private static final Pattern ECO_WORD = Pattern.compile("\\beco(?:friendly)?\\b");

    public FootprintResult estimate(NormalizedProduct product) {
        double base = baseMultiplier(product.getMaterials());
        double adjustment = typeAdjustment(product);
        double co2e = round2(product.getWeightKg() * base * adjustment);
        log.debug("Heuristic footprint: weightKg={} base={} adjustment={} co2e={}",
                product.getWeightKg(), base, adjustment, co2e);
        return FootprintResult.heuristic(co2e);
    }

    public static double baseMultiplier(Set<String> materials) {
        if (materials == null) return DEFAULT_MULTIPLIER;
        for (Map.Entry<List<String>, Double> e : MATERIAL_MULTIPLIERS.entrySet()) {
            for (String m : e.getKey()) {
                if (materials.contains(m)) return e.getValue();
            }
        }
        return DEFAULT_MULTIPLIER;
    }

    /**
     * Electronics weigh heaviest in manufacturing; eco-labelled products are
     * discounted and disposable or fast-fashion items surcharged. Only one applies.
     */
    public static double typeAdjustment(NormalizedProduct product) {
        String title = product.getTitle() == null ? "" : product.getTitle().toLowerCase(Locale.ROOT);
        if (product.getCategory() == ProductCategory.ELECTRONICS
                || title.contains("electronic") || title.contains("phone") || title.contains("computer")) {
            return ELECTRONICS_FACTOR;
        }
        if (title.contains("organic") || ECO_WORD.matcher(title).find() || title.contains("sustainable")) {
            return ECO_FACTOR;
        }
        if (title.contains("fast fashion") || title.contains("disposable")) {
            return DISPOSABLE_FACTOR;
        }
        return 1.0;
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
