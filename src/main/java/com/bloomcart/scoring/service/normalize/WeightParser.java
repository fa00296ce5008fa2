package com.bloomcart.scoring.service.normalize;

import com.bloomcart.scoring.model.ProductCategory;
import com.bloomcart.scoring.model.RawProduct;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts product weight in kilograms.
 *
 * <p>The step itself only accepts explicit numeric+unit tokens, looked up in
 * weight-labelled detail rows first, then the title, then the remaining detail
 * rows. Defaults (product type, category, absolute floor) are exposed as static
 * helpers because the Normalizer applies them only after AI hints had a chance
 * to fill the gap.
 */
public class WeightParser implements NormalizerStep {

    public static final double FLOOR_DEFAULT_KG = 0.5;
    private static final double MAX_PLAUSIBLE_KG = 2000.0;

    private static final Pattern WEIGHT_PATTERN = Pattern.compile(
        "(\\d+(?:[.,]\\d+)?)\\s*(kilograms?|kgs?|grams?|g|pounds?|lbs?|ounces?|oz)\\b",
        Pattern.CASE_INSENSITIVE
    );

    private static final Map<String, Double> UNIT_TO_KG = Map.of(
        "kg", 1.0,
        "g", 0.001,
        "lb", 0.453592,
        "oz", 0.0283495
    );

    // Specific product types whose typical weight differs a lot from their category average
    private static final Map<Pattern, Double> TYPE_DEFAULTS = new LinkedHashMap<>();
    static {
        TYPE_DEFAULTS.put(Pattern.compile("\\b(earbuds|earphones|headphones?|phone|smartphone|smartwatch|watch|electronic)\\b", Pattern.CASE_INSENSITIVE), 0.4);
        TYPE_DEFAULTS.put(Pattern.compile("\\b(book|paperback|paper)\\b", Pattern.CASE_INSENSITIVE), 0.2);
        TYPE_DEFAULTS.put(Pattern.compile("\\b(shirt|t-shirt|socks|clothing)\\b", Pattern.CASE_INSENSITIVE), 0.3);
        TYPE_DEFAULTS.put(Pattern.compile("\\b(appliance|refrigerator|washer|dryer)\\b", Pattern.CASE_INSENSITIVE), 15.0);
    }

    private static final Map<ProductCategory, Double> CATEGORY_DEFAULTS = new EnumMap<>(ProductCategory.class);
    static {
        CATEGORY_DEFAULTS.put(ProductCategory.ELECTRONICS, 1.5);
        CATEGORY_DEFAULTS.put(ProductCategory.CLOTHING, 0.4);
        CATEGORY_DEFAULTS.put(ProductCategory.FURNITURE, 12.0);
        CATEGORY_DEFAULTS.put(ProductCategory.FOOD, 0.8);
        CATEGORY_DEFAULTS.put(ProductCategory.BOOKS, 0.6);
        CATEGORY_DEFAULTS.put(ProductCategory.TOYS, 1.2);
        CATEGORY_DEFAULTS.put(ProductCategory.BEAUTY, 0.25);
        CATEGORY_DEFAULTS.put(ProductCategory.KITCHEN, 2.0);
        CATEGORY_DEFAULTS.put(ProductCategory.SPORTS, 1.5);
        CATEGORY_DEFAULTS.put(ProductCategory.HOME, 2.5);
        CATEGORY_DEFAULTS.put(ProductCategory.OFFICE, 1.0);
    }

    @Override
    public boolean supports(RawProduct raw) {
        return raw.getTitle() != null || (raw.getDetails() != null && !raw.getDetails().isEmpty());
    }

    @Override
    public void apply(RawProduct raw, NormalizationDraft draft) {
        if (draft.getWeightKg() != null) return;

        List<String> weightRows = new ArrayList<>();
        List<String> otherRows = new ArrayList<>();
        if (raw.getDetails() != null) {
            for (Map.Entry<String, String> e : raw.getDetails().entrySet()) {
                if (e.getValue() == null) continue;
                String label = e.getKey() == null ? "" : e.getKey().toLowerCase(Locale.ROOT);
                if (label.contains("weight")) weightRows.add(e.getValue());
                else otherRows.add(e.getValue());
            }
        }

        for (String row : weightRows) {
            OptionalDouble kg = parseKg(row);
            if (kg.isPresent()) {
                draft.setWeightKg(kg.getAsDouble(), "explicit");
                return;
            }
        }
        OptionalDouble fromTitle = parseKg(raw.getTitle());
        if (fromTitle.isPresent()) {
            draft.setWeightKg(fromTitle.getAsDouble(), "regex");
            return;
        }
        for (String row : otherRows) {
            OptionalDouble kg = parseKg(row);
            if (kg.isPresent()) {
                draft.setWeightKg(kg.getAsDouble(), "regex");
                return;
            }
        }
    }

    /**
     * Parses the first plausible weight token in the text.
     *
     * <p>A bare upper-case "G" is skipped so "5G smartphone" is not read as five grams.
     *
     * @param text Free text such as "Item Weight: 1.2 pounds"
     * @return Weight in kilograms, empty when no plausible token is present
     */
    public static OptionalDouble parseKg(String text) {
        if (text == null || text.isBlank()) return OptionalDouble.empty();
        Matcher m = WEIGHT_PATTERN.matcher(text);
        while (m.find()) {
            String unitToken = m.group(2);
            if (unitToken.equals("G")) continue;
            Double factor = UNIT_TO_KG.get(canonicalUnit(unitToken));
            Double value = parseNumber(m.group(1));
            if (factor == null || value == null) continue;
            double kg = value * factor;
            if (Double.isFinite(kg) && kg > 0 && kg <= MAX_PLAUSIBLE_KG) {
                return OptionalDouble.of(kg);
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Converts a value in the given unit to kilograms.
     *
     * @return Weight in kilograms, empty for unknown units or non-positive values
     */
    public static OptionalDouble toKg(double value, String unit) {
        if (unit == null) return OptionalDouble.empty();
        Double factor = UNIT_TO_KG.get(canonicalUnit(unit));
        if (factor == null) return OptionalDouble.empty();
        double kg = value * factor;
        if (!Double.isFinite(kg) || kg <= 0 || kg > MAX_PLAUSIBLE_KG) return OptionalDouble.empty();
        return OptionalDouble.of(kg);
    }

    /** Typical weight for a recognizable product type in the title, if any. */
    public static OptionalDouble typeDefault(String title) {
        if (title == null) return OptionalDouble.empty();
        for (Map.Entry<Pattern, Double> e : TYPE_DEFAULTS.entrySet()) {
            if (e.getKey().matcher(title).find()) return OptionalDouble.of(e.getValue());
        }
        return OptionalDouble.empty();
    }

    /** Category average weight; empty for {@link ProductCategory#DEFAULT}. */
    public static OptionalDouble categoryDefault(ProductCategory category) {
        Double kg = category == null ? null : CATEGORY_DEFAULTS.get(category);
        return kg == null ? OptionalDouble.empty() : OptionalDouble.of(kg);
    }

    static String canonicalUnit(String unit) {
        String u = unit.trim().toLowerCase(Locale.ROOT);
        if (u.startsWith("kilo") || u.startsWith("kg")) return "kg";
        if (u.startsWith("gram") || u.equals("g")) return "g";
        if (u.startsWith("pound") || u.startsWith("lb")) return "lb";
        if (u.startsWith("ounce") || u.equals("oz")) return "oz";
        return u;
    }

    private static Double parseNumber(String token) {
        String t = token;
        // "1,000" is a thousands separator, "1,5" a decimal comma
        if (t.matches("\\d{1,3},\\d{3}")) t = t.replace(",", "");
        else t = t.replace(',', '.');
        try {
            return Double.parseDouble(t);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
