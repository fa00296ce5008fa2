package com.bloomcart.scoring.service.normalize;

import com.bloomcart.scoring.model.ProductCategory;
import com.bloomcart.scoring.model.RawProduct;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves the canonical category from the explicit category field, then from a
 * breadcrumb-like hierarchy (category text with separators, or a breadcrumb row
 * in the detail table), scanning from the most specific segment to the root.
 *
 * <p>Title keyword guessing is a later, lower-confidence phase and lives in
 * {@link #fromTitle(String)} so the Normalizer can run AI hints in between.
 */
public class CategoryResolver implements NormalizerStep {

    private static final Pattern HIERARCHY_SEPARATORS = Pattern.compile("\\s*(?:›|»|>|/|\\|)\\s*");

    // Department and breadcrumb vocabulary. Order matters: "Home & Kitchen" is kitchen, not home.
    private static final Map<ProductCategory, Pattern> DEPARTMENT_PATTERNS = new LinkedHashMap<>();
    static {
        DEPARTMENT_PATTERNS.put(ProductCategory.ELECTRONICS, Pattern.compile(
                "\\b(electronics?|computers?|cell\\s*phones?|headphones?|earbuds|audio|camera|television|tv|laptops?|tablets?|wearable)\\b",
                Pattern.CASE_INSENSITIVE));
        DEPARTMENT_PATTERNS.put(ProductCategory.CLOTHING, Pattern.compile(
                "\\b(clothing|apparel|fashion|shoes|jewelry|shirts?|dress(es)?|textiles?)\\b", Pattern.CASE_INSENSITIVE));
        DEPARTMENT_PATTERNS.put(ProductCategory.FURNITURE, Pattern.compile(
                "\\b(furniture|sofas?|chairs?|desks?|tables?|mattress(es)?)\\b", Pattern.CASE_INSENSITIVE));
        DEPARTMENT_PATTERNS.put(ProductCategory.FOOD, Pattern.compile(
                "\\b(food|grocery|gourmet|snacks?|beverages?|pantry)\\b", Pattern.CASE_INSENSITIVE));
        DEPARTMENT_PATTERNS.put(ProductCategory.BOOKS, Pattern.compile(
                "\\b(books?|kindle|textbooks?|magazines?)\\b", Pattern.CASE_INSENSITIVE));
        DEPARTMENT_PATTERNS.put(ProductCategory.TOYS, Pattern.compile(
                "\\b(toys?|games?|puzzles?|lego)\\b", Pattern.CASE_INSENSITIVE));
        DEPARTMENT_PATTERNS.put(ProductCategory.BEAUTY, Pattern.compile(
                "\\b(beauty|personal\\s*care|skin\\s*care|skincare|makeup|cosmetics?|hair\\s*care)\\b", Pattern.CASE_INSENSITIVE));
        DEPARTMENT_PATTERNS.put(ProductCategory.KITCHEN, Pattern.compile(
                "\\b(kitchen|dining|cookware|bakeware|small\\s*appliances?)\\b", Pattern.CASE_INSENSITIVE));
        DEPARTMENT_PATTERNS.put(ProductCategory.SPORTS, Pattern.compile(
                "\\b(sports?|outdoors?|fitness|exercise|cycling|camping)\\b", Pattern.CASE_INSENSITIVE));
        DEPARTMENT_PATTERNS.put(ProductCategory.HOME, Pattern.compile(
                "\\b(home|garden|household|bedding|bath|d[eé]cor|patio)\\b", Pattern.CASE_INSENSITIVE));
        DEPARTMENT_PATTERNS.put(ProductCategory.OFFICE, Pattern.compile(
                "\\b(office|stationery|school\\s*supplies|printers?)\\b", Pattern.CASE_INSENSITIVE));
    }

    // Product-type words seen in titles, used only when nothing explicit matched
    private static final Map<ProductCategory, Pattern> TITLE_PATTERNS = new LinkedHashMap<>();
    static {
        TITLE_PATTERNS.put(ProductCategory.ELECTRONICS, Pattern.compile(
                "\\b(laptop|computer|tablet|monitor|phone|smartphone|earbuds|headphones?|smartwatch|charger|speaker)\\b", Pattern.CASE_INSENSITIVE));
        TITLE_PATTERNS.put(ProductCategory.CLOTHING, Pattern.compile(
                "\\b(shirt|t-shirt|dress|clothing|shoes|sneakers?|hoodie|jacket|jeans|socks)\\b", Pattern.CASE_INSENSITIVE));
        TITLE_PATTERNS.put(ProductCategory.FURNITURE, Pattern.compile(
                "\\b(furniture|sofa|desk|chair|table|bookshelf|dresser)\\b", Pattern.CASE_INSENSITIVE));
        TITLE_PATTERNS.put(ProductCategory.FOOD, Pattern.compile(
                "\\b(food|snack|vitamin|supplement|protein|coffee|tea)\\b", Pattern.CASE_INSENSITIVE));
        TITLE_PATTERNS.put(ProductCategory.BOOKS, Pattern.compile(
                "\\b(book|paperback|hardcover|kindle|journal|notebook)\\b", Pattern.CASE_INSENSITIVE));
        TITLE_PATTERNS.put(ProductCategory.TOYS, Pattern.compile(
                "\\b(toy|game|lego|puzzle|doll|plush)\\b", Pattern.CASE_INSENSITIVE));
        TITLE_PATTERNS.put(ProductCategory.BEAUTY, Pattern.compile(
                "\\b(cream|serum|lotion|makeup|beauty|skincare|shampoo|lipstick)\\b", Pattern.CASE_INSENSITIVE));
        TITLE_PATTERNS.put(ProductCategory.KITCHEN, Pattern.compile(
                "\\b(kitchen|blender|toaster|microwave|cookware|pan|pot|kettle)\\b", Pattern.CASE_INSENSITIVE));
        TITLE_PATTERNS.put(ProductCategory.SPORTS, Pattern.compile(
                "\\b(yoga|dumbbell|treadmill|bicycle|tent|racket)\\b", Pattern.CASE_INSENSITIVE));
    }

    private static final List<String> BREADCRUMB_DETAIL_KEYS = List.of("breadcrumbs", "breadcrumb", "category path");

    @Override
    public boolean supports(RawProduct raw) {
        return notBlank(raw.getCategory()) || breadcrumbFromDetails(raw) != null;
    }

    @Override
    public void apply(RawProduct raw, NormalizationDraft draft) {
        if (draft.hasCategory()) return;

        String explicit = raw.getCategory();
        if (notBlank(explicit) && !HIERARCHY_SEPARATORS.matcher(explicit).find()) {
            Optional<ProductCategory> c = fromDepartment(explicit);
            if (c.isPresent()) {
                draft.setCategory(c.get(), "explicit");
                return;
            }
        }

        List<String> trail = new ArrayList<>();
        if (notBlank(explicit) && HIERARCHY_SEPARATORS.matcher(explicit).find()) {
            trail.addAll(splitTrail(explicit));
        }
        String crumb = breadcrumbFromDetails(raw);
        if (crumb != null) {
            trail.addAll(splitTrail(crumb));
        }
        for (int i = trail.size() - 1; i >= 0; i--) {
            Optional<ProductCategory> c = fromDepartment(trail.get(i));
            if (c.isPresent()) {
                draft.setCategory(c.get(), "breadcrumb");
                return;
            }
        }
    }

    /**
     * Maps a department or breadcrumb segment onto a known category.
     *
     * @param text Department text such as "Cell Phones &amp; Accessories"
     * @return The matching category, empty if none matched
     */
    public static Optional<ProductCategory> fromDepartment(String text) {
        if (!notBlank(text)) return Optional.empty();
        ProductCategory direct = ProductCategory.fromKey(text);
        if (direct != ProductCategory.DEFAULT) return Optional.of(direct);
        for (Map.Entry<ProductCategory, Pattern> e : DEPARTMENT_PATTERNS.entrySet()) {
            if (e.getValue().matcher(text).find()) return Optional.of(e.getKey());
        }
        return Optional.empty();
    }

    /**
     * Guesses a category from product-type words in the title.
     *
     * @param title Product title
     * @return The guessed category, empty if no product-type word matched
     */
    public static Optional<ProductCategory> fromTitle(String title) {
        if (!notBlank(title)) return Optional.empty();
        for (Map.Entry<ProductCategory, Pattern> e : TITLE_PATTERNS.entrySet()) {
            if (e.getValue().matcher(title).find()) return Optional.of(e.getKey());
        }
        return Optional.empty();
    }

    private static List<String> splitTrail(String text) {
        List<String> out = new ArrayList<>();
        for (String s : HIERARCHY_SEPARATORS.split(text)) {
            if (notBlank(s)) out.add(s.trim());
        }
        return out;
    }

    private static String breadcrumbFromDetails(RawProduct raw) {
        if (raw.getDetails() == null) return null;
        for (Map.Entry<String, String> e : raw.getDetails().entrySet()) {
            if (e.getKey() != null && BREADCRUMB_DETAIL_KEYS.contains(e.getKey().trim().toLowerCase()) && notBlank(e.getValue())) {
                return e.getValue();
            }
        }
        return null;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
