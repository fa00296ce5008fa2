package com.bloomcart.scoring.service.normalize;

import com.bloomcart.scoring.model.NormalizedProduct;
import com.bloomcart.scoring.model.ProductCategory;
import com.bloomcart.scoring.model.RawProduct;
import com.bloomcart.scoring.util.ProductKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Turns a scraped {@link RawProduct} into a canonical {@link NormalizedProduct}.
 *
 * <p>Normalization is deterministic-first: the rule-based steps run before any AI
 * hint is consulted, and hints only fill fields the rules left empty. Defaults
 * are applied last, each one recorded as a {@link Warn}.
 *
 * <h3>Phases</h3>
 * <ol>
 *   <li><strong>Deterministic steps</strong> - {@link CategoryResolver}, {@link WeightParser},
 *       {@link MaterialExtractor}, {@link OriginExtractor}</li>
 *   <li><strong>AI hints</strong> - validated gap filling from {@link ExtractionHints}</li>
 *   <li><strong>Title keywords</strong> - low-confidence category guess</li>
 *   <li><strong>Defaults</strong> - type, category and floor weight; {@code "mixed"} materials;
 *       {@code default} category</li>
 * </ol>
 *
 * <p>{@link #normalize(RawProduct)} is total: any field of the input may be
 * missing and the result always has a finite, strictly positive weight.
 *
 * @see NormalizerStep
 * @see NormalizationService
 */
public class Normalizer {
    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    static final String UNKNOWN_TITLE = "Unknown Product";
    private static final int MAX_DESCRIPTION_CHARS = 500;

    /** Ordered list of deterministic steps */
    private final List<NormalizerStep> steps;

    public Normalizer() {
        this.steps = Arrays.asList(
            new CategoryResolver(),
            new WeightParser(),
            new MaterialExtractor(),
            new OriginExtractor()
        );
    }

    /**
     * Normalizes without AI hints.
     *
     * @param raw The scraped product, possibly with every field missing
     * @return The normalized product
     */
    public NormalizedProduct normalize(RawProduct raw) {
        return normalize(raw, ExtractionHints.none());
    }

    /**
     * Normalizes, letting validated AI hints fill gaps left by the deterministic steps.
     *
     * @param raw The scraped product, possibly with every field missing
     * @param hints AI extraction hints, may be null
     * @return The normalized product
     */
    public NormalizedProduct normalize(RawProduct raw, ExtractionHints hints) {
        RawProduct in = raw != null ? raw : new RawProduct();
        NormalizationDraft draft = new NormalizationDraft(ProductKeys.of(in));

        for (NormalizerStep step : steps) {
            if (!step.supports(in)) continue;
            try {
                step.apply(in, draft);
            } catch (Exception e) {
                log.error("Error applying {} to product {}: {}", step.getName(), draft.getProductKey(), e.getMessage(), e);
            }
        }

        if (hints != null) {
            applyHints(in, hints, draft);
        }

        if (!draft.hasCategory()) {
            Optional<ProductCategory> guessed = CategoryResolver.fromTitle(in.getTitle());
            if (guessed.isPresent()) {
                draft.setCategory(guessed.get(), "title_keyword");
            } else {
                draft.setCategory(ProductCategory.DEFAULT, "default");
                draft.warn(Warn.categoryDefaulted(draft.getProductKey(), in.getCategory()));
            }
        }

        if (draft.getWeightKg() == null) {
            applyWeightDefault(in, draft);
        }

        if (draft.getMaterials().isEmpty()) {
            draft.addMaterials(Set.of("mixed"), "default");
            draft.warn(Warn.materialsDefaulted(draft.getProductKey()));
        }

        if (draft.getTitle() == null) {
            if (notBlank(in.getTitle())) draft.setTitle(in.getTitle().trim(), "explicit");
            else draft.setTitle(UNKNOWN_TITLE, "default");
        }

        if (draft.getDescription() == null) {
            draft.setDescription(composeDescription(in, draft.getTitle()), "composed");
        }

        NormalizedProduct out = draft.toProduct();
        log.debug("Normalized product {}: category={} weightKg={} materials={} provenance={}",
                draft.getProductKey(), out.getCategory().key(), out.getWeightKg(), out.getMaterials(), out.getProvenance());
        return out;
    }

    private void applyHints(RawProduct raw, ExtractionHints hints, NormalizationDraft draft) {
        String key = draft.getProductKey();

        if (notBlank(hints.getCleanedTitle())) {
            draft.setTitle(hints.getCleanedTitle().trim(), "ai");
        }

        if (!draft.hasCategory() && notBlank(hints.getCategory())) {
            Optional<ProductCategory> c = CategoryResolver.fromDepartment(hints.getCategory());
            if (c.isPresent()) {
                draft.setCategory(c.get(), "ai");
            } else {
                draft.warn(Warn.aiHintRejected(key, "category", hints.getCategory()));
            }
        }

        ExtractionHints.WeightHint w = hints.getWeight();
        if (draft.getWeightKg() == null && w != null && (w.getValue() != null || w.getUnit() != null)) {
            OptionalDouble kg = w.getValue() == null ? OptionalDouble.empty() : WeightParser.toKg(w.getValue(), w.getUnit());
            if (kg.isPresent()) {
                draft.setWeightKg(kg.getAsDouble(), "ai");
            } else {
                draft.warn(Warn.aiHintRejected(key, "weightKg", String.valueOf(w)));
            }
        }

        if (draft.getMaterials().isEmpty() && hints.getMaterials() != null && !hints.getMaterials().isEmpty()) {
            Set<String> mapped = new LinkedHashSet<>();
            for (String m : hints.getMaterials()) {
                String c = MaterialExtractor.canonical(m);
                if (c != null) mapped.add(c);
            }
            if (mapped.isEmpty()) {
                draft.warn(Warn.aiHintRejected(key, "materials", String.join(", ", hints.getMaterials())));
            } else {
                draft.addMaterials(mapped, "ai");
            }
        }

        if (notBlank(hints.getProductDescription())) {
            draft.setDescription(truncate(hints.getProductDescription().trim()), "ai");
        }
    }

    private void applyWeightDefault(RawProduct raw, NormalizationDraft draft) {
        String key = draft.getProductKey();
        OptionalDouble byType = WeightParser.typeDefault(raw.getTitle());
        if (byType.isPresent()) {
            draft.setWeightKg(byType.getAsDouble(), "type_default");
            draft.warn(Warn.weightDefaulted(key, "type_default", byType.getAsDouble()));
            return;
        }
        OptionalDouble byCategory = WeightParser.categoryDefault(draft.getCategory());
        if (byCategory.isPresent()) {
            draft.setWeightKg(byCategory.getAsDouble(), "category_default");
            draft.warn(Warn.weightDefaulted(key, "category_default", byCategory.getAsDouble()));
            return;
        }
        draft.setWeightKg(WeightParser.FLOOR_DEFAULT_KG, "floor_default");
        draft.warn(Warn.weightDefaulted(key, "floor_default", WeightParser.FLOOR_DEFAULT_KG));
    }

    private static String composeDescription(RawProduct raw, String title) {
        StringBuilder sb = new StringBuilder(title);
        if (notBlank(raw.getBrand())) sb.append(" by ").append(raw.getBrand().trim());
        if (notBlank(raw.getDescription())) sb.append(". ").append(raw.getDescription().trim());
        return truncate(sb.toString());
    }

    private static String truncate(String s) {
        return s.length() <= MAX_DESCRIPTION_CHARS ? s : s.substring(0, MAX_DESCRIPTION_CHARS);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
