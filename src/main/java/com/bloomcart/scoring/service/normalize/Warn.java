package com.bloomcart.scoring.service.normalize;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Represents a data-quality issue encountered while normalizing a product.
 *
 * <p>Warnings never stop normalization; they record where a value had to be
 * defaulted or where an AI hint was discarded, so the final record explains
 * itself.
 *
 * <h3>Warning Types</h3>
 * <ul>
 *   <li><strong>WEIGHT_DEFAULTED</strong> - No explicit weight; a type, category or floor default was used</li>
 *   <li><strong>CATEGORY_DEFAULTED</strong> - No known category could be resolved</li>
 *   <li><strong>MATERIALS_DEFAULTED</strong> - No material keyword matched; "mixed" was used</li>
 *   <li><strong>AI_HINT_REJECTED</strong> - An AI extraction hint failed validation and was ignored</li>
 * </ul>
 *
 * @see Normalizer
 * @see NormalizerStep
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Warn {
    /** Canonical product key, when known */
    private final String productKey;

    /** Warning code for categorization */
    private final String code;

    /** Field name if the warning is field-specific */
    private final String field;

    /** Human-readable warning message */
    private final String message;

    /** Supporting evidence or context for the warning */
    private final String evidence;

    @JsonCreator
    public Warn(@JsonProperty("productKey") String productKey,
                @JsonProperty("code") String code,
                @JsonProperty("field") String field,
                @JsonProperty("message") String message,
                @JsonProperty("evidence") String evidence) {
        this.productKey = productKey;
        this.code = code;
        this.field = field;
        this.message = message;
        this.evidence = evidence;
    }

    public String getProductKey() { return productKey; }
    public String getCode() { return code; }
    public String getField() { return field; }
    public String getMessage() { return message; }
    public String getEvidence() { return evidence; }

    /**
     * Creates a weight defaulted warning.
     *
     * @param productKey Product key for identification
     * @param source Which default was used (type_default, category_default, floor_default)
     * @param weightKg The defaulted weight
     * @return A weight defaulted warning
     */
    public static Warn weightDefaulted(String productKey, String source, double weightKg) {
        return new Warn(productKey, "WEIGHT_DEFAULTED", "weightKg",
                String.format("No explicit weight found; using %s of %.2f kg", source, weightKg), null);
    }

    /**
     * Creates a category defaulted warning.
     *
     * @param productKey Product key for identification
     * @param evidence The category text that could not be mapped (can be null)
     * @return A category defaulted warning
     */
    public static Warn categoryDefaulted(String productKey, String evidence) {
        return new Warn(productKey, "CATEGORY_DEFAULTED", "category",
                "No known category matched; using default benchmarks", evidence);
    }

    /**
     * Creates a materials defaulted warning.
     *
     * @param productKey Product key for identification
     * @return A materials defaulted warning
     */
    public static Warn materialsDefaulted(String productKey) {
        return new Warn(productKey, "MATERIALS_DEFAULTED", "materials",
                "No material keyword matched; using 'mixed'", null);
    }

    /**
     * Creates an AI hint rejected warning.
     *
     * <p>Used when the AI extractor returned a value that fails validation
     * (non-positive weight, unknown unit, unmapped category).
     *
     * @param productKey Product key for identification
     * @param field Field the hint was for
     * @param evidence The rejected value
     * @return An AI hint rejected warning
     */
    public static Warn aiHintRejected(String productKey, String field, String evidence) {
        return new Warn(productKey, "AI_HINT_REJECTED", field,
                String.format("AI hint for '%s' failed validation", field), evidence);
    }

    @Override
    public String toString() {
        return code + (field != null ? "[" + field + "]" : "") + ": " + message;
    }
}
