package com.bloomcart.scoring.model;

import com.bloomcart.scoring.service.normalize.Warn;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonical product description produced once per raw record by the Normalizer.
 *
 * <p>{@code weightKg} is always finite and strictly positive; the constructor
 * rejects anything else so the invariant cannot be broken after normalization.
 * {@code materials} is never empty ({@code "mixed"} when nothing was recognized).
 *
 * <p>{@code provenance} maps field name to the source that produced the value
 * (explicit, breadcrumb, regex, ai, category_default, ...).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NormalizedProduct {
    private final String title;
    private final ProductCategory category;
    private final double weightKg;
    private final Set<String> materials;
    private final String description;
    private final String origin;
    private final String shippingMethod;
    private final Map<String, String> provenance;
    private final List<Warn> warnings;

    @JsonCreator
    public NormalizedProduct(@JsonProperty("title") String title,
                             @JsonProperty("category") ProductCategory category,
                             @JsonProperty("weightKg") double weightKg,
                             @JsonProperty("materials") Set<String> materials,
                             @JsonProperty("description") String description,
                             @JsonProperty("origin") String origin,
                             @JsonProperty("shippingMethod") String shippingMethod,
                             @JsonProperty("provenance") Map<String, String> provenance,
                             @JsonProperty("warnings") List<Warn> warnings) {
        if (!Double.isFinite(weightKg) || weightKg <= 0) {
            throw new IllegalArgumentException("weightKg must be finite and > 0, got " + weightKg);
        }
        this.title = title == null ? "" : title;
        this.category = category == null ? ProductCategory.DEFAULT : category;
        this.weightKg = weightKg;
        this.materials = materials == null || materials.isEmpty()
                ? Set.of("mixed")
                : Collections.unmodifiableSet(new LinkedHashSet<>(materials));
        this.description = description == null ? "" : description;
        this.origin = origin;
        this.shippingMethod = shippingMethod;
        this.provenance = provenance == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public NormalizedProduct(String title, ProductCategory category, double weightKg,
                             Set<String> materials, String description) {
        this(title, category, weightKg, materials, description, null, null, null, null);
    }

    public String getTitle() { return title; }
    public ProductCategory getCategory() { return category; }
    public double getWeightKg() { return weightKg; }
    public Set<String> getMaterials() { return materials; }
    public String getDescription() { return description; }
    public String getOrigin() { return origin; }
    public String getShippingMethod() { return shippingMethod; }
    public Map<String, String> getProvenance() { return provenance; }
    public List<Warn> getWarnings() { return warnings; }
}
