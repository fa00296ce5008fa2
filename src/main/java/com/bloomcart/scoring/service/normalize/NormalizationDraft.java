package com.bloomcart.scoring.service.normalize;

import com.bloomcart.scoring.model.NormalizedProduct;
import com.bloomcart.scoring.model.ProductCategory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable working state of one normalization run. Owned by a single call to
 * {@link Normalizer#normalize}; never shared between threads.
 */
public class NormalizationDraft {
    private final String productKey;
    private String title;
    private ProductCategory category;
    private Double weightKg;
    private final Set<String> materials = new LinkedHashSet<>();
    private String description;
    private String origin;
    private String shippingMethod;
    private final Map<String, String> provenance = new LinkedHashMap<>();
    private final List<Warn> warnings = new ArrayList<>();

    public NormalizationDraft(String productKey) {
        this.productKey = productKey;
    }

    public String getProductKey() { return productKey; }

    public String getTitle() { return title; }
    public ProductCategory getCategory() { return category; }
    public Double getWeightKg() { return weightKg; }
    public Set<String> getMaterials() { return materials; }
    public String getDescription() { return description; }
    public String getOrigin() { return origin; }
    public String getShippingMethod() { return shippingMethod; }
    public Map<String, String> getProvenance() { return provenance; }
    public List<Warn> getWarnings() { return warnings; }

    public boolean hasCategory() {
        return category != null && category != ProductCategory.DEFAULT;
    }

    public void setTitle(String title, String source) {
        this.title = title;
        provenance.put("title", source);
    }

    public void setCategory(ProductCategory category, String source) {
        this.category = category;
        provenance.put("category", source);
    }

    public void setWeightKg(double weightKg, String source) {
        this.weightKg = weightKg;
        provenance.put("weightKg", source);
    }

    public void addMaterials(Set<String> found, String source) {
        if (found.isEmpty()) return;
        materials.addAll(found);
        provenance.putIfAbsent("materials", source);
    }

    public void setDescription(String description, String source) {
        this.description = description;
        provenance.put("description", source);
    }

    public void setOrigin(String origin) {
        this.origin = origin;
        provenance.put("origin", "explicit");
    }

    public void setShippingMethod(String shippingMethod) {
        this.shippingMethod = shippingMethod;
        provenance.put("shippingMethod", "explicit");
    }

    public void warn(Warn w) {
        warnings.add(w);
    }

    NormalizedProduct toProduct() {
        return new NormalizedProduct(title, category, weightKg, materials, description,
                origin, shippingMethod, provenance, warnings);
    }
}
