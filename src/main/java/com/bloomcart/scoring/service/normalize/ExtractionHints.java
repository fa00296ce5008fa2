package com.bloomcart.scoring.service.normalize;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Structured product attributes suggested by the AI extractor. Every field is
 * optional and untrusted; the Normalizer validates each one before use and
 * only lets it fill a gap left by deterministic parsing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractionHints {
    private String cleanedTitle;
    private WeightHint weight;
    private List<String> materials;
    private String category;
    private String productDescription;

    public static ExtractionHints none() {
        return new ExtractionHints();
    }

    public String getCleanedTitle() { return cleanedTitle; }
    public void setCleanedTitle(String cleanedTitle) { this.cleanedTitle = cleanedTitle; }
    public WeightHint getWeight() { return weight; }
    public void setWeight(WeightHint weight) { this.weight = weight; }
    public List<String> getMaterials() { return materials; }
    public void setMaterials(List<String> materials) { this.materials = materials; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public String getProductDescription() { return productDescription; }
    public void setProductDescription(String productDescription) { this.productDescription = productDescription; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WeightHint {
        private Double value;
        private String unit;

        public WeightHint() {}

        public WeightHint(Double value, String unit) {
            this.value = value;
            this.unit = unit;
        }

        public Double getValue() { return value; }
        public void setValue(Double value) { this.value = value; }
        public String getUnit() { return unit; }
        public void setUnit(String unit) { this.unit = unit; }

        @Override
        public String toString() {
            return value + " " + unit;
        }
    }
}
