package com.bloomcart.scoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * The cached record for one product key: the normalized product, its footprint,
 * score breakdown and percentile ranking, plus display equivalents
 * ("drivingKm", "showers", "phoneCharges").
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProductEvaluation {
    private final String productKey;
    private final NormalizedProduct product;
    private final FootprintResult footprint;
    private final ScoreBreakdown breakdown;
    private final PercentileRanking percentiles;
    private final Map<String, Double> equivalents;
    private final Instant evaluatedAt;

    @JsonCreator
    public ProductEvaluation(@JsonProperty("productKey") String productKey,
                             @JsonProperty("product") NormalizedProduct product,
                             @JsonProperty("footprint") FootprintResult footprint,
                             @JsonProperty("breakdown") ScoreBreakdown breakdown,
                             @JsonProperty("percentiles") PercentileRanking percentiles,
                             @JsonProperty("equivalents") Map<String, Double> equivalents,
                             @JsonProperty("evaluatedAt") Instant evaluatedAt) {
        this.productKey = productKey;
        this.product = product;
        this.footprint = footprint;
        this.breakdown = breakdown;
        this.percentiles = percentiles;
        this.equivalents = equivalents == null ? Map.of() : Map.copyOf(equivalents);
        this.evaluatedAt = evaluatedAt;
    }

    public String getProductKey() { return productKey; }
    public NormalizedProduct getProduct() { return product; }
    public FootprintResult getFootprint() { return footprint; }
    public ScoreBreakdown getBreakdown() { return breakdown; }
    public PercentileRanking getPercentiles() { return percentiles; }
    public Map<String, Double> getEquivalents() { return equivalents; }
    public Instant getEvaluatedAt() { return evaluatedAt; }
}
