package com.bloomcart.scoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One dimension of a {@link ScoreBreakdown}: a 0..100 score (higher is better),
 * the absolute value that drove it with its unit, and an optional human detail
 * (origin label, packaging descriptor).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FactorScore {
    private final double score;
    private final double value;
    private final String unit;
    private final Rating rating;
    private final String detail;

    @JsonCreator
    public FactorScore(@JsonProperty("score") double score,
                       @JsonProperty("value") double value,
                       @JsonProperty("unit") String unit,
                       @JsonProperty("rating") Rating rating,
                       @JsonProperty("detail") String detail) {
        this.score = score;
        this.value = value;
        this.unit = unit;
        this.rating = rating != null ? rating : Rating.forScore(score);
        this.detail = detail;
    }

    public static FactorScore of(double score, double value, String unit) {
        return new FactorScore(score, value, unit, Rating.forScore(score), null);
    }

    public static FactorScore of(double score, double value, String unit, String detail) {
        return new FactorScore(score, value, unit, Rating.forScore(score), detail);
    }

    public double getScore() { return score; }
    public double getValue() { return value; }
    public String getUnit() { return unit; }
    public Rating getRating() { return rating; }
    public String getDetail() { return detail; }
}
