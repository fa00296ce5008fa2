package com.bloomcart.scoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Six-factor sustainability score for one product.
 *
 * <p>{@code overallScore} is the fixed linear combination of the factor scores
 * (see {@link com.bloomcart.scoring.service.scoring.SustainabilityScorer#WEIGHTS}); it is not
 * rounded, so the identity holds to floating-point tolerance. {@code grade} is the
 * band of {@code overallScore} under the configured grade scale.
 */
public final class ScoreBreakdown {
    private final FactorScore carbon;
    private final FactorScore water;
    private final FactorScore energy;
    private final FactorScore transport;
    private final FactorScore endOfLife;
    private final FactorScore packaging;
    private final double overallScore;
    private final Grade grade;

    @JsonCreator
    public ScoreBreakdown(@JsonProperty("carbon") FactorScore carbon,
                          @JsonProperty("water") FactorScore water,
                          @JsonProperty("energy") FactorScore energy,
                          @JsonProperty("transport") FactorScore transport,
                          @JsonProperty("endOfLife") FactorScore endOfLife,
                          @JsonProperty("packaging") FactorScore packaging,
                          @JsonProperty("overallScore") double overallScore,
                          @JsonProperty("grade") Grade grade) {
        this.carbon = carbon;
        this.water = water;
        this.energy = energy;
        this.transport = transport;
        this.endOfLife = endOfLife;
        this.packaging = packaging;
        this.overallScore = overallScore;
        this.grade = grade;
    }

    public FactorScore getCarbon() { return carbon; }
    public FactorScore getWater() { return water; }
    public FactorScore getEnergy() { return energy; }
    public FactorScore getTransport() { return transport; }
    public FactorScore getEndOfLife() { return endOfLife; }
    public FactorScore getPackaging() { return packaging; }
    public double getOverallScore() { return overallScore; }
    public Grade getGrade() { return grade; }
}
