package com.bloomcart.scoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Percentiles in [1, 99] against the product's category benchmark; higher is more sustainable. */
public final class PercentileRanking {
    private final int overall;
    private final int carbon;
    private final int water;
    private final int energy;
    private final int recyclability;

    @JsonCreator
    public PercentileRanking(@JsonProperty("overall") int overall,
                             @JsonProperty("carbon") int carbon,
                             @JsonProperty("water") int water,
                             @JsonProperty("energy") int energy,
                             @JsonProperty("recyclability") int recyclability) {
        this.overall = overall;
        this.carbon = carbon;
        this.water = water;
        this.energy = energy;
        this.recyclability = recyclability;
    }

    public int getOverall() { return overall; }
    public int getCarbon() { return carbon; }
    public int getWater() { return water; }
    public int getEnergy() { return energy; }
    public int getRecyclability() { return recyclability; }
}
