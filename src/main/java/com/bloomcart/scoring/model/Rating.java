package com.bloomcart.scoring.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Coarse label for a single factor score. */
public enum Rating {
    EXCELLENT("Excellent"),
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor"),
    VERY_POOR("Very Poor");

    private final String label;

    Rating(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Rating forScore(double score) {
        if (score >= 80) return EXCELLENT;
        if (score >= 60) return GOOD;
        if (score >= 40) return FAIR;
        if (score >= 20) return POOR;
        return VERY_POOR;
    }
}
