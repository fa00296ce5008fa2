package com.bloomcart.scoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Canonical product categories. Benchmark rows, default weights and water
 * multipliers are keyed by these; anything unrecognized maps to {@link #DEFAULT}.
 */
public enum ProductCategory {
    ELECTRONICS("electronics"),
    CLOTHING("clothing"),
    FURNITURE("furniture"),
    FOOD("food"),
    BOOKS("books"),
    TOYS("toys"),
    BEAUTY("beauty"),
    KITCHEN("kitchen"),
    SPORTS("sports"),
    HOME("home"),
    OFFICE("office"),
    DEFAULT("default");

    private final String key;

    ProductCategory(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static ProductCategory fromKey(String key) {
        if (key == null) return DEFAULT;
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (ProductCategory c : values()) {
            if (c.key.equals(k)) return c;
        }
        return DEFAULT;
    }
}
