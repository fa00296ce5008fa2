package com.bloomcart.scoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Which tier of the estimation chain produced a footprint. */
public enum FootprintSource {
    PRIMARY,
    SECONDARY,
    HEURISTIC;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FootprintSource fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
