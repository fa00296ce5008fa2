package com.bloomcart.scoring.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Letter grades, best first. How many of them a deployment uses and where
 * their boundaries sit is decided by {@link com.bloomcart.scoring.service.scoring.GradeScale}.
 */
public enum Grade {
    A, B, C, D, E, F, G;

    public static Optional<Grade> parse(String label) {
        if (label == null || label.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
