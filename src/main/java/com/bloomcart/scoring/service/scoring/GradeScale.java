package com.bloomcart.scoring.service.scoring;

import com.bloomcart.scoring.config.GradingProperties;
import com.bloomcart.scoring.model.Grade;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Ordered grade bands, best first. The same table turns an overall score into a
 * grade and a grade into a reward delta, so the two can never drift apart.
 *
 * <p>Band count is whatever the configuration lists; nothing else in the
 * pipeline assumes seven.
 */
@Component
public class GradeScale {

    public static final class Band {
        private final Grade grade;
        private final double minScore;
        private final int delta;

        Band(Grade grade, double minScore, int delta) {
            this.grade = grade;
            this.minScore = minScore;
            this.delta = delta;
        }

        public Grade getGrade() { return grade; }
        public double getMinScore() { return minScore; }
        public int getDelta() { return delta; }
    }

    private final List<Band> bands;
    private final int favorableBands;

    @Autowired
    public GradeScale(GradingProperties properties) {
        this(properties.getBands(), properties.getFavorableBands());
    }

    public GradeScale(List<GradingProperties.Band> configured, int favorableBands) {
        if (configured == null || configured.isEmpty()) {
            throw new IllegalArgumentException("grading.bands must list at least one band");
        }
        List<Band> out = new ArrayList<>();
        Set<Grade> seen = new HashSet<>();
        double previousMin = Double.POSITIVE_INFINITY;
        for (GradingProperties.Band b : configured) {
            Grade g = Grade.parse(b.getGrade())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown grade label in grading.bands: " + b.getGrade()));
            if (!seen.add(g)) {
                throw new IllegalArgumentException("Duplicate grade in grading.bands: " + g);
            }
            if (b.getMinScore() >= previousMin) {
                throw new IllegalArgumentException("grading.bands must be listed best first with decreasing min-score");
            }
            previousMin = b.getMinScore();
            out.add(new Band(g, b.getMinScore(), b.getDelta()));
        }
        this.bands = Collections.unmodifiableList(out);
        this.favorableBands = Math.max(0, Math.min(favorableBands, out.size()));
    }

    public static GradeScale defaults() {
        return new GradeScale(GradingProperties.defaultBands(), 2);
    }

    public List<Band> getBands() {
        return bands;
    }

    /**
     * Highest band whose minimum the score reaches; scores below every minimum get the last band.
     */
    public Grade gradeFor(double overallScore) {
        for (Band b : bands) {
            if (overallScore >= b.minScore) return b.grade;
        }
        return bands.get(bands.size() - 1).grade;
    }

    /**
     * @return The reward delta for the grade label, empty if the label is not on this scale
     */
    public OptionalInt delta(String gradeLabel) {
        int i = indexOf(gradeLabel);
        return i < 0 ? OptionalInt.empty() : OptionalInt.of(bands.get(i).delta);
    }

    public boolean isKnown(String gradeLabel) {
        return indexOf(gradeLabel) >= 0;
    }

    public boolean isFavorable(String gradeLabel) {
        int i = indexOf(gradeLabel);
        return i >= 0 && i < favorableBands;
    }

    private int indexOf(String gradeLabel) {
        if (gradeLabel == null) return -1;
        String label = gradeLabel.trim().toUpperCase(Locale.ROOT);
        for (int i = 0; i < bands.size(); i++) {
            if (bands.get(i).grade.name().equals(label)) return i;
        }
        return -1;
    }
}
