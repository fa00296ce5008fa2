package com.bloomcart.scoring.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Grade band table shared by the scorer (score to grade) and the reward
 * aggregator (grade to delta). Bands are listed best first.
 */
@ConfigurationProperties(prefix = "grading")
public class GradingProperties {
    private List<Band> bands = defaultBands();
    /**
     * How many of the best bands count as favorable for reward tracking.
     */
    private int favorableBands = 2;

    public static List<Band> defaultBands() {
        List<Band> out = new ArrayList<>();
        out.add(new Band("A", 85, 15));
        out.add(new Band("B", 70, 10));
        out.add(new Band("C", 55, 5));
        out.add(new Band("D", 40, 0));
        out.add(new Band("E", 25, -10));
        out.add(new Band("F", 10, -15));
        out.add(new Band("G", 0, -20));
        return out;
    }

    public List<Band> getBands() {
        return bands;
    }

    public void setBands(List<Band> bands) {
        this.bands = bands;
    }

    public int getFavorableBands() {
        return favorableBands;
    }

    public void setFavorableBands(int favorableBands) {
        this.favorableBands = favorableBands;
    }

    public static class Band {
        private String grade;
        private double minScore;
        private int delta;

        public Band() {}

        public Band(String grade, double minScore, int delta) {
            this.grade = grade;
            this.minScore = minScore;
            this.delta = delta;
        }

        public String getGrade() {
            return grade;
        }

        public void setGrade(String grade) {
            this.grade = grade;
        }

        public double getMinScore() {
            return minScore;
        }

        public void setMinScore(double minScore) {
            this.minScore = minScore;
        }

        public int getDelta() {
            return delta;
        }

        public void setDelta(int delta) {
            this.delta = delta;
        }
    }
}
