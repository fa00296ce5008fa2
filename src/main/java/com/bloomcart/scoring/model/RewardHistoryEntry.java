package com.bloomcart.scoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/** One folded score: the grade label as received, the delta applied and when. */
public final class RewardHistoryEntry {
    private final String grade;
    private final int delta;
    private final Instant timestamp;

    @JsonCreator
    public RewardHistoryEntry(@JsonProperty("grade") String grade,
                              @JsonProperty("delta") int delta,
                              @JsonProperty("timestamp") Instant timestamp) {
        this.grade = grade;
        this.delta = delta;
        this.timestamp = timestamp;
    }

    public String getGrade() { return grade; }
    public int getDelta() { return delta; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RewardHistoryEntry other)) return false;
        return delta == other.delta && Objects.equals(grade, other.grade) && Objects.equals(timestamp, other.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(grade, delta, timestamp);
    }
}
