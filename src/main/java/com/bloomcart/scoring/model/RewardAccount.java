package com.bloomcart.scoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Bounded reward state for one account: a value in [0, 100], counters and the
 * fold history (oldest first). Instances are immutable; every fold produces a
 * new account via {@link com.bloomcart.scoring.service.reward.RewardAggregator}.
 */
public final class RewardAccount {
    public static final int MIN_VALUE = 0;
    public static final int MAX_VALUE = 100;

    private final String accountId;
    private final int value;
    private final int totalCount;
    private final int favorableCount;
    private final List<RewardHistoryEntry> history;
    private final Instant updatedAt;

    @JsonCreator
    public RewardAccount(@JsonProperty("accountId") String accountId,
                         @JsonProperty("value") int value,
                         @JsonProperty("totalCount") int totalCount,
                         @JsonProperty("favorableCount") int favorableCount,
                         @JsonProperty("history") List<RewardHistoryEntry> history,
                         @JsonProperty("updatedAt") Instant updatedAt) {
        this.accountId = accountId;
        this.value = Math.max(MIN_VALUE, Math.min(MAX_VALUE, value));
        this.totalCount = Math.max(0, totalCount);
        this.favorableCount = Math.max(0, favorableCount);
        this.history = history == null ? List.of() : List.copyOf(history);
        this.updatedAt = updatedAt;
    }

    public static RewardAccount fresh(String accountId, int initialValue) {
        return new RewardAccount(accountId, initialValue, 0, 0, List.of(), null);
    }

    public String getAccountId() { return accountId; }
    public int getValue() { return value; }
    public int getTotalCount() { return totalCount; }
    public int getFavorableCount() { return favorableCount; }
    public List<RewardHistoryEntry> getHistory() { return history; }
    public Instant getUpdatedAt() { return updatedAt; }
}
