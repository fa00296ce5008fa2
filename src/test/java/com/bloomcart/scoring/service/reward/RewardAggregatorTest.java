package com.bloomcart.scoring.service.reward;

import com.bloomcart.scoring.model.RewardAccount;
import com.bloomcart.scoring.model.RewardHistoryEntry;
import com.bloomcart.scoring.service.scoring.GradeScale;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RewardAggregatorTest {

    private final RewardAggregator aggregator = new RewardAggregator(GradeScale.defaults());
    private final Instant now = Instant.parse("2026-05-01T10:00:00Z");

    private RewardAccount account(int value) {
        return new RewardAccount("acct-1", value, 3, 1, List.of(), null);
    }

    @Test
    public void valueIsClampedAtTheTop() {
        RewardAccount out = aggregator.apply(account(95), "A", now);
        assertEquals(100, out.getValue());
        assertEquals(15, out.getHistory().get(0).getDelta(), "history keeps the nominal delta");
    }

    @Test
    public void valueIsClampedAtTheBottom() {
        RewardAccount out = aggregator.apply(account(5), "G", now);
        assertEquals(0, out.getValue());
    }

    @Test
    public void countsAndHistoryGrowByOne() {
        RewardAccount start = account(50);
        RewardAccount afterB = aggregator.apply(start, "b", now);
        RewardAccount afterD = aggregator.apply(afterB, "D", now.plusSeconds(60));

        assertEquals(60, afterB.getValue());
        assertEquals(4, afterB.getTotalCount());
        assertEquals(2, afterB.getFavorableCount());
        assertEquals(5, afterD.getTotalCount());
        assertEquals(2, afterD.getFavorableCount());
        assertEquals(List.of(new RewardHistoryEntry("B", 10, now), new RewardHistoryEntry("D", 0, now.plusSeconds(60))),
                afterD.getHistory());
        assertEquals(now.plusSeconds(60), afterD.getUpdatedAt());
        assertTrue(start.getHistory().isEmpty(), "input account is not mutated");
    }

    @Test
    public void unknownGradeFoldsWithZeroDelta() {
        RewardAccount out = aggregator.apply(account(50), "Z", now);

        assertEquals(50, out.getValue());
        assertEquals(4, out.getTotalCount());
        assertEquals(1, out.getFavorableCount());
        assertEquals(1, out.getHistory().size());
        assertEquals(0, out.getHistory().get(0).getDelta());
    }

    @Test
    public void historyIsNeverTrimmedByTheAggregator() {
        RewardAccount acct = RewardAccount.fresh("acct-2", 50);
        for (int i = 0; i < 500; i++) {
            acct = aggregator.apply(acct, i % 2 == 0 ? "A" : "G", now);
        }
        assertEquals(500, acct.getHistory().size());
        assertTrue(acct.getValue() >= 0 && acct.getValue() <= 100);
    }
}
