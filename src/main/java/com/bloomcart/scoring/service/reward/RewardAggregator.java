package com.bloomcart.scoring.service.reward;

import com.bloomcart.scoring.model.RewardAccount;
import com.bloomcart.scoring.model.RewardHistoryEntry;
import com.bloomcart.scoring.service.scoring.GradeScale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Folds one graded product into a reward account.
 *
 * <p>{@code value' = clamp(value + delta(grade), 0, 100)}, the total count always
 * grows by one, the favorable count grows for the top bands, and exactly one
 * history entry is appended. An unknown grade folds with delta 0 and is logged;
 * it is never an error. History is never trimmed here.
 */
@Component
public class RewardAggregator {
    private static final Logger log = LoggerFactory.getLogger(RewardAggregator.class);

    private final GradeScale gradeScale;

    public RewardAggregator(GradeScale gradeScale) {
        this.gradeScale = gradeScale;
    }

    public RewardAccount apply(RewardAccount account, String grade, Instant now) {
        String label = grade == null ? "" : grade.trim().toUpperCase(Locale.ROOT);
        OptionalInt known = gradeScale.delta(label);
        int delta = known.orElse(0);
        if (known.isEmpty()) {
            log.warn("Unknown grade '{}' applied to account {}; using delta 0", grade, account.getAccountId());
        }
        boolean favorable = known.isPresent() && gradeScale.isFavorable(label);

        List<RewardHistoryEntry> history = new ArrayList<>(account.getHistory().size() + 1);
        history.addAll(account.getHistory());
        history.add(new RewardHistoryEntry(label, delta, now));

        int value = clamp(account.getValue() + delta);
        return new RewardAccount(account.getAccountId(), value,
                account.getTotalCount() + 1,
                account.getFavorableCount() + (favorable ? 1 : 0),
                history, now);
    }

    static int clamp(int v) {
        return Math.max(RewardAccount.MIN_VALUE, Math.min(RewardAccount.MAX_VALUE, v));
    }
}
