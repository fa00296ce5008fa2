package com.bloomcart.scoring.service.reward;

import com.bloomcart.scoring.config.AppProperties;
import com.bloomcart.scoring.model.RewardAccount;
import com.bloomcart.scoring.service.cache.ScoringCoordinator;
import com.bloomcart.scoring.store.KeyValueStore;
import com.bloomcart.scoring.util.KeyedSerializer;
import com.bloomcart.scoring.util.ProductKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Loads, folds and saves reward accounts. Updates to one account are
 * serialized; different accounts proceed independently.
 */
@Service
public class RewardService {
    private static final Logger log = LoggerFactory.getLogger(RewardService.class);

    private final KeyValueStore<RewardAccount> store;
    private final RewardAggregator aggregator;
    private final ScoringCoordinator coordinator;
    private final int initialValue;
    private final int historyLimit;
    private final KeyedSerializer serializer = new KeyedSerializer();

    public RewardService(@Qualifier("rewardStore") KeyValueStore<RewardAccount> store,
                         RewardAggregator aggregator,
                         ScoringCoordinator coordinator,
                         AppProperties appProperties) {
        this.store = store;
        this.aggregator = aggregator;
        this.coordinator = coordinator;
        this.initialValue = appProperties.getReward().getInitialValue();
        this.historyLimit = appProperties.getReward().getHistoryLimit();
    }

    /**
     * Current snapshot; an account that was never folded is returned fresh and not saved.
     */
    public Mono<RewardAccount> get(String accountId) {
        return store.find(accountId)
                .defaultIfEmpty(RewardAccount.fresh(accountId, initialValue));
    }

    public Mono<RewardAccount> applyGrade(String accountId, String grade) {
        return serializer.run(accountId, () -> get(accountId)
                .map(account -> aggregator.apply(account, grade, Instant.now()))
                .map(this::capHistory)
                .flatMap(updated -> store.upsert(accountId, updated).thenReturn(updated))
                .doOnNext(a -> log.info("Reward applied: account={} grade={} value={} total={}",
                        accountId, grade, a.getValue(), a.getTotalCount())));
    }

    /**
     * Folds the grade of an already evaluated product.
     *
     * @return The updated account, empty if the product has no stored evaluation
     */
    public Mono<RewardAccount> applyProduct(String accountId, String productKey) {
        return coordinator.lookup(ProductKeys.canonical(productKey))
                .flatMap(ev -> applyGrade(accountId, ev.getBreakdown().getGrade().name()));
    }

    RewardAccount capHistory(RewardAccount account) {
        int size = account.getHistory().size();
        if (historyLimit <= 0 || size <= historyLimit) return account;
        return new RewardAccount(account.getAccountId(), account.getValue(), account.getTotalCount(),
                account.getFavorableCount(), account.getHistory().subList(size - historyLimit, size),
                account.getUpdatedAt());
    }
}
