package com.bloomcart.scoring.config;

import com.bloomcart.scoring.model.ProductEvaluation;
import com.bloomcart.scoring.model.RewardAccount;
import com.bloomcart.scoring.store.DegradingStore;
import com.bloomcart.scoring.store.LocalStore;
import com.bloomcart.scoring.store.R2dbcJsonStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.core.DatabaseClient;

import java.time.Duration;

@Configuration
public class StoreConfig {

    @Bean(name = "evaluationStore")
    public DegradingStore<ProductEvaluation> evaluationStore(DatabaseClient db, ObjectMapper objectMapper, AppProperties appProperties) {
        R2dbcJsonStore<ProductEvaluation> persistent = new R2dbcJsonStore<>(db, objectMapper, "product_scores",
                ProductEvaluation.class, Duration.ofMillis(appProperties.getStoreTimeoutMs()));
        persistent.ensureSchema().subscribe();
        return new DegradingStore<>("product_scores", persistent, new LocalStore<>(appProperties.getLocalCacheMaxEntries()));
    }

    @Bean(name = "rewardStore")
    public DegradingStore<RewardAccount> rewardStore(DatabaseClient db, ObjectMapper objectMapper, AppProperties appProperties) {
        R2dbcJsonStore<RewardAccount> persistent = new R2dbcJsonStore<>(db, objectMapper, "reward_accounts",
                RewardAccount.class, Duration.ofMillis(appProperties.getStoreTimeoutMs()));
        persistent.ensureSchema().subscribe();
        return new DegradingStore<>("reward_accounts", persistent, new LocalStore<>(appProperties.getLocalCacheMaxEntries()));
    }
}
