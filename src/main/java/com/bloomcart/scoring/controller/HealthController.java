package com.bloomcart.scoring.controller;

import com.bloomcart.scoring.model.ProductEvaluation;
import com.bloomcart.scoring.model.RewardAccount;
import com.bloomcart.scoring.store.DegradingStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
public class HealthController {
    private final DegradingStore<ProductEvaluation> evaluationStore;
    private final DegradingStore<RewardAccount> rewardStore;

    public HealthController(@Qualifier("evaluationStore") DegradingStore<ProductEvaluation> evaluationStore,
                            @Qualifier("rewardStore") DegradingStore<RewardAccount> rewardStore) {
        this.evaluationStore = evaluationStore;
        this.rewardStore = rewardStore;
    }

    // Degraded storage still serves requests from the local cache, so it stays 200
    @GetMapping("/healthz")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        boolean degraded = evaluationStore.isDegraded() || rewardStore.isDegraded();
        return Mono.just(ResponseEntity.ok(Map.<String, Object>of(
                "ok", Boolean.TRUE,
                "store", degraded ? "degraded" : "persistent")));
    }
}
