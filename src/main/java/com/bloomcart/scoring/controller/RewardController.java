package com.bloomcart.scoring.controller;

import com.bloomcart.scoring.dto.RewardDtos;
import com.bloomcart.scoring.model.RewardAccount;
import com.bloomcart.scoring.service.reward.RewardService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/rewards")
public class RewardController {
    private final RewardService rewardService;

    public RewardController(RewardService rewardService) { this.rewardService = rewardService; }

    @GetMapping(value = "/{accountId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<RewardAccount>> get(@PathVariable("accountId") String accountId) {
        return rewardService.get(accountId).map(ResponseEntity::ok);
    }

    /**
     * Folds one grade into the account. Accepts a letter grade directly, or the key
     * of a product whose evaluation is already stored (404 when it is not).
     */
    @PostMapping(value = "/{accountId}/apply", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<RewardAccount>> apply(@PathVariable("accountId") String accountId,
                                                     @RequestBody RewardDtos.ApplyRequest body) {
        if (body == null) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        if (body.getGrade() != null && !body.getGrade().isBlank()) {
            return rewardService.applyGrade(accountId, body.getGrade()).map(ResponseEntity::ok);
        }
        if (body.getProductKey() != null && !body.getProductKey().isBlank()) {
            return rewardService.applyProduct(accountId, body.getProductKey())
                    .map(ResponseEntity::ok)
                    .defaultIfEmpty(ResponseEntity.notFound().build());
        }
        return Mono.just(ResponseEntity.badRequest().build());
    }
}
