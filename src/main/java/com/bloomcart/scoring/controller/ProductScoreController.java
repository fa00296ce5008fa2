package com.bloomcart.scoring.controller;

import com.bloomcart.scoring.config.AppProperties;
import com.bloomcart.scoring.dto.EvaluationDtos;
import com.bloomcart.scoring.model.ProductEvaluation;
import com.bloomcart.scoring.model.RawProduct;
import com.bloomcart.scoring.service.ProductEvaluationService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/products")
public class ProductScoreController {
    private final ProductEvaluationService evaluationService;
    private final AppProperties appProperties;

    public ProductScoreController(ProductEvaluationService evaluationService, AppProperties appProperties) {
        this.evaluationService = evaluationService;
        this.appProperties = appProperties;
    }

    @PostMapping(value = "/evaluate", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<EvaluationDtos.EvaluateResponse>> evaluate(@RequestBody RawProduct raw) {
        if (!isIdentifiable(raw)) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return evaluationService.evaluate(raw)
                .map(EvaluationDtos.EvaluateResponse::from)
                .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/evaluate/batch", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<EvaluationDtos.BatchResponse>> evaluateBatch(@Valid @RequestBody EvaluationDtos.BatchRequest body) {
        if (body.getProducts().stream().anyMatch(r -> !isIdentifiable(r))) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return evaluationService.evaluateBatch(body.getProducts())
                .map(EvaluationDtos.EvaluateResponse::from)
                .collectList()
                .map(results -> {
                    EvaluationDtos.BatchResponse resp = new EvaluationDtos.BatchResponse();
                    resp.setCount(results.size());
                    resp.setCached_count((int) results.stream().filter(EvaluationDtos.EvaluateResponse::isCached).count());
                    resp.setResults(results);
                    return ResponseEntity.ok(resp);
                });
    }

    @GetMapping(value = "/{key}/score", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ProductEvaluation>> getScore(@PathVariable("key") String key) {
        return evaluationService.lookup(key)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @DeleteMapping(value = "/{key}/score", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> evict(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable("key") String key) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return evaluationService.evict(key)
                .map(removed -> ResponseEntity.ok(Map.<String, Object>of("key", key, "removed", removed)));
    }

    // A record needs an ASIN or a title to produce a stable key
    static boolean isIdentifiable(RawProduct raw) {
        if (raw == null) return false;
        boolean hasKey = raw.getProductKey() != null && !raw.getProductKey().isBlank();
        boolean hasTitle = raw.getTitle() != null && !raw.getTitle().isBlank();
        return hasKey || hasTitle;
    }
}
