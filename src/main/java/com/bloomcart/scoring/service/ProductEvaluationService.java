package com.bloomcart.scoring.service;

import com.bloomcart.scoring.config.AppProperties;
import com.bloomcart.scoring.model.FootprintResult;
import com.bloomcart.scoring.model.NormalizedProduct;
import com.bloomcart.scoring.model.PercentileRanking;
import com.bloomcart.scoring.model.ProductEvaluation;
import com.bloomcart.scoring.model.RawProduct;
import com.bloomcart.scoring.model.ScoreBreakdown;
import com.bloomcart.scoring.service.cache.ScoringCoordinator;
import com.bloomcart.scoring.service.footprint.FootprintEstimator;
import com.bloomcart.scoring.service.normalize.NormalizationService;
import com.bloomcart.scoring.service.scoring.EnvironmentalEquivalents;
import com.bloomcart.scoring.service.scoring.PercentileRanker;
import com.bloomcart.scoring.service.scoring.SustainabilityScorer;
import com.bloomcart.scoring.util.ProductKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates scraped products: normalize, estimate footprint, score, rank, and
 * store the result under the product key through the {@link ScoringCoordinator}.
 */
@Service
public class ProductEvaluationService {
    private static final Logger log = LoggerFactory.getLogger(ProductEvaluationService.class);

    private final NormalizationService normalizationService;
    private final FootprintEstimator footprintEstimator;
    private final SustainabilityScorer scorer;
    private final PercentileRanker ranker;
    private final ScoringCoordinator coordinator;
    private final int batchConcurrency;

    public ProductEvaluationService(NormalizationService normalizationService,
                                    FootprintEstimator footprintEstimator,
                                    SustainabilityScorer scorer,
                                    PercentileRanker ranker,
                                    ScoringCoordinator coordinator,
                                    AppProperties appProperties) {
        this.normalizationService = normalizationService;
        this.footprintEstimator = footprintEstimator;
        this.scorer = scorer;
        this.ranker = ranker;
        this.coordinator = coordinator;
        this.batchConcurrency = appProperties.getBatchConcurrency();
    }

    public Mono<ScoringCoordinator.Result> evaluate(RawProduct raw) {
        String key = ProductKeys.of(raw);
        return coordinator.getOrCompute(key, k -> compute(k, raw));
    }

    /**
     * Evaluates a batch; results follow input order. Records sharing a key are
     * computed once, from the first record with that key.
     */
    public Flux<ScoringCoordinator.Result> evaluateBatch(List<RawProduct> raws) {
        List<String> keys = new ArrayList<>(raws.size());
        Map<String, RawProduct> byKey = new LinkedHashMap<>();
        for (RawProduct raw : raws) {
            String key = ProductKeys.of(raw);
            keys.add(key);
            byKey.putIfAbsent(key, raw);
        }
        return coordinator.getOrComputeBatch(keys, k -> compute(k, byKey.get(k)), batchConcurrency);
    }

    public Mono<ProductEvaluation> lookup(String productKey) {
        return coordinator.lookup(ProductKeys.canonical(productKey));
    }

    public Mono<Boolean> evict(String productKey) {
        return coordinator.evict(ProductKeys.canonical(productKey));
    }

    Mono<ProductEvaluation> compute(String key, RawProduct raw) {
        long t0 = System.currentTimeMillis();
        return normalizationService.normalize(raw)
                .flatMap(product -> footprintEstimator.estimate(product)
                        .map(footprint -> assemble(key, product, footprint)))
                .doOnNext(ev -> log.info("Evaluated {} '{}': overall={} grade={} source={} ms={}",
                        key, ev.getProduct().getTitle(),
                        String.format("%.1f", ev.getBreakdown().getOverallScore()),
                        ev.getBreakdown().getGrade(), ev.getFootprint().getSource().key(),
                        System.currentTimeMillis() - t0));
    }

    ProductEvaluation assemble(String key, NormalizedProduct product, FootprintResult footprint) {
        ScoreBreakdown breakdown = scorer.score(product, footprint);
        PercentileRanking percentiles = ranker.rank(breakdown, product.getCategory());
        return new ProductEvaluation(key, product, footprint, breakdown, percentiles,
                EnvironmentalEquivalents.of(breakdown), Instant.now());
    }
}
