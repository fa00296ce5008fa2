package com.bloomcart.scoring.service.footprint;

import com.bloomcart.scoring.config.ProviderProperties;
import com.bloomcart.scoring.model.FootprintResult;
import com.bloomcart.scoring.model.NormalizedProduct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Three-tier footprint estimation: primary emissions-factor provider behind a
 * data-quality gate, then the AI estimator, then the local heuristic.
 *
 * <p>{@link #estimate(NormalizedProduct)} always emits exactly one
 * {@link FootprintResult}; provider failures only move the chain to the next tier.
 */
@Service
public class FootprintEstimator {
    private static final Logger log = LoggerFactory.getLogger(FootprintEstimator.class);

    private final EmissionFactorProvider primary;
    private final AiFootprintEstimator secondary;
    private final HeuristicFootprintEstimator heuristic;
    private final DataQualityGate gate;

    @Autowired
    public FootprintEstimator(EmissionFactorProvider primary, AiFootprintEstimator secondary, ProviderProperties providerProperties) {
        this(primary, secondary, new HeuristicFootprintEstimator(),
                new DataQualityGate(providerProperties.getClimatiq().getQualityThreshold()));
    }

    public FootprintEstimator(EmissionFactorProvider primary, AiFootprintEstimator secondary,
                              HeuristicFootprintEstimator heuristic, DataQualityGate gate) {
        this.primary = primary;
        this.secondary = secondary;
        this.heuristic = heuristic;
        this.gate = gate;
    }

    public Mono<FootprintResult> estimate(NormalizedProduct product) {
        return callPrimary(product)
                .flatMap(outcome -> switch (outcome.getKind()) {
                    case OK -> Mono.just(outcome.getValue());
                    case REJECTED, UNAVAILABLE -> {
                        log.warn("Primary footprint {} for '{}': {}; trying AI estimator",
                                outcome.getKind(), product.getTitle(), outcome.getReason());
                        yield callSecondary(product);
                    }
                })
                .doOnNext(r -> log.info("Footprint for '{}': co2eKg={} source={}",
                        product.getTitle(), r.getCo2eKg(), r.getSource().key()));
    }

    Mono<ProviderOutcome<FootprintResult>> callPrimary(NormalizedProduct product) {
        if (primary == null || !primary.isEnabled()) {
            return Mono.just(ProviderOutcome.unavailable("primary provider disabled"));
        }
        String text = product.getDescription().isBlank() ? product.getTitle() : product.getDescription();
        return primary.suggest(text)
                .flatMap(match -> match.isOk()
                        ? primary.estimate(match.getValue(), product.getWeightKg())
                        : Mono.just(match.<FootprintResult>asFailure()))
                .map(outcome -> outcome.isOk() ? gate.check(outcome.getValue()) : outcome)
                .defaultIfEmpty(ProviderOutcome.unavailable("primary provider returned nothing"))
                .onErrorResume(e -> Mono.just(ProviderOutcome.unavailable(e.toString())));
    }

    private Mono<FootprintResult> callSecondary(NormalizedProduct product) {
        Mono<ProviderOutcome<FootprintResult>> call = secondary == null || !secondary.isEnabled()
                ? Mono.just(ProviderOutcome.unavailable("AI estimator disabled"))
                : secondary.estimate(product)
                        .defaultIfEmpty(ProviderOutcome.unavailable("AI estimator returned nothing"))
                        .onErrorResume(e -> Mono.just(ProviderOutcome.unavailable(e.toString())));
        return call.map(outcome -> switch (outcome.getKind()) {
            case OK -> outcome.getValue();
            case REJECTED, UNAVAILABLE -> {
                log.warn("AI footprint {} for '{}': {}; using heuristic",
                        outcome.getKind(), product.getTitle(), outcome.getReason());
                yield heuristic.estimate(product);
            }
        });
    }
}
