package com.bloomcart.scoring.service.footprint;

import com.bloomcart.scoring.model.FootprintResult;
import com.bloomcart.scoring.model.NormalizedProduct;
import reactor.core.publisher.Mono;

/**
 * Secondary, AI-based footprint estimator. Like {@link EmissionFactorProvider},
 * failures are reported as outcomes, never as errors.
 */
public interface AiFootprintEstimator {

    boolean isEnabled();

    Mono<ProviderOutcome<FootprintResult>> estimate(NormalizedProduct product);
}
