package com.bloomcart.scoring.service.footprint;

import com.bloomcart.scoring.model.FootprintResult;
import reactor.core.publisher.Mono;

/**
 * Primary emissions-factor provider, called in two phases: resolve a factor
 * reference from free text, then compute a footprint for that reference and a weight.
 *
 * <p>Implementations never signal errors on the returned {@code Mono}; every
 * failure is an {@link ProviderOutcome.Kind#UNAVAILABLE} or
 * {@link ProviderOutcome.Kind#REJECTED} outcome.
 */
public interface EmissionFactorProvider {

    boolean isEnabled();

    Mono<ProviderOutcome<EmissionFactorMatch>> suggest(String text);

    /**
     * @return A {@code primary} footprint; {@code dataQuality} may be null when the provider reported none
     */
    Mono<ProviderOutcome<FootprintResult>> estimate(EmissionFactorMatch match, double weightKg);
}
