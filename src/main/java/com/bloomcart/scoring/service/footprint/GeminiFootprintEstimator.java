package com.bloomcart.scoring.service.footprint;

import com.bloomcart.scoring.model.FootprintResult;
import com.bloomcart.scoring.model.NormalizedProduct;
import com.bloomcart.scoring.service.ai.GeminiClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks Gemini for a structured {@code {estimatedCO2e, confidence}} estimate.
 * Anything other than a finite, strictly positive number is treated as unavailable.
 */
@Service
public class GeminiFootprintEstimator implements AiFootprintEstimator {
    private static final Logger log = LoggerFactory.getLogger(GeminiFootprintEstimator.class);

    static final Map<String, Object> RESPONSE_SCHEMA = Map.of(
            "type", "OBJECT",
            "properties", Map.of(
                    "estimatedCO2e", Map.of("type", "NUMBER"),
                    "confidence", Map.of("type", "STRING", "enum", List.of("high", "medium", "low"))),
            "required", List.of("estimatedCO2e", "confidence"));

    private final GeminiClient gemini;

    public GeminiFootprintEstimator(GeminiClient gemini) {
        this.gemini = gemini;
    }

    @Override
    public boolean isEnabled() {
        return gemini.isEnabled();
    }

    @Override
    public Mono<ProviderOutcome<FootprintResult>> estimate(NormalizedProduct product) {
        if (!isEnabled()) return Mono.just(ProviderOutcome.unavailable("gemini not configured"));
        return gemini.generateJson("footprint", buildPrompt(product), RESPONSE_SCHEMA)
                .map(json -> parse(json, gemini.getModel()))
                .onErrorResume(e -> {
                    log.warn("Gemini footprint estimate failed: {}", e.toString());
                    return Mono.just(ProviderOutcome.unavailable(e.getMessage()));
                });
    }

    static ProviderOutcome<FootprintResult> parse(JsonNode json, String model) {
        JsonNode value = json.get("estimatedCO2e");
        if (value == null || !value.isNumber()) {
            return ProviderOutcome.unavailable("estimatedCO2e missing or not numeric");
        }
        double co2e = value.asDouble();
        if (!Double.isFinite(co2e) || co2e <= 0) {
            return ProviderOutcome.unavailable("estimatedCO2e out of range: " + co2e);
        }
        log.debug("Gemini footprint ← co2e={} confidence={}", co2e, json.path("confidence").asText("n/a"));
        return ProviderOutcome.ok(FootprintResult.secondary(co2e, model));
    }

    String buildPrompt(NormalizedProduct p) {
        return String.format(Locale.ROOT, """
                Estimate the cradle-to-customer carbon footprint of this product in kg CO2e,
                covering materials, manufacturing and transport.

                Product: %s
                Category: %s
                Weight: %.3f kg
                Materials: %s
                Description: %s
                """, p.getTitle(), p.getCategory().key(), p.getWeightKg(),
                String.join(", ", p.getMaterials()), p.getDescription());
    }
}
