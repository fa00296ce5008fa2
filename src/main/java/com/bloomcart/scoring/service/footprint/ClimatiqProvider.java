package com.bloomcart.scoring.service.footprint;

import com.bloomcart.scoring.config.ProviderProperties;
import com.bloomcart.scoring.model.FootprintResult;
import com.bloomcart.scoring.model.FootprintSource;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Climatiq Autopilot client: {@code suggest} resolves a free-text description to an
 * emission-factor suggestion, {@code estimate} computes kg CO2e for that suggestion
 * and a weight in kilograms.
 */
@Service
public class ClimatiqProvider implements EmissionFactorProvider {
    private static final Logger log = LoggerFactory.getLogger(ClimatiqProvider.class);

    static final String SUGGEST_PATH = "/autopilot/v1-preview4/suggest";
    static final String ESTIMATE_PATH = "/autopilot/v1-preview4/estimate";
    private static final Pattern NUMERIC = Pattern.compile("\\d+(?:\\.\\d+)?");

    private final WebClient webClient;
    private final ProviderProperties.Provider settings;

    public ClimatiqProvider(@Qualifier("climatiqClient") WebClient webClient, ProviderProperties providerProperties) {
        this.webClient = webClient;
        this.settings = providerProperties.getClimatiq();
        if (!settings.isEnabled()) {
            log.info("Climatiq disabled: no API key configured");
        }
    }

    @Override
    public boolean isEnabled() {
        return settings.isEnabled();
    }

    @Override
    public Mono<ProviderOutcome<EmissionFactorMatch>> suggest(String text) {
        if (!isEnabled()) return Mono.just(ProviderOutcome.unavailable("climatiq not configured"));
        if (text == null || text.isBlank()) return Mono.just(ProviderOutcome.rejected("empty description"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("suggest", Map.of("text", text));
        body.put("max_suggestions", 1);
        log.debug("Climatiq suggest → text={}", text);
        return post(SUGGEST_PATH, body)
                .map(ClimatiqProvider::parseSuggestion)
                .onErrorResume(e -> {
                    log.warn("Climatiq suggest failed: {}", e.toString());
                    return Mono.just(ProviderOutcome.unavailable("suggest: " + e.getMessage()));
                });
    }

    @Override
    public Mono<ProviderOutcome<FootprintResult>> estimate(EmissionFactorMatch match, double weightKg) {
        if (!isEnabled()) return Mono.just(ProviderOutcome.unavailable("climatiq not configured"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("suggestion_id", match.getSuggestionId());
        body.put("parameters", Map.of("weight", weightKg, "weight_unit", "kg"));
        log.debug("Climatiq estimate → suggestion={} weightKg={}", match.getSuggestionId(), weightKg);
        return post(ESTIMATE_PATH, body)
                .map(json -> parseEstimate(json, match))
                .onErrorResume(e -> {
                    log.warn("Climatiq estimate failed: {}", e.toString());
                    return Mono.just(ProviderOutcome.unavailable("estimate: " + e.getMessage()));
                });
    }

    private Mono<JsonNode> post(String path, Map<String, Object> body) {
        return webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofMillis(settings.getTimeoutMs()));
    }

    static ProviderOutcome<EmissionFactorMatch> parseSuggestion(JsonNode json) {
        // Both a bare array and {"results": [...]} have been observed
        JsonNode list = json.isArray() ? json : json.path("results");
        if (!list.isArray() || list.isEmpty()) {
            return ProviderOutcome.rejected("no emission factor matched");
        }
        JsonNode best = list.get(0);
        String id = best.path("suggestion_id").asText(null);
        if (id == null || id.isBlank()) {
            return ProviderOutcome.unavailable("suggestion without suggestion_id");
        }
        JsonNode details = best.path("suggestion_details");
        String name = details.path("name").asText(best.path("name").asText(null));
        Double quality = parseDataQuality(best.has("data_quality_rating") ? best.get("data_quality_rating") : details.get("data_quality_rating"));
        log.debug("Climatiq suggest ← suggestion={} name={}", id, name);
        return ProviderOutcome.ok(new EmissionFactorMatch(id, name, quality));
    }

    static ProviderOutcome<FootprintResult> parseEstimate(JsonNode json, EmissionFactorMatch match) {
        JsonNode co2eNode = json.get("co2e");
        if (co2eNode == null || !(co2eNode.isNumber() || co2eNode.isTextual())) {
            return ProviderOutcome.unavailable("estimate without co2e");
        }
        double co2e;
        try {
            co2e = co2eNode.isNumber() ? co2eNode.asDouble() : Double.parseDouble(co2eNode.asText().trim());
        } catch (NumberFormatException e) {
            return ProviderOutcome.unavailable("non-numeric co2e: " + co2eNode.asText());
        }
        if (!Double.isFinite(co2e) || co2e < 0) {
            return ProviderOutcome.unavailable("invalid co2e: " + co2e);
        }
        Double quality = parseDataQuality(json.get("data_quality_rating"));
        if (quality == null) quality = match.getDataQuality();
        log.debug("Climatiq estimate ← co2e={} dataQuality={}", co2e, quality);
        return ProviderOutcome.ok(new FootprintResult(co2e, quality, FootprintSource.PRIMARY, match.getSuggestionId()));
    }

    /**
     * Reads Climatiq's data-quality rating, which is numeric (1 best .. 3 worst) or categorical.
     *
     * @return The rating on the numeric scale, or null if missing or unrecognized
     */
    static Double parseDataQuality(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isNumber()) {
            double v = node.asDouble();
            return Double.isFinite(v) ? v : null;
        }
        if (!node.isTextual()) return null;
        String s = node.asText().trim().toLowerCase(Locale.ROOT);
        if (NUMERIC.matcher(s).matches()) return Double.parseDouble(s);
        return switch (s) {
            case "good", "high" -> 1.0;
            case "medium", "fair", "moderate" -> 2.0;
            case "bad", "poor", "low" -> 3.0;
            default -> null;
        };
    }
}
