package com.bloomcart.scoring.service.ai;

import com.bloomcart.scoring.config.ProviderProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin client for Gemini structured-output generation. Every call asks for
 * {@code application/json} constrained by a response schema; the returned text
 * part is parsed as JSON and nothing else is attempted.
 *
 * <p>Errors (timeout, non-2xx, missing candidate, unparseable JSON) are signalled
 * as {@code Mono.error}; callers translate them into their own fallback.
 */
@Service
public class GeminiClient {
    private static final Logger log = LoggerFactory.getLogger(GeminiClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ProviderProperties.Provider settings;

    public GeminiClient(@Qualifier("geminiClient") WebClient webClient,
                        ObjectMapper objectMapper,
                        ProviderProperties providerProperties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.settings = providerProperties.getGemini();
        if (!settings.isEnabled()) {
            log.info("Gemini disabled: no API key configured");
        } else {
            log.info("Gemini enabled with model: {}", settings.getModel());
        }
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    public String getModel() {
        return settings.getModel();
    }

    /**
     * Generates a JSON object for the prompt, constrained by the given schema.
     *
     * @param purpose Short label used in logs (e.g. "extract", "footprint")
     * @param prompt The user prompt
     * @param responseSchema Gemini response schema (OpenAPI subset)
     * @return The parsed JSON object
     */
    public Mono<JsonNode> generateJson(String purpose, String prompt, Map<String, Object> responseSchema) {
        if (!isEnabled()) {
            return Mono.error(new IllegalStateException("Gemini is not configured"));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", prompt)))));
        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("temperature", 0.1);
        generationConfig.put("responseMimeType", "application/json");
        generationConfig.put("responseSchema", responseSchema);
        body.put("generationConfig", generationConfig);

        long t0 = System.currentTimeMillis();
        log.debug("Gemini request → purpose={} model={}", purpose, settings.getModel());
        return webClient.post()
                .uri("/v1beta/models/{model}:generateContent", settings.getModel())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofMillis(settings.getTimeoutMs()))
                .map(this::extractJson)
                .doOnNext(n -> log.debug("Gemini response ← purpose={} ms={}", purpose, System.currentTimeMillis() - t0));
    }

    JsonNode extractJson(JsonNode response) {
        JsonNode text = response.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (!text.isTextual() || text.asText().isBlank()) {
            throw new IllegalStateException("Gemini response has no text candidate");
        }
        try {
            JsonNode parsed = objectMapper.readTree(text.asText());
            if (parsed == null || !parsed.isObject()) {
                throw new IllegalStateException("Gemini response is not a JSON object");
            }
            return parsed;
        } catch (java.io.IOException e) {
            throw new IllegalStateException("Gemini response is not valid JSON: " + e.getMessage(), e);
        }
    }
}
