package com.bloomcart.scoring.service.normalize;

import com.bloomcart.scoring.model.RawProduct;
import com.bloomcart.scoring.service.ai.GeminiClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Asks Gemini to clean up a scraped record: title, weight with unit, materials,
 * category and a short description suited to footprint estimation.
 */
@Service
public class GeminiProductExtractor implements AiProductExtractor {
    private static final Logger log = LoggerFactory.getLogger(GeminiProductExtractor.class);

    static final Map<String, Object> RESPONSE_SCHEMA = Map.of(
            "type", "OBJECT",
            "properties", Map.of(
                    "cleanedTitle", Map.of("type", "STRING"),
                    "weight", Map.of(
                            "type", "OBJECT",
                            "properties", Map.of(
                                    "value", Map.of("type", "NUMBER"),
                                    "unit", Map.of("type", "STRING", "enum", List.of("kg", "g", "lb", "oz")))),
                    "materials", Map.of("type", "ARRAY", "items", Map.of("type", "STRING")),
                    "category", Map.of("type", "STRING"),
                    "productDescription", Map.of("type", "STRING")));

    private final GeminiClient gemini;
    private final ObjectMapper objectMapper;

    public GeminiProductExtractor(GeminiClient gemini, ObjectMapper objectMapper) {
        this.gemini = gemini;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isEnabled() {
        return gemini.isEnabled();
    }

    @Override
    public Mono<ExtractionHints> extract(RawProduct raw) {
        return gemini.generateJson("extract", buildPrompt(raw), RESPONSE_SCHEMA)
                .map(json -> objectMapper.convertValue(json, ExtractionHints.class));
    }

    String buildPrompt(RawProduct raw) {
        String details;
        try {
            details = objectMapper.writeValueAsString(raw.getDetails() != null ? raw.getDetails() : Map.of());
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize details for prompt: {}", e.getMessage());
            details = "{}";
        }
        return """
                Extract structured attributes from this scraped product listing.

                Title: %s
                Brand: %s
                Category: %s
                Details: %s
                Description: %s

                Return:
                - cleanedTitle: short product title without marketing noise
                - weight: shipping weight as {value, unit} with unit one of kg, g, lb, oz; omit if not stated
                - materials: main materials (plastic, metal, cotton, wood, glass, paper, ...)
                - category: department such as Electronics, Clothing, Home, Kitchen, Books
                - productDescription: one or two sentences describing what the product is made of and used for
                """.formatted(
                orNa(raw.getTitle()), orNa(raw.getBrand()), orNa(raw.getCategory()), details, orNa(raw.getDescription()));
    }

    private static String orNa(String s) {
        return s == null || s.isBlank() ? "N/A" : s;
    }
}
