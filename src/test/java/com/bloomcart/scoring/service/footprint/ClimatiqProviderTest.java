package com.bloomcart.scoring.service.footprint;

import com.bloomcart.scoring.model.FootprintResult;
import com.bloomcart.scoring.model.FootprintSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ClimatiqProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Test
    public void dataQualityAcceptsNumbersAndLabels() {
        assertEquals(1.5, ClimatiqProvider.parseDataQuality(NODES.numberNode(1.5)));
        assertEquals(2.0, ClimatiqProvider.parseDataQuality(NODES.textNode("2")));
        assertEquals(1.0, ClimatiqProvider.parseDataQuality(NODES.textNode("Good")));
        assertEquals(2.0, ClimatiqProvider.parseDataQuality(NODES.textNode("medium")));
        assertEquals(3.0, ClimatiqProvider.parseDataQuality(NODES.textNode("poor")));
        assertNull(ClimatiqProvider.parseDataQuality(NODES.textNode("unknown")));
        assertNull(ClimatiqProvider.parseDataQuality(null));
    }

    @Test
    public void suggestionParsesWrappedAndBareArrays() throws Exception {
        ProviderOutcome<EmissionFactorMatch> wrapped = ClimatiqProvider.parseSuggestion(mapper.readTree("""
                {"results":[{"suggestion_id":"abc","suggestion_details":{"name":"Headphones","data_quality_rating":"good"}}]}
                """));
        ProviderOutcome<EmissionFactorMatch> bare = ClimatiqProvider.parseSuggestion(mapper.readTree("""
                [{"suggestion_id":"xyz","suggestion_details":{"name":"Shoes"}}]
                """));

        assertTrue(wrapped.isOk());
        assertEquals("abc", wrapped.getValue().getSuggestionId());
        assertEquals("Headphones", wrapped.getValue().getName());
        assertEquals(1.0, wrapped.getValue().getDataQuality());
        assertTrue(bare.isOk());
        assertNull(bare.getValue().getDataQuality());
    }

    @Test
    public void emptySuggestionIsRejectedAndMalformedIsUnavailable() throws Exception {
        assertEquals(ProviderOutcome.Kind.REJECTED,
                ClimatiqProvider.parseSuggestion(mapper.readTree("{\"results\":[]}")).getKind());
        assertEquals(ProviderOutcome.Kind.UNAVAILABLE,
                ClimatiqProvider.parseSuggestion(mapper.readTree("[{\"name\":\"no id\"}]")).getKind());
    }

    @Test
    public void estimateCarriesQualityFromResponseOrMatch() throws Exception {
        EmissionFactorMatch match = new EmissionFactorMatch("abc", "Headphones", 2.0);

        ProviderOutcome<FootprintResult> fromResponse = ClimatiqProvider.parseEstimate(
                mapper.readTree("{\"co2e\": 12.5, \"data_quality_rating\": 1}"), match);
        ProviderOutcome<FootprintResult> fromMatch = ClimatiqProvider.parseEstimate(
                mapper.readTree("{\"co2e\": \"7.25\"}"), match);

        assertEquals(12.5, fromResponse.getValue().getCo2eKg(), 1e-9);
        assertEquals(1.0, fromResponse.getValue().getDataQuality());
        assertEquals(FootprintSource.PRIMARY, fromResponse.getValue().getSource());
        assertEquals("abc", fromResponse.getValue().getProviderRef());
        assertEquals(7.25, fromMatch.getValue().getCo2eKg(), 1e-9);
        assertEquals(2.0, fromMatch.getValue().getDataQuality());
    }

    @Test
    public void invalidEstimateIsUnavailable() throws Exception {
        EmissionFactorMatch match = new EmissionFactorMatch("abc", null, 1.0);
        assertEquals(ProviderOutcome.Kind.UNAVAILABLE,
                ClimatiqProvider.parseEstimate(mapper.readTree("{}"), match).getKind());
        assertEquals(ProviderOutcome.Kind.UNAVAILABLE,
                ClimatiqProvider.parseEstimate(mapper.readTree("{\"co2e\": -1}"), match).getKind());
        assertEquals(ProviderOutcome.Kind.UNAVAILABLE,
                ClimatiqProvider.parseEstimate(mapper.readTree("{\"co2e\": \"lots\"}"), match).getKind());
    }
}
