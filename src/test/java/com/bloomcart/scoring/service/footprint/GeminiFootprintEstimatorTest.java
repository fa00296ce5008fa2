package com.bloomcart.scoring.service.footprint;

import com.bloomcart.scoring.model.FootprintResult;
import com.bloomcart.scoring.model.FootprintSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GeminiFootprintEstimatorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void parsesPositiveEstimate() throws Exception {
        ProviderOutcome<FootprintResult> out = GeminiFootprintEstimator.parse(
                mapper.readTree("{\"estimatedCO2e\": 8.4, \"confidence\": \"medium\"}"), "gemini-1.5-flash");

        assertTrue(out.isOk());
        assertEquals(8.4, out.getValue().getCo2eKg(), 1e-9);
        assertEquals(FootprintSource.SECONDARY, out.getValue().getSource());
        assertEquals("gemini-1.5-flash", out.getValue().getProviderRef());
    }

    @Test
    public void rejectsMissingZeroAndTextualValues() throws Exception {
        assertFalse(GeminiFootprintEstimator.parse(mapper.readTree("{\"confidence\":\"low\"}"), "m").isOk());
        assertFalse(GeminiFootprintEstimator.parse(mapper.readTree("{\"estimatedCO2e\": 0}"), "m").isOk());
        assertFalse(GeminiFootprintEstimator.parse(mapper.readTree("{\"estimatedCO2e\": \"12\"}"), "m").isOk());
    }
}
