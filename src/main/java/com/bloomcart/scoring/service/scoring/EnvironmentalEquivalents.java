package com.bloomcart.scoring.service.scoring;

import com.bloomcart.scoring.model.ScoreBreakdown;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everyday equivalents of a product's footprint, for display.
 */
public final class EnvironmentalEquivalents {
    static final double KM_DRIVEN_PER_KG_CO2E = 4.0;
    static final double LITERS_PER_SHOWER = 60.0;
    static final double PHONE_CHARGES_PER_KWH = 33.0;

    private EnvironmentalEquivalents() {}

    /**
     * @return drivingKm, showers and phoneCharges, each rounded to one decimal
     */
    public static Map<String, Double> of(ScoreBreakdown breakdown) {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put("drivingKm", round1(breakdown.getCarbon().getValue() * KM_DRIVEN_PER_KG_CO2E));
        out.put("showers", round1(breakdown.getWater().getValue() / LITERS_PER_SHOWER));
        out.put("phoneCharges", round1(breakdown.getEnergy().getValue() * PHONE_CHARGES_PER_KWH));
        return out;
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
