package com.bloomcart.scoring.service.footprint;

import com.bloomcart.scoring.model.FootprintResult;

/**
 * Rejects a primary-provider footprint whose data-quality rating is worse than
 * the threshold (1 best .. 3 worst). A result without a rating passes.
 */
public class DataQualityGate {
    private final double threshold;

    public DataQualityGate(double threshold) {
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    public ProviderOutcome<FootprintResult> check(FootprintResult result) {
        Double q = result.getDataQuality();
        if (q != null && q > threshold) {
            return ProviderOutcome.rejected("data quality " + q + " worse than " + threshold);
        }
        return ProviderOutcome.ok(result);
    }
}
