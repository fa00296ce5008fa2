package com.bloomcart.scoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Carbon-equivalent footprint estimate for one product.
 *
 * <p>{@code dataQuality} is only populated for {@link FootprintSource#PRIMARY}
 * results (provider scale 1 best .. 3 worst). {@code providerRef} is the
 * emission-factor reference the primary provider matched, or the model name of
 * the secondary estimator.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FootprintResult {
    private final double co2eKg;
    private final Double dataQuality;
    private final FootprintSource source;
    private final String providerRef;

    @JsonCreator
    public FootprintResult(@JsonProperty("co2eKg") double co2eKg,
                           @JsonProperty("dataQuality") Double dataQuality,
                           @JsonProperty("source") FootprintSource source,
                           @JsonProperty("providerRef") String providerRef) {
        if (!Double.isFinite(co2eKg) || co2eKg < 0) {
            throw new IllegalArgumentException("co2eKg must be finite and >= 0, got " + co2eKg);
        }
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
        this.co2eKg = co2eKg;
        this.dataQuality = source == FootprintSource.PRIMARY ? dataQuality : null;
        this.source = source;
        this.providerRef = providerRef;
    }

    public static FootprintResult primary(double co2eKg, double dataQuality, String suggestionId) {
        return new FootprintResult(co2eKg, dataQuality, FootprintSource.PRIMARY, suggestionId);
    }

    public static FootprintResult secondary(double co2eKg, String model) {
        return new FootprintResult(co2eKg, null, FootprintSource.SECONDARY, model);
    }

    public static FootprintResult heuristic(double co2eKg) {
        return new FootprintResult(co2eKg, null, FootprintSource.HEURISTIC, null);
    }

    public double getCo2eKg() { return co2eKg; }
    public Double getDataQuality() { return dataQuality; }
    public FootprintSource getSource() { return source; }
    public String getProviderRef() { return providerRef; }

    @Override
    public String toString() {
        return "FootprintResult{co2eKg=" + co2eKg + ", source=" + source.key()
                + (dataQuality != null ? ", dataQuality=" + dataQuality : "") + "}";
    }
}
