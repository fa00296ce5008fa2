package com.bloomcart.scoring.service.footprint;

/**
 * Best-match emission-factor reference returned by the primary provider's suggest call.
 */
public final class EmissionFactorMatch {
    private final String suggestionId;
    private final String name;
    /** Provider data-quality rating if the suggest call already reported one (1 best .. 3 worst) */
    private final Double dataQuality;

    public EmissionFactorMatch(String suggestionId, String name, Double dataQuality) {
        this.suggestionId = suggestionId;
        this.name = name;
        this.dataQuality = dataQuality;
    }

    public String getSuggestionId() { return suggestionId; }
    public String getName() { return name; }
    public Double getDataQuality() { return dataQuality; }

    @Override
    public String toString() {
        return "EmissionFactorMatch{" + suggestionId + ", " + name + "}";
    }
}
