package com.dynop.wayfinding.scoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw sub-metrics fed into the score.
 *
 * <p>Signage and accessibility scores may be given as fractions in [0, 1] or as percentages;
 * any value above 1 is read as a percentage.
 */
public final class WesInputs {

    private final double meanTime;
    private final double detourIndex;
    private final double meanErrors;
    private final double meanHesitations;
    private final double visualIntegration;
    private final double signageScore;
    private final double accessibilityScore;

    @JsonCreator
    public WesInputs(
            @JsonProperty(value = "mean_time", required = true) double meanTime,
            @JsonProperty(value = "detour_index", required = true) double detourIndex,
            @JsonProperty(value = "mean_errors", required = true) double meanErrors,
            @JsonProperty(value = "mean_hesitations", required = true) double meanHesitations,
            @JsonProperty(value = "visual_integration", required = true) double visualIntegration,
            @JsonProperty(value = "signage_score", required = true) double signageScore,
            @JsonProperty(value = "accessibility_score", required = true) double accessibilityScore) {
        this.meanTime = requireFinite(meanTime, "mean_time");
        this.detourIndex = requireFinite(detourIndex, "detour_index");
        this.meanErrors = requireFinite(meanErrors, "mean_errors");
        this.meanHesitations = requireFinite(meanHesitations, "mean_hesitations");
        this.visualIntegration = requireFinite(visualIntegration, "visual_integration");
        this.signageScore = requireFinite(signageScore, "signage_score");
        this.accessibilityScore = requireFinite(accessibilityScore, "accessibility_score");
    }

    private static double requireFinite(double value, String label) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(label + " must be a finite double");
        }
        return value;
    }

    /**
     * @return Raw value for a component, with signage and accessibility rescaled to [0, 1] when given as percent
     */
    public double value(WesComponent component) {
        switch (component) {
            case TIME:
                return meanTime;
            case DETOUR:
                return detourIndex;
            case ERRORS:
                return meanErrors;
            case HESITATIONS:
                return meanHesitations;
            case VISUAL_INTEGRATION:
                return visualIntegration;
            case SIGNAGE:
                return asFraction(signageScore);
            case ACCESSIBILITY:
                return asFraction(accessibilityScore);
            default:
                throw new IllegalStateException("Unhandled component " + component);
        }
    }

    private static double asFraction(double score) {
        return score > 1.0 ? score / 100.0 : score;
    }

    @JsonProperty("mean_time")
    public double getMeanTime() {
        return meanTime;
    }

    @JsonProperty("detour_index")
    public double getDetourIndex() {
        return detourIndex;
    }

    @JsonProperty("mean_errors")
    public double getMeanErrors() {
        return meanErrors;
    }

    @JsonProperty("mean_hesitations")
    public double getMeanHesitations() {
        return meanHesitations;
    }

    @JsonProperty("visual_integration")
    public double getVisualIntegration() {
        return visualIntegration;
    }

    @JsonProperty("signage_score")
    public double getSignageScore() {
        return signageScore;
    }

    @JsonProperty("accessibility_score")
    public double getAccessibilityScore() {
        return accessibilityScore;
    }

    @Override
    public String toString() {
        return String.format("WesInputs{T=%.2f, DI=%.3f, W=%.2f, H=%.2f, VI=%.3f, S=%.3f, A=%.3f}",
                meanTime, detourIndex, meanErrors, meanHesitations, visualIntegration,
                signageScore, accessibilityScore);
    }
}
