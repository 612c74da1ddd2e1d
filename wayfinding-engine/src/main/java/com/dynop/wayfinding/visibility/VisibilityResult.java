package com.dynop.wayfinding.visibility;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-sample isovist and visibility-graph table with its critical points.
 */
public final class VisibilityResult {

    private final List<IsovistSample> samples;
    private final double[] visualIntegration;
    private final boolean[] blindSpot;
    private final List<Integer> blindSpots;
    private final List<Integer> wideVisibilityPoints;
    private final VisibilitySummary summary;
    private final VisibilityGraph visibilityGraph;
    private final List<String> skippedMetrics;

    VisibilityResult(List<IsovistSample> samples, double[] visualIntegration, List<Integer> blindSpots,
                     List<Integer> wideVisibilityPoints, VisibilitySummary summary,
                     VisibilityGraph visibilityGraph, List<String> skippedMetrics) {
        this.samples = List.copyOf(samples);
        this.visualIntegration = visualIntegration.clone();
        this.blindSpot = new boolean[samples.size()];
        for (int index : blindSpots) {
            blindSpot[index] = true;
        }
        this.blindSpots = List.copyOf(blindSpots);
        this.wideVisibilityPoints = List.copyOf(wideVisibilityPoints);
        this.summary = summary;
        this.visibilityGraph = visibilityGraph;
        this.skippedMetrics = List.copyOf(skippedMetrics);
    }

    @JsonProperty("samples")
    public List<IsovistSample> getSamples() {
        return samples;
    }

    /**
     * @return Visual integration per sample index
     */
    @JsonProperty("visual_integration")
    public double[] getVisualIntegration() {
        return visualIntegration.clone();
    }

    public double visualIntegration(int sample) {
        return visualIntegration[sample];
    }

    /**
     * @return Sample indices whose visual integration is below the blind-spot percentile
     */
    @JsonProperty("blind_spots")
    public List<Integer> getBlindSpots() {
        return blindSpots;
    }

    /**
     * @return Sample indices whose visual integration is above the wide-visibility percentile
     */
    @JsonProperty("wide_visibility_points")
    public List<Integer> getWideVisibilityPoints() {
        return wideVisibilityPoints;
    }

    public boolean isBlindSpot(int sample) {
        return blindSpot[sample];
    }

    @JsonProperty("summary")
    public VisibilitySummary getSummary() {
        return summary;
    }

    @JsonIgnore
    public VisibilityGraph getVisibilityGraph() {
        return visibilityGraph;
    }

    @JsonProperty("skipped_metrics")
    public List<String> getSkippedMetrics() {
        return skippedMetrics;
    }

    /**
     * Nearest sample by Euclidean distance; ties go to the lower index.
     *
     * @return Sample index
     */
    public int nearestSample(double x, double y) {
        int nearest = 0;
        double best = Double.POSITIVE_INFINITY;
        for (IsovistSample sample : samples) {
            double distance = Math.hypot(sample.getX() - x, sample.getY() - y);
            if (distance < best) {
                best = distance;
                nearest = sample.getIndex();
            }
        }
        return nearest;
    }
}
