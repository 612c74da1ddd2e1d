package com.dynop.wayfinding.visibility;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate view of a visibility analysis.
 */
public record VisibilitySummary(
        @JsonProperty("sample_count") int sampleCount,
        @JsonProperty("visibility_edges") int visibilityEdges,
        @JsonProperty("mean_visual_integration") double meanVisualIntegration,
        @JsonProperty("std_visual_integration") double stdVisualIntegration,
        @JsonProperty("min_visual_integration") double minVisualIntegration,
        @JsonProperty("max_visual_integration") double maxVisualIntegration,
        @JsonProperty("mean_isovist_area") double meanIsovistArea,
        @JsonProperty("std_isovist_area") double stdIsovistArea,
        @JsonProperty("blind_spot_count") int blindSpotCount,
        @JsonProperty("wide_visibility_count") int wideVisibilityCount,
        @JsonProperty("degenerate_count") int degenerateCount,
        @JsonProperty("effective_spacing") double effectiveSpacing,
        @JsonProperty("coarsened") boolean coarsened) {
}
