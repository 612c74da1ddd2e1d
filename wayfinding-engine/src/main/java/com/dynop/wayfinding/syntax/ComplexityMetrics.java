package com.dynop.wayfinding.syntax;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whole-graph spatial complexity indicators.
 *
 * @param meanDegree    Mean node degree
 * @param stdDegree     Standard deviation of node degree
 * @param meanMeanDepth Mean of the defined mean depths
 * @param maxMeanDepth  Largest defined mean depth
 * @param composite     {@code 0.4 * meanDegree + 0.3 * maxMeanDepth + 0.3 / meanIntegration}; the last
 *                      term is dropped when no integration value is defined
 */
public record ComplexityMetrics(
        @JsonProperty("mean_degree") double meanDegree,
        @JsonProperty("std_degree") double stdDegree,
        @JsonProperty("mean_mean_depth") double meanMeanDepth,
        @JsonProperty("max_mean_depth") double maxMeanDepth,
        @JsonProperty("composite") double composite) {
}
