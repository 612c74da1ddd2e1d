package com.dynop.wayfinding.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregates of one agent type within a scenario.
 */
public record TypeBreakdown(
        @JsonProperty("runs") int runs,
        @JsonProperty("success_rate") double successRate,
        @JsonProperty("first_pass_success_rate") double firstPassSuccessRate,
        @JsonProperty("mean_time") double meanTime,
        @JsonProperty("mean_errors") double meanErrors,
        @JsonProperty("mean_hesitations") double meanHesitations,
        @JsonProperty("mean_detour_index") double meanDetourIndex) {
}
