package com.dynop.wayfinding.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A score component that falls short of "excellent", ranked by how many points improving it could add.
 *
 * @param component            Component to improve
 * @param goodness             Current goodness in [0, 1] (1 is best, whether penalty or bonus)
 * @param improvementPotential {@code 1 - goodness}
 * @param impact               Estimated score gain, {@code improvementPotential * weight * 0.9}
 * @param level                HIGH above 5 points, MEDIUM above 2, otherwise LOW
 */
public record ImprovementPriority(
        @JsonProperty("component") WesComponent component,
        @JsonProperty("goodness") double goodness,
        @JsonProperty("improvement_potential") double improvementPotential,
        @JsonProperty("impact") double impact,
        @JsonProperty("level") Level level) {

    public enum Level {
        HIGH,
        MEDIUM,
        LOW
    }

    static Level levelFor(double impact) {
        if (impact > 5) {
            return Level.HIGH;
        }
        return impact > 2 ? Level.MEDIUM : Level.LOW;
    }
}
