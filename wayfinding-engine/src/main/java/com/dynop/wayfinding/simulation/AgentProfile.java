package com.dynop.wayfinding.simulation;

/**
 * Behavioural attributes of an agent type.
 *
 * @param baseErrorRate Probability of a wrong turn at a decision point before situational factors, in [0, 1]
 * @param walkingSpeed  Walking speed in distance units per second, positive
 */
public record AgentProfile(double baseErrorRate, double walkingSpeed) {

    public AgentProfile {
        if (!(baseErrorRate >= 0 && baseErrorRate <= 1)) {
            throw new IllegalArgumentException("baseErrorRate must be in [0, 1], was " + baseErrorRate);
        }
        if (!(walkingSpeed > 0) || Double.isInfinite(walkingSpeed)) {
            throw new IllegalArgumentException("walkingSpeed must be positive and finite, was " + walkingSpeed);
        }
    }
}
