package com.dynop.wayfinding.config;

import com.dynop.wayfinding.simulation.AgentProfile;
import com.dynop.wayfinding.simulation.AgentType;
import com.graphhopper.util.PMap;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Decision-model constants and agent profiles of the navigation simulation.
 *
 * <p>Agent profiles are overridden per type with {@code simulation.agent.<type>.error_rate} and
 * {@code simulation.agent.<type>.speed}, where {@code <type>} is {@link AgentType#getKey()}.
 */
public final class SimulationConfig {

    public static final String SEED = "simulation.seed";
    public static final String ERROR_CAP = "simulation.error_cap";
    public static final String DEGREE_FACTOR = "simulation.degree_factor";
    public static final String SIGNAGE_FACTOR = "simulation.signage_factor";
    public static final String LANDMARK_FACTOR = "simulation.landmark_factor";
    public static final String VISIBILITY_FACTOR = "simulation.visibility_factor";
    public static final String SIGNAGE_RADIUS = "simulation.signage_radius";
    public static final String DWELL_TIME = "simulation.dwell_time";
    public static final String MIN_STEPS = "simulation.min_steps";
    public static final String STEP_FACTOR = "simulation.step_factor";
    public static final String RETAIN_TRACES = "simulation.retain_traces";
    static final String AGENT_PREFIX = "simulation.agent.";

    private final long seed;
    private final double errorCap;
    private final double degreeFactor;
    private final double signageFactor;
    private final double landmarkFactor;
    private final double visibilityFactor;
    private final double signageRadius;
    private final double dwellTime;
    private final int minSteps;
    private final double stepFactor;
    private final boolean retainTraces;
    private final Map<AgentType, AgentProfile> profiles;

    SimulationConfig(PropertyReader reader) {
        this.seed = reader.getLong(SEED, 42L);
        this.errorCap = reader.probability(ERROR_CAP, 0.9);
        this.degreeFactor = reader.nonNegative(DEGREE_FACTOR, 0.1);
        this.signageFactor = reader.positive(SIGNAGE_FACTOR, 2.0);
        this.landmarkFactor = reader.positive(LANDMARK_FACTOR, 1.67);
        this.visibilityFactor = reader.positive(VISIBILITY_FACTOR, 1.5);
        this.signageRadius = reader.nonNegative(SIGNAGE_RADIUS, 5.0);
        this.dwellTime = reader.nonNegative(DWELL_TIME, 2.0);
        this.minSteps = reader.positiveInt(MIN_STEPS, 50);
        this.stepFactor = reader.positive(STEP_FACTOR, 4.0);
        this.retainTraces = reader.getBool(RETAIN_TRACES, false);

        EnumMap<AgentType, AgentProfile> resolved = new EnumMap<>(AgentType.class);
        for (AgentType type : AgentType.values()) {
            String prefix = AGENT_PREFIX + type.getKey();
            AgentProfile defaults = type.getDefaultProfile();
            double errorRate = reader.probability(prefix + ".error_rate", defaults.baseErrorRate());
            double speed = reader.positive(prefix + ".speed", defaults.walkingSpeed());
            resolved.put(type, new AgentProfile(errorRate, speed));
        }
        this.profiles = Collections.unmodifiableMap(resolved);
    }

    public static SimulationConfig defaults() {
        return new SimulationConfig(new PropertyReader(new PMap()));
    }

    /**
     * @return Seed used when a request does not carry its own
     */
    public long getSeed() {
        return seed;
    }

    /**
     * @return Upper bound of the per-decision error probability
     */
    public double getErrorCap() {
        return errorCap;
    }

    /**
     * @return Relative error increase per additional branch at a decision point
     */
    public double getDegreeFactor() {
        return degreeFactor;
    }

    /**
     * @return Error multiplier applied when no sign is within {@link #getSignageRadius()}
     */
    public double getSignageFactor() {
        return signageFactor;
    }

    /**
     * @return Error multiplier applied when no landmark is within {@link #getSignageRadius()}
     */
    public double getLandmarkFactor() {
        return landmarkFactor;
    }

    /**
     * @return Error multiplier applied at nodes whose nearest visibility sample is a blind spot
     */
    public double getVisibilityFactor() {
        return visibilityFactor;
    }

    public double getSignageRadius() {
        return signageRadius;
    }

    /**
     * @return Seconds added when leaving a decision point
     */
    public double getDwellTime() {
        return dwellTime;
    }

    public int getMinSteps() {
        return minSteps;
    }

    public double getStepFactor() {
        return stepFactor;
    }

    /**
     * @return Move budget for a component with the given hop diameter
     */
    public int stepBudget(int hopDiameter) {
        return (int) Math.max(minSteps, Math.ceil(stepFactor * hopDiameter));
    }

    public boolean isRetainTraces() {
        return retainTraces;
    }

    public AgentProfile profile(AgentType type) {
        return profiles.get(type);
    }

    public Map<AgentType, AgentProfile> getProfiles() {
        return profiles;
    }
}
