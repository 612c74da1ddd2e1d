package com.dynop.wayfinding.simulation;

/**
 * Closed set of simulated visitor types.
 *
 * <ul>
 *   <li>{@link #FAMILIAR} - Regular user who knows the building</li>
 *   <li>{@link #FIRST_TIME_VISITOR} - Visitor with no prior knowledge</li>
 *   <li>{@link #ELDERLY} - Older visitor, slower and more error-prone</li>
 *   <li>{@link #MOBILITY_IMPAIRED} - Wheelchair or walking-aid user</li>
 * </ul>
 */
public enum AgentType {
    FAMILIAR("familiar", new AgentProfile(0.05, 1.4)),
    FIRST_TIME_VISITOR("first_time_visitor", new AgentProfile(0.25, 1.0)),
    ELDERLY("elderly", new AgentProfile(0.35, 0.8)),
    MOBILITY_IMPAIRED("mobility_impaired", new AgentProfile(0.30, 0.6));

    private final String key;
    private final AgentProfile defaultProfile;

    AgentType(String key, AgentProfile defaultProfile) {
        this.key = key;
        this.defaultProfile = defaultProfile;
    }

    /**
     * @return Lower-case key used in configuration (e.g. "first_time_visitor")
     */
    public String getKey() {
        return key;
    }

    /**
     * @return Built-in error rate and walking speed
     */
    public AgentProfile getDefaultProfile() {
        return defaultProfile;
    }
}
