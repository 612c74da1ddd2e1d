package com.dynop.wayfinding.scoring;

/**
 * The seven sub-metrics combined into the Wayfinding Efficiency Score.
 *
 * <p>Penalty components lower the score as they grow; bonus components raise it.
 */
public enum WesComponent {
    TIME("time", true),
    DETOUR("detour", true),
    ERRORS("errors", true),
    HESITATIONS("hesitations", true),
    VISUAL_INTEGRATION("visual_integration", false),
    SIGNAGE("signage", false),
    ACCESSIBILITY("accessibility", false);

    private final String key;
    private final boolean penalty;

    WesComponent(String key, boolean penalty) {
        this.key = key;
        this.penalty = penalty;
    }

    /**
     * @return Lower-case key used in configuration (e.g. "visual_integration")
     */
    public String getKey() {
        return key;
    }

    /**
     * @return true if a larger raw value makes wayfinding worse
     */
    public boolean isPenalty() {
        return penalty;
    }
}
