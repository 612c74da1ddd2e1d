package com.dynop.wayfinding.simulation;

/**
 * Phase of a simulated agent.
 *
 * <p>Transitions: {@code AT_NODE -> DECIDING -> MOVING -> AT_NODE}, ending in {@link #ARRIVED}
 * or {@link #STUCK}.
 */
public enum AgentPhase {
    AT_NODE,
    DECIDING,
    MOVING,
    ARRIVED,
    STUCK;

    public boolean isTerminal() {
        return this == ARRIVED || this == STUCK;
    }
}
