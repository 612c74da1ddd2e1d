package com.dynop.wayfinding.simulation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Outcome of one agent walking one scenario once.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AgentRun {

    private final int run;
    private final int agent;
    private final AgentType type;
    private final AgentPhase outcome;
    private final double distance;
    private final double time;
    private final int errors;
    private final int hesitations;
    private final int decisions;
    private final int moves;
    private final int signUsages;
    private final double detourIndex;
    @Nullable
    private final List<String> trace;

    AgentRun(int run, int agent, AgentState finalState, double straightLine, @Nullable List<String> trace) {
        this.run = run;
        this.agent = agent;
        this.type = finalState.getType();
        this.outcome = finalState.getPhase();
        this.distance = finalState.getDistance();
        this.time = finalState.getTime();
        this.errors = finalState.getErrors();
        this.hesitations = finalState.getHesitations();
        this.decisions = finalState.getDecisions();
        this.moves = finalState.getMoves();
        this.signUsages = finalState.getSignUsages();
        this.detourIndex = straightLine > 0 ? Math.max(1.0, distance / straightLine) : 1.0;
        this.trace = trace != null ? List.copyOf(trace) : null;
    }

    @JsonProperty("run")
    public int getRun() {
        return run;
    }

    @JsonProperty("agent")
    public int getAgent() {
        return agent;
    }

    @JsonProperty("type")
    public AgentType getType() {
        return type;
    }

    /**
     * @return {@link AgentPhase#ARRIVED} or {@link AgentPhase#STUCK}
     */
    @JsonProperty("outcome")
    public AgentPhase getOutcome() {
        return outcome;
    }

    public boolean isArrived() {
        return outcome == AgentPhase.ARRIVED;
    }

    /**
     * @return true if the agent arrived without a single wrong turn
     */
    public boolean isFirstPassSuccess() {
        return isArrived() && errors == 0;
    }

    @JsonProperty("distance")
    public double getDistance() {
        return distance;
    }

    @JsonProperty("time")
    public double getTime() {
        return time;
    }

    @JsonProperty("errors")
    public int getErrors() {
        return errors;
    }

    @JsonProperty("hesitations")
    public int getHesitations() {
        return hesitations;
    }

    @JsonProperty("decisions")
    public int getDecisions() {
        return decisions;
    }

    @JsonProperty("moves")
    public int getMoves() {
        return moves;
    }

    /**
     * @return Correct moves made with a sign within the signage radius of either end of the edge
     */
    @JsonProperty("sign_usages")
    public int getSignUsages() {
        return signUsages;
    }

    /**
     * @return {@code max(1, distance / straightLine)}, 1 when origin and destination coincide
     */
    @JsonProperty("detour_index")
    public double getDetourIndex() {
        return detourIndex;
    }

    /**
     * @return Node ids walked, only when traces are retained
     */
    @Nullable
    @JsonProperty("trace")
    public List<String> getTrace() {
        return trace;
    }

    @Override
    public String toString() {
        return String.format("AgentRun{run=%d, agent=%d, type=%s, outcome=%s, errors=%d, hesitations=%d, time=%.2f}",
                run, agent, type, outcome, errors, hesitations, time);
    }
}
