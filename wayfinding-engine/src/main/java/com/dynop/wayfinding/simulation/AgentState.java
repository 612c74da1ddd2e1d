package com.dynop.wayfinding.simulation;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Immutable snapshot of one agent during a run.
 *
 * <p>Only {@link AgentStepper} derives new states. The path history is append-only and includes
 * backtracks; the visited set mirrors it for constant-time revisit checks.
 */
public final class AgentState {

    static final int NONE = -1;

    private final AgentType type;
    private final AgentPhase phase;
    private final int current;
    private final int previous;
    private final int target;
    private final boolean leavingDecisionPoint;
    private final double distance;
    private final double time;
    private final int errors;
    private final int hesitations;
    private final int decisions;
    private final int moves;
    private final int signUsages;
    private final int[] path;
    private final BitSet visited;

    private AgentState(AgentType type, AgentPhase phase, int current, int previous, int target,
                       boolean leavingDecisionPoint, double distance, double time, int errors,
                       int hesitations, int decisions, int moves, int signUsages, int[] path, BitSet visited) {
        this.type = type;
        this.phase = phase;
        this.current = current;
        this.previous = previous;
        this.target = target;
        this.leavingDecisionPoint = leavingDecisionPoint;
        this.distance = distance;
        this.time = time;
        this.errors = errors;
        this.hesitations = hesitations;
        this.decisions = decisions;
        this.moves = moves;
        this.signUsages = signUsages;
        this.path = path;
        this.visited = visited;
    }

    /**
     * @return Agent standing at the origin, nothing walked yet
     */
    public static AgentState start(AgentType type, int origin) {
        BitSet visited = new BitSet();
        visited.set(origin);
        return new AgentState(type, AgentPhase.AT_NODE, origin, NONE, NONE, false, 0, 0, 0, 0, 0, 0, 0,
                new int[]{origin}, visited);
    }

    AgentState withPhase(AgentPhase next) {
        return new AgentState(type, next, current, previous, target, leavingDecisionPoint, distance, time,
                errors, hesitations, decisions, moves, signUsages, path, visited);
    }

    AgentState withDecision(int chosen, boolean decisionPoint, boolean wrongTurn, boolean signUsed) {
        return new AgentState(type, AgentPhase.MOVING, current, previous, chosen, decisionPoint, distance, time,
                wrongTurn ? errors + 1 : errors, hesitations, decisionPoint ? decisions + 1 : decisions, moves,
                signUsed ? signUsages + 1 : signUsages, path, visited);
    }

    AgentState arriveAt(double edgeWeight, double elapsed) {
        boolean revisit = visited.get(target);
        int[] extended = Arrays.copyOf(path, path.length + 1);
        extended[path.length] = target;
        BitSet nextVisited = (BitSet) visited.clone();
        nextVisited.set(target);
        return new AgentState(type, AgentPhase.AT_NODE, target, current, NONE, false, distance + edgeWeight,
                time + elapsed, errors, revisit ? hesitations + 1 : hesitations, decisions, moves + 1,
                signUsages, extended, nextVisited);
    }

    public AgentType getType() {
        return type;
    }

    public AgentPhase getPhase() {
        return phase;
    }

    public int getCurrent() {
        return current;
    }

    /**
     * @return Node the agent arrived from, or -1 at the origin
     */
    public int getPrevious() {
        return previous;
    }

    /**
     * @return Node being moved to while {@link AgentPhase#MOVING}, otherwise -1
     */
    public int getTarget() {
        return target;
    }

    boolean isLeavingDecisionPoint() {
        return leavingDecisionPoint;
    }

    public double getDistance() {
        return distance;
    }

    public double getTime() {
        return time;
    }

    public int getErrors() {
        return errors;
    }

    public int getHesitations() {
        return hesitations;
    }

    public int getDecisions() {
        return decisions;
    }

    public int getMoves() {
        return moves;
    }

    /**
     * @return Correct moves made with a sign in reach
     */
    public int getSignUsages() {
        return signUsages;
    }

    /**
     * @return Visited node indices in walking order (defensive copy)
     */
    public int[] getPath() {
        return path.clone();
    }

    public boolean hasVisited(int node) {
        return visited.get(node);
    }

    @Override
    public String toString() {
        return String.format("AgentState{type=%s, phase=%s, at=%d, moves=%d, errors=%d, hesitations=%d, time=%.2f}",
                type, phase, current, moves, errors, hesitations, time);
    }
}
