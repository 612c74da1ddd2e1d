package com.dynop.wayfinding.simulation;

import java.util.List;
import java.util.SplittableRandom;

/**
 * Pure transition function of the agent state machine.
 *
 * <p>{@code AT_NODE -> DECIDING -> MOVING -> AT_NODE}, until the agent reaches the destination
 * ({@link AgentPhase#ARRIVED}) or exhausts its move budget ({@link AgentPhase#STUCK}). The only
 * source of randomness is the supplied stream, drawn once per decision point.
 *
 * <p>A correct move taken next to a sign, at either end of the edge, counts as one sign usage.
 */
public final class AgentStepper {

    private AgentStepper() {
    }

    /**
     * Advance the agent by one phase.
     *
     * @param state   Current state
     * @param context Scenario environment
     * @param random  Stream of this run
     * @return Next state (the same instance for terminal phases)
     */
    public static AgentState step(AgentState state, NavigationContext context, SplittableRandom random) {
        switch (state.getPhase()) {
            case AT_NODE:
                if (state.getCurrent() == context.getDestination()) {
                    return state.withPhase(AgentPhase.ARRIVED);
                }
                if (state.getMoves() >= context.getStepBudget()
                        || context.getGraph().degree(state.getCurrent()) == 0) {
                    return state.withPhase(AgentPhase.STUCK);
                }
                return state.withPhase(AgentPhase.DECIDING);
            case DECIDING:
                return decide(state, context, random);
            case MOVING:
                return move(state, context);
            case ARRIVED:
            case STUCK:
                return state;
            default:
                throw new IllegalStateException("Unhandled phase " + state.getPhase());
        }
    }

    /**
     * Step until a terminal phase.
     */
    public static AgentState run(AgentState start, NavigationContext context, SplittableRandom random) {
        AgentState state = start;
        while (!state.getPhase().isTerminal()) {
            state = step(state, context, random);
        }
        return state;
    }

    private static AgentState decide(AgentState state, NavigationContext context, SplittableRandom random) {
        int node = state.getCurrent();
        boolean decisionPoint = DecisionModel.forwardOptions(context.getGraph(), node, state.getPrevious()) > 1;
        if (decisionPoint) {
            double p = DecisionModel.errorProbability(context, state.getType(), node);
            double draw = random.nextDouble();
            List<Integer> incorrect = DecisionModel.incorrectChoices(context, node);
            if (draw < p && !incorrect.isEmpty()) {
                int wrong = incorrect.get(random.nextInt(incorrect.size()));
                return state.withDecision(wrong, true, true, false);
            }
        }
        int chosen = DecisionModel.correctChoice(context, node);
        boolean signUsed = context.isSignNearby(node) || context.isSignNearby(chosen);
        return state.withDecision(chosen, decisionPoint, false, signUsed);
    }

    private static AgentState move(AgentState state, NavigationContext context) {
        double weight = context.getGraph().edgeWeight(state.getCurrent(), state.getTarget());
        double speed = context.getConfig().profile(state.getType()).walkingSpeed();
        double elapsed = weight / speed;
        if (state.isLeavingDecisionPoint()) {
            elapsed += context.getConfig().getDwellTime();
        }
        return state.arriveAt(weight, elapsed);
    }
}
