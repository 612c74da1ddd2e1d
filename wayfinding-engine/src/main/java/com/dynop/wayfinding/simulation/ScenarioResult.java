package com.dynop.wayfinding.simulation;

import com.dynop.wayfinding.stats.DistributionSummary;
import com.dynop.wayfinding.stats.Statistics;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Aggregated outcome of every run of a scenario. Stuck runs are included in every statistic.
 */
public final class ScenarioResult {

    private final String name;
    private final String origin;
    private final String destination;
    private final List<AgentRun> runs;
    private final DistributionSummary time;
    private final DistributionSummary errors;
    private final DistributionSummary hesitations;
    private final DistributionSummary distance;
    private final DistributionSummary signUsage;
    private final double detourIndex;
    private final double successRate;
    private final double firstPassSuccessRate;
    private final double stuckRate;
    private final Map<AgentType, TypeBreakdown> byType;

    ScenarioResult(Scenario scenario, List<AgentRun> runs) {
        this.name = scenario.getName();
        this.origin = scenario.getOrigin();
        this.destination = scenario.getDestination();
        this.runs = List.copyOf(runs);
        this.time = DistributionSummary.of(values(runs, AgentRun::getTime));
        this.errors = DistributionSummary.of(values(runs, AgentRun::getErrors));
        this.hesitations = DistributionSummary.of(values(runs, AgentRun::getHesitations));
        this.distance = DistributionSummary.of(values(runs, AgentRun::getDistance));
        this.signUsage = DistributionSummary.of(values(runs, AgentRun::getSignUsages));
        this.detourIndex = Statistics.mean(values(runs, AgentRun::getDetourIndex));
        this.successRate = rate(runs, AgentRun::isArrived);
        this.firstPassSuccessRate = rate(runs, AgentRun::isFirstPassSuccess);
        this.stuckRate = 1.0 - successRate;

        Map<AgentType, List<AgentRun>> grouped = new EnumMap<>(AgentType.class);
        for (AgentRun run : runs) {
            grouped.computeIfAbsent(run.getType(), t -> new ArrayList<>()).add(run);
        }
        Map<AgentType, TypeBreakdown> breakdown = new EnumMap<>(AgentType.class);
        for (Map.Entry<AgentType, List<AgentRun>> entry : grouped.entrySet()) {
            List<AgentRun> typeRuns = entry.getValue();
            breakdown.put(entry.getKey(), new TypeBreakdown(
                    typeRuns.size(),
                    rate(typeRuns, AgentRun::isArrived),
                    rate(typeRuns, AgentRun::isFirstPassSuccess),
                    Statistics.mean(values(typeRuns, AgentRun::getTime)),
                    Statistics.mean(values(typeRuns, AgentRun::getErrors)),
                    Statistics.mean(values(typeRuns, AgentRun::getHesitations)),
                    Statistics.mean(values(typeRuns, AgentRun::getDetourIndex))));
        }
        this.byType = Collections.unmodifiableMap(breakdown);
    }

    static double[] values(List<AgentRun> runs, ToDoubleFunction<AgentRun> metric) {
        return runs.stream().mapToDouble(metric).toArray();
    }

    private static double rate(List<AgentRun> runs, Predicate<AgentRun> predicate) {
        if (runs.isEmpty()) {
            return 0.0;
        }
        return (double) runs.stream().filter(predicate).count() / runs.size();
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("origin")
    public String getOrigin() {
        return origin;
    }

    @JsonProperty("destination")
    public String getDestination() {
        return destination;
    }

    /**
     * @return Individual runs ordered by (run, agent)
     */
    @JsonProperty("runs")
    public List<AgentRun> getRuns() {
        return runs;
    }

    @JsonProperty("time")
    public DistributionSummary getTime() {
        return time;
    }

    @JsonProperty("errors")
    public DistributionSummary getErrors() {
        return errors;
    }

    @JsonProperty("hesitations")
    public DistributionSummary getHesitations() {
        return hesitations;
    }

    @JsonProperty("distance")
    public DistributionSummary getDistance() {
        return distance;
    }

    /**
     * @return Sign usages per run
     */
    @JsonProperty("sign_usage")
    public DistributionSummary getSignUsage() {
        return signUsage;
    }

    /**
     * @return Mean per-run detour index, never below 1
     */
    @JsonProperty("detour_index")
    public double getDetourIndex() {
        return detourIndex;
    }

    @JsonProperty("success_rate")
    public double getSuccessRate() {
        return successRate;
    }

    @JsonProperty("first_pass_success_rate")
    public double getFirstPassSuccessRate() {
        return firstPassSuccessRate;
    }

    @JsonProperty("stuck_rate")
    public double getStuckRate() {
        return stuckRate;
    }

    @JsonProperty("by_type")
    public Map<AgentType, TypeBreakdown> getByType() {
        return byType;
    }

    @Override
    public String toString() {
        return String.format("ScenarioResult{name='%s', runs=%d, success=%.3f, meanTime=%.2f, DI=%.3f}",
                name, runs.size(), successRate, time.getMean(), detourIndex);
    }
}
