package com.dynop.wayfinding.simulation;

import com.dynop.wayfinding.stats.Statistics;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Results of every scenario plus run-weighted totals across them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SimulationReport {

    static final double LOW_SUCCESS_RATE = 0.7;
    static final double HIGH_MEAN_TIME = 180.0;
    static final double HIGH_MEAN_ERRORS = 1.5;
    static final String NO_ISSUES = "Overall performance is good, no critical recommendations";

    private static final int NAMES_PER_RECOMMENDATION = 3;

    private final List<ScenarioResult> scenarios;
    private final long seed;
    private final int totalRuns;
    private final double successRate;
    private final double meanTime;
    private final double meanErrors;
    private final double meanHesitations;
    private final double meanDetourIndex;
    private final double meanSignUsage;
    private final List<String> recommendations;
    @Nullable
    private final String bestScenario;
    @Nullable
    private final String worstScenario;

    SimulationReport(List<ScenarioResult> scenarios, long seed) {
        this.scenarios = List.copyOf(scenarios);
        this.seed = seed;

        List<AgentRun> all = new ArrayList<>();
        for (ScenarioResult scenario : scenarios) {
            all.addAll(scenario.getRuns());
        }
        this.totalRuns = all.size();
        this.successRate = all.isEmpty() ? 0.0
                : (double) all.stream().filter(AgentRun::isArrived).count() / all.size();
        this.meanTime = Statistics.mean(ScenarioResult.values(all, AgentRun::getTime));
        this.meanErrors = Statistics.mean(ScenarioResult.values(all, AgentRun::getErrors));
        this.meanHesitations = Statistics.mean(ScenarioResult.values(all, AgentRun::getHesitations));
        this.meanDetourIndex = all.isEmpty() ? 1.0
                : Statistics.mean(ScenarioResult.values(all, AgentRun::getDetourIndex));
        this.meanSignUsage = Statistics.mean(ScenarioResult.values(all, AgentRun::getSignUsages));
        this.recommendations = recommend(this.scenarios);

        ScenarioResult best = null;
        ScenarioResult worst = null;
        for (ScenarioResult scenario : scenarios) {
            if (best == null || scenario.getSuccessRate() > best.getSuccessRate()) {
                best = scenario;
            }
            if (worst == null || scenario.getSuccessRate() < worst.getSuccessRate()) {
                worst = scenario;
            }
        }
        this.bestScenario = best != null ? best.getName() : null;
        this.worstScenario = worst != null ? worst.getName() : null;
    }

    /**
     * Flag scenarios with a success rate below 0.7, a mean time above 180 s or more than 1.5
     * mean errors. Each rule yields one line naming at most three scenarios in input order.
     */
    static List<String> recommend(List<ScenarioResult> scenarios) {
        List<String> lines = new ArrayList<>();
        addIfAny(lines, scenarios, s -> s.getSuccessRate() < LOW_SUCCESS_RATE,
                "Improve route guidance for %s (success rate below 70%%)");
        addIfAny(lines, scenarios, s -> s.getTime().getMean() > HIGH_MEAN_TIME,
                "Reduce travel time for %s (mean time above 180 s)");
        addIfAny(lines, scenarios, s -> s.getErrors().getMean() > HIGH_MEAN_ERRORS,
                "Add signage along %s (more than 1.5 wrong turns per run)");
        if (lines.isEmpty()) {
            lines.add(NO_ISSUES);
        }
        return List.copyOf(lines);
    }

    private static void addIfAny(List<String> lines, List<ScenarioResult> scenarios,
                                 Predicate<ScenarioResult> flagged, String template) {
        String names = scenarios.stream()
                .filter(flagged)
                .limit(NAMES_PER_RECOMMENDATION)
                .map(ScenarioResult::getName)
                .collect(Collectors.joining(", "));
        if (!names.isEmpty()) {
            lines.add(String.format(template, names));
        }
    }

    @JsonProperty("scenarios")
    public List<ScenarioResult> getScenarios() {
        return scenarios;
    }

    @JsonProperty("seed")
    public long getSeed() {
        return seed;
    }

    @JsonProperty("total_runs")
    public int getTotalRuns() {
        return totalRuns;
    }

    @JsonProperty("success_rate")
    public double getSuccessRate() {
        return successRate;
    }

    @JsonProperty("mean_time")
    public double getMeanTime() {
        return meanTime;
    }

    @JsonProperty("mean_errors")
    public double getMeanErrors() {
        return meanErrors;
    }

    @JsonProperty("mean_hesitations")
    public double getMeanHesitations() {
        return meanHesitations;
    }

    @JsonProperty("mean_detour_index")
    public double getMeanDetourIndex() {
        return meanDetourIndex;
    }

    @JsonProperty("mean_sign_usage")
    public double getMeanSignUsage() {
        return meanSignUsage;
    }

    @JsonProperty("recommendations")
    public List<String> getRecommendations() {
        return recommendations;
    }

    /**
     * @return Scenario with the highest success rate (first on ties), null without scenarios
     */
    @Nullable
    @JsonProperty("best_scenario")
    public String getBestScenario() {
        return bestScenario;
    }

    @Nullable
    @JsonProperty("worst_scenario")
    public String getWorstScenario() {
        return worstScenario;
    }
}
