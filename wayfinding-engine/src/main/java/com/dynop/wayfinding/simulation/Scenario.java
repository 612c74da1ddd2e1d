package com.dynop.wayfinding.simulation;

import com.dynop.wayfinding.AnalysisException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A navigation task (origin to destination) walked by a population of agents, repeated {@code runCount} times.
 *
 * <p>Agents of one run are numbered in {@link AgentType} declaration order, so a population of
 * {@code {FAMILIAR: 2, ELDERLY: 1}} yields agents 0 and 1 (familiar) and agent 2 (elderly).
 */
public final class Scenario {

    private final String name;
    private final String origin;
    private final String destination;
    private final Map<AgentType, Integer> population;
    private final int runCount;
    private final List<AgentType> agents;

    /**
     * @throws AnalysisException with {@code INVALID_SCENARIO} if the population is empty, a count is
     *                           negative or {@code runCount < 1}
     */
    @JsonCreator
    public Scenario(
            @JsonProperty(value = "name", required = true) String name,
            @JsonProperty(value = "origin", required = true) String origin,
            @JsonProperty(value = "destination", required = true) String destination,
            @JsonProperty(value = "population", required = true) Map<AgentType, Integer> population,
            @JsonProperty(value = "run_count", defaultValue = "1") Integer runCount) {
        this.name = Objects.requireNonNull(name, "name");
        this.origin = Objects.requireNonNull(origin, "origin");
        this.destination = Objects.requireNonNull(destination, "destination");
        this.runCount = runCount != null ? runCount : 1;
        if (this.runCount < 1) {
            throw new AnalysisException(AnalysisException.INVALID_SCENARIO, name,
                    "run_count must be at least 1, was " + this.runCount);
        }

        EnumMap<AgentType, Integer> mix = new EnumMap<>(AgentType.class);
        List<AgentType> roster = new ArrayList<>();
        if (population != null) {
            mix.putAll(population);
        }
        for (Map.Entry<AgentType, Integer> entry : mix.entrySet()) {
            Integer count = entry.getValue();
            if (count == null || count < 0) {
                throw new AnalysisException(AnalysisException.INVALID_SCENARIO, name,
                        "Population count for " + entry.getKey() + " must be non-negative");
            }
            for (int i = 0; i < count; i++) {
                roster.add(entry.getKey());
            }
        }
        if (roster.isEmpty()) {
            throw new AnalysisException(AnalysisException.INVALID_SCENARIO, name, "Population must not be empty");
        }
        this.population = Collections.unmodifiableMap(mix);
        this.agents = List.copyOf(roster);
    }

    public Scenario(String name, String origin, String destination, Map<AgentType, Integer> population,
                    int runCount) {
        this(name, origin, destination, population, Integer.valueOf(runCount));
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

    @JsonProperty("population")
    public Map<AgentType, Integer> getPopulation() {
        return population;
    }

    @JsonProperty("run_count")
    public int getRunCount() {
        return runCount;
    }

    /**
     * @return Agent types by agent index within one run
     */
    public List<AgentType> agents() {
        return agents;
    }

    @Override
    public String toString() {
        return String.format("Scenario{name='%s', %s -> %s, population=%s, runs=%d}",
                name, origin, destination, population, runCount);
    }
}
