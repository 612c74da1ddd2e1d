package com.dynop.wayfinding.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;

/**
 * Benchmark checks of every component plus the share that met its standard.
 */
public final class BenchmarkComparison {

    private final Map<WesComponent, BenchmarkCheck> checks;
    private final int met;

    BenchmarkComparison(Map<WesComponent, BenchmarkCheck> checks) {
        this.checks = Collections.unmodifiableMap(checks);
        this.met = (int) checks.values().stream().filter(BenchmarkCheck::meetsStandard).count();
    }

    @JsonProperty("checks")
    public Map<WesComponent, BenchmarkCheck> getChecks() {
        return checks;
    }

    public BenchmarkCheck get(WesComponent component) {
        return checks.get(component);
    }

    @JsonProperty("met")
    public int getMet() {
        return met;
    }

    @JsonProperty("total")
    public int getTotal() {
        return checks.size();
    }

    /**
     * @return {@code met / total * 100}
     */
    @JsonProperty("compliance_percentage")
    public double getCompliancePercentage() {
        return checks.isEmpty() ? 0.0 : 100.0 * met / checks.size();
    }
}
