package com.dynop.wayfinding.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;

/**
 * Spread of scores across alternative designs or scenarios.
 */
public final class WesComparison {

    private final String best;
    private final String worst;
    private final double bestScore;
    private final double worstScore;
    private final double meanScore;
    private final double stdScore;
    private final Map<String, Double> scores;

    WesComparison(String best, String worst, double bestScore, double worstScore,
                  double meanScore, double stdScore, Map<String, Double> scores) {
        this.best = best;
        this.worst = worst;
        this.bestScore = bestScore;
        this.worstScore = worstScore;
        this.meanScore = meanScore;
        this.stdScore = stdScore;
        this.scores = Collections.unmodifiableMap(scores);
    }

    @JsonProperty("best")
    public String getBest() {
        return best;
    }

    @JsonProperty("worst")
    public String getWorst() {
        return worst;
    }

    @JsonProperty("best_score")
    public double getBestScore() {
        return bestScore;
    }

    @JsonProperty("worst_score")
    public double getWorstScore() {
        return worstScore;
    }

    @JsonProperty("mean_score")
    public double getMeanScore() {
        return meanScore;
    }

    @JsonProperty("std_score")
    public double getStdScore() {
        return stdScore;
    }

    @JsonProperty("range")
    public double getRange() {
        return bestScore - worstScore;
    }

    @JsonProperty("scores")
    public Map<String, Double> getScores() {
        return scores;
    }
}
