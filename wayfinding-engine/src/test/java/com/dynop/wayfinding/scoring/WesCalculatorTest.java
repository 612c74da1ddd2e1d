package com.dynop.wayfinding.scoring;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WesCalculatorTest {

    private final WesCalculator calculator = new WesCalculator();

    private static WesInputs midpoint() {
        return new WesInputs(180, 1.75, 2.5, 4, 0.6, 0.5, 0.5);
    }

    @Test
    void midpointInputsScoreAsWeighted() {
        WesResult result = calculator.calculate(midpoint());

        assertEquals(95.0, result.getScore(), 1e-9);
        assertEquals(WesBand.EXCELLENT, result.getBand());
        assertEquals("A+", result.getGrade());
        assertEquals(-7.5, result.getContributions().get(WesComponent.TIME), 1e-9);
        assertEquals(10.0, result.getContributions().get(WesComponent.VISUAL_INTEGRATION), 1e-9);
        for (double value : result.getNormalized().values()) {
            assertEquals(0.5, value, 1e-9);
        }
    }

    @Test
    void allZeroInputsStayInRange() {
        WesResult result = calculator.calculate(new WesInputs(0, 0, 0, 0, 0, 0, 0));

        assertEquals(100.0, result.getScore(), 1e-9);
        assertEquals(0.0, result.getNormalized().get(WesComponent.TIME));
        assertEquals(0.0, result.getNormalized().get(WesComponent.VISUAL_INTEGRATION));
    }

    @Test
    void allMaximalInputsStayInRange() {
        WesResult result = calculator.calculate(new WesInputs(1e6, 1e6, 1e6, 1e6, 1e6, 1e6, 1e6));

        assertTrue(result.getScore() >= 0 && result.getScore() <= 100);
        assertEquals(90.0, result.getScore(), 1e-9);
        result.getNormalized().values().forEach(v -> assertEquals(1.0, v, 1e-12));
    }

    @Test
    void heavyPenaltiesClampAtZero() {
        Map<WesComponent, Double> heavy = new EnumMap<>(WesComponent.class);
        for (WesComponent component : WesComponent.values()) {
            heavy.put(component, component.isPenalty() ? 50.0 : 0.0);
        }
        WesCalculator strict = new WesCalculator(new WesWeights(heavy), NormalizationBounds.defaults());

        WesResult result = strict.calculate(new WesInputs(300, 2.5, 5, 8, 0.3, 0, 0));

        assertEquals(0.0, result.getScore());
        assertEquals(WesBand.CRITICAL, result.getBand());
        assertEquals("F", result.getGrade());
    }

    @Test
    void scoreStrictlyDecreasesWithErrors() {
        double previous = Double.POSITIVE_INFINITY;
        for (int errors = 0; errors <= 5; errors++) {
            double score = calculator.calculate(new WesInputs(300, 1.75, errors, 4, 0.6, 0.5, 0.5)).getScore();
            assertTrue(score < previous, "errors=" + errors);
            previous = score;
        }
        assertEquals(97.5, calculator.calculate(new WesInputs(300, 1.75, 0, 4, 0.6, 0.5, 0.5)).getScore(), 1e-9);
        assertEquals(77.5, previous, 1e-9);
    }

    @Test
    void percentScoresAreRescaled() {
        WesResult fraction = calculator.calculate(new WesInputs(180, 1.75, 2.5, 4, 0.6, 0.8, 0.7));
        WesResult percent = calculator.calculate(new WesInputs(180, 1.75, 2.5, 4, 0.6, 80, 70));

        assertEquals(fraction.getScore(), percent.getScore(), 1e-9);
        assertEquals(0.8, percent.getNormalized().get(WesComponent.SIGNAGE), 1e-12);
    }

    @ParameterizedTest
    @CsvSource({
            "95, EXCELLENT, A+",
            "90, EXCELLENT, A+",
            "87, GOOD, A",
            "80, GOOD, A-",
            "75, GOOD, B+",
            "72, ACCEPTABLE, B",
            "66, ACCEPTABLE, B-",
            "60, ACCEPTABLE, C+",
            "57, POOR, C",
            "52, POOR, C-",
            "45, POOR, D",
            "44.9, CRITICAL, F",
            "0, CRITICAL, F"
    })
    void bandsAndGrades(double score, WesBand band, String grade) {
        assertEquals(band, WesBand.of(score));
        assertEquals(grade, WesBand.letterGrade(score));
    }

    @Test
    void prioritiesRankWeakestWeightedComponentsFirst() {
        WesResult result = calculator.calculate(new WesInputs(300, 1.0, 0, 0, 0.3, 0.95, 0.5));
        List<ImprovementPriority> priorities = result.getPriorities();

        assertEquals(3, priorities.size());
        ImprovementPriority first = priorities.get(0);
        assertEquals(WesComponent.VISUAL_INTEGRATION, first.component());
        assertEquals(18.0, first.impact(), 1e-9);
        assertEquals(ImprovementPriority.Level.HIGH, first.level());
        assertEquals(WesComponent.TIME, priorities.get(1).component());
        assertEquals(13.5, priorities.get(1).impact(), 1e-9);
        ImprovementPriority last = priorities.get(2);
        assertEquals(WesComponent.ACCESSIBILITY, last.component());
        assertEquals(4.5, last.impact(), 1e-9);
        assertEquals(ImprovementPriority.Level.MEDIUM, last.level());
    }

    @Test
    void priorityLevels() {
        assertEquals(ImprovementPriority.Level.HIGH, ImprovementPriority.levelFor(5.01));
        assertEquals(ImprovementPriority.Level.MEDIUM, ImprovementPriority.levelFor(5.0));
        assertEquals(ImprovementPriority.Level.LOW, ImprovementPriority.levelFor(2.0));
    }

    @Test
    void compareReportsSpread() {
        Map<String, WesResult> designs = new LinkedHashMap<>();
        designs.put("baseline", calculator.calculate(new WesInputs(300, 1.75, 0, 4, 0.6, 0.5, 0.5)));
        designs.put("more-signs", calculator.calculate(midpoint()));
        designs.put("cluttered", calculator.calculate(new WesInputs(300, 1.75, 5, 4, 0.6, 0.5, 0.5)));

        WesComparison comparison = WesCalculator.compare(designs);

        assertEquals("baseline", comparison.getBest());
        assertEquals("cluttered", comparison.getWorst());
        assertEquals(97.5, comparison.getBestScore(), 1e-9);
        assertEquals(20.0, comparison.getRange(), 1e-9);
        assertEquals((97.5 + 95.0 + 77.5) / 3, comparison.getMeanScore(), 1e-9);
        assertEquals(3, comparison.getScores().size());
    }

    @Test
    void compareRejectsEmptyInput() {
        assertThrows(IllegalArgumentException.class, () -> WesCalculator.compare(Map.of()));
    }

    @Test
    void rejectsNonFiniteInputs() {
        assertThrows(IllegalArgumentException.class,
                () -> new WesInputs(Double.NaN, 1, 0, 0, 0.5, 0.5, 0.5));
    }

    @Test
    void benchmarksFlagEachComponentAndCountCompliance() {
        BenchmarkComparison benchmarks = calculator.calculate(midpoint()).getBenchmarks();

        assertEquals(7, benchmarks.getTotal());
        assertEquals(6, benchmarks.getMet());
        assertEquals(600.0 / 7, benchmarks.getCompliancePercentage(), 1e-9);
        assertFalse(benchmarks.get(WesComponent.DETOUR).meetsStandard());
        assertTrue(benchmarks.get(WesComponent.TIME).meetsStandard());
        assertEquals(60.0, benchmarks.get(WesComponent.TIME).percentageOfBenchmark(), 1e-9);
        // Threshold itself meets the standard for bonuses
        assertTrue(benchmarks.get(WesComponent.ACCESSIBILITY).meetsStandard());
    }

    @Test
    void percentageSignageIsComparedAsFraction() {
        BenchmarkComparison passing = calculator.calculate(new WesInputs(60, 1, 0, 0, 0.9, 45, 1)).getBenchmarks();
        BenchmarkComparison failing = calculator.calculate(new WesInputs(60, 1, 0, 0, 0.9, 30, 1)).getBenchmarks();

        assertTrue(passing.get(WesComponent.SIGNAGE).meetsStandard());
        assertEquals(100.0, passing.getCompliancePercentage(), 1e-9);
        assertFalse(failing.get(WesComponent.SIGNAGE).meetsStandard());
        assertEquals(6, failing.getMet());
    }

    @Test
    void customBenchmarksReplaceDefaults() {
        Map<WesComponent, Double> strict = new EnumMap<>(WesComponent.class);
        for (WesComponent component : WesComponent.values()) {
            strict.put(component, WesBenchmarks.defaults().get(component));
        }
        strict.put(WesComponent.TIME, 100.0);
        WesCalculator custom = new WesCalculator(WesWeights.defaults(), NormalizationBounds.defaults(),
                new WesBenchmarks(strict));

        BenchmarkCheck time = custom.calculate(midpoint()).getBenchmarks().get(WesComponent.TIME);

        assertFalse(time.meetsStandard());
        assertEquals(180.0, time.percentageOfBenchmark(), 1e-9);
    }

    @Test
    void benchmarksRejectMissingComponent() {
        assertThrows(IllegalArgumentException.class,
                () -> new WesBenchmarks(Map.of(WesComponent.TIME, 300.0)));
    }
}
