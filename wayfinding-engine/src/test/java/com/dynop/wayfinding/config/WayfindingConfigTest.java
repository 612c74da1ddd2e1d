package com.dynop.wayfinding.config;

import com.dynop.wayfinding.AnalysisException;
import com.dynop.wayfinding.scoring.WesComponent;
import com.dynop.wayfinding.simulation.AgentType;
import com.graphhopper.util.PMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WayfindingConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsMatchDocumentedValues() {
        WayfindingConfig config = WayfindingConfig.defaults();

        assertEquals(Runtime.getRuntime().availableProcessors(), config.getPoolSize());
        assertEquals(90, config.getSyntax().getBottleneckPercentile());
        assertEquals(1.0, config.getVisibility().getGridSpacing());
        assertEquals(72, config.getVisibility().getRayCount());
        assertEquals(42L, config.getSimulation().getSeed());
        assertEquals(50, config.getSimulation().getMinSteps());
        assertEquals(0.35, config.getSimulation().profile(AgentType.ELDERLY).baseErrorRate());
        assertEquals(20.0, config.getScoring().getWeights().get(WesComponent.ERRORS));
        assertEquals(60.0, config.getScoring().getBounds().get(WesComponent.TIME).min());
        assertEquals(1.5, config.getSimulation().getVisibilityFactor());
        assertEquals(300.0, config.getScoring().getBenchmarks().get(WesComponent.TIME));
    }

    @Test
    void bundledResourceMatchesDefaults() throws IOException {
        WayfindingConfig bundled = WayfindingConfig.load();
        WayfindingConfig defaults = WayfindingConfig.defaults();

        assertEquals(defaults.getPoolSize(), bundled.getPoolSize());
        assertEquals(defaults.getSimulation().getSeed(), bundled.getSimulation().getSeed());
        assertEquals(defaults.getSimulation().getProfiles(), bundled.getSimulation().getProfiles());
        assertEquals(defaults.getVisibility().getAreaNormalization(), bundled.getVisibility().getAreaNormalization());
        assertEquals(defaults.getSimulation().getVisibilityFactor(), bundled.getSimulation().getVisibilityFactor());
        for (WesComponent component : WesComponent.values()) {
            assertEquals(defaults.getScoring().getWeights().get(component),
                    bundled.getScoring().getWeights().get(component), component.getKey());
            assertEquals(defaults.getScoring().getBounds().get(component),
                    bundled.getScoring().getBounds().get(component), component.getKey());
            assertEquals(defaults.getScoring().getBenchmarks().get(component),
                    bundled.getScoring().getBenchmarks().get(component), component.getKey());
        }
    }

    @Test
    void nestedYamlIsFlattenedIntoDottedKeys() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/config/small-pool.yml")) {
            PMap properties = WayfindingConfig.readYaml(in);

            assertEquals(2, properties.getInt(WayfindingConfig.POOL_SIZE, -1));
            assertEquals(0.5, properties.getDouble(VisibilityConfig.GRID_SPACING, -1), 1e-12);
            assertTrue(properties.getBool(SimulationConfig.RETAIN_TRACES, false));
        }
    }

    @Test
    void loadsOverridesFromFile() throws IOException {
        Path file = tempDir.resolve("wayfinding.yml");
        Files.writeString(file, """
                runtime:
                  executor:
                    pool_size: 3
                simulation:
                  seed: 7
                  agent:
                    elderly:
                      speed: 0.7
                scoring:
                  weight:
                    errors: 25
                vga.grid_spacing: 0.25
                """);

        WayfindingConfig config = WayfindingConfig.load(file);

        assertEquals(3, config.getPoolSize());
        assertEquals(7L, config.getSimulation().getSeed());
        assertEquals(0.7, config.getSimulation().profile(AgentType.ELDERLY).walkingSpeed());
        assertEquals(0.35, config.getSimulation().profile(AgentType.ELDERLY).baseErrorRate());
        assertEquals(25.0, config.getScoring().getWeights().get(WesComponent.ERRORS));
        assertEquals(0.25, config.getVisibility().getGridSpacing());
    }

    @Test
    void emptyFileYieldsDefaults() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        assertEquals(42L, WayfindingConfig.load(file).getSimulation().getSeed());
    }

    @Test
    void nonPositivePoolSizeFallsBackToProcessors() {
        WayfindingConfig config = new WayfindingConfig(new PMap().putObject(WayfindingConfig.POOL_SIZE, -2));

        assertEquals(Runtime.getRuntime().availableProcessors(), config.getPoolSize());
    }

    @Test
    void invalidPercentileFromResourceIsRejected() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/config/invalid-percentile.yml")) {
            PMap properties = WayfindingConfig.readYaml(in);

            AnalysisException ex = assertThrows(AnalysisException.class, () -> new WayfindingConfig(properties));
            assertEquals(AnalysisException.INVALID_CONFIGURATION, ex.getErrorCode());
            assertEquals(VisibilityConfig.BLIND_SPOT_PERCENTILE, ex.getEntityId());
        }
    }

    @ParameterizedTest
    @CsvSource({
            "vga.grid_spacing, 0",
            "vga.angular_step, 180",
            "vga.coarsening_factor, 1.0",
            "vga.max_samples, -5",
            "simulation.error_cap, 1.5",
            "simulation.agent.familiar.speed, 0",
            "simulation.agent.elderly.error_rate, -0.1",
            "simulation.retain_traces, maybe",
            "syntax.tie_epsilon, abc",
            "scoring.weight.signage, -1",
            "scoring.benchmark.time, -300"
    })
    void rejectsOutOfRangeValues(String key, String value) {
        AnalysisException ex = assertThrows(AnalysisException.class,
                () -> new WayfindingConfig(new PMap().putObject(key, value)));

        assertEquals(AnalysisException.INVALID_CONFIGURATION, ex.getErrorCode());
        assertEquals(key, ex.getEntityId());
    }

    @Test
    void rejectsInvertedBounds() {
        PMap properties = new PMap()
                .putObject("scoring.bounds.time.min", 300)
                .putObject("scoring.bounds.time.max", 60);

        AnalysisException ex = assertThrows(AnalysisException.class, () -> new WayfindingConfig(properties));
        assertEquals("scoring.bounds.time.min", ex.getEntityId());
    }

    @Test
    void rejectsListValues() throws IOException {
        Path file = tempDir.resolve("list.yml");
        Files.writeString(file, "vga:\n  grid_spacing: [1, 2]\n");

        AnalysisException ex = assertThrows(AnalysisException.class, () -> WayfindingConfig.load(file));
        assertEquals("vga.grid_spacing", ex.getEntityId());
    }
}
