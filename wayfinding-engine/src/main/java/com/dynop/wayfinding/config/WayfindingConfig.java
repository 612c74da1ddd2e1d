package com.dynop.wayfinding.config;

import com.dynop.wayfinding.AnalysisException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.graphhopper.util.PMap;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Typed view of the engine settings.
 *
 * <p>Settings are flat dotted keys (e.g. {@code vga.grid_spacing}) carried in a GraphHopper {@link PMap}.
 * YAML files are flattened into that form, so
 * <pre>
 * vga:
 *   grid_spacing: 0.5
 * </pre>
 * and {@code vga.grid_spacing: 0.5} are equivalent. Every key has a default in code; unknown keys are
 * ignored, invalid values raise {@link AnalysisException} with {@code INVALID_CONFIGURATION}.
 */
public final class WayfindingConfig {

    private static final Logger LOGGER = Logger.getLogger(WayfindingConfig.class.getName());

    public static final String POOL_SIZE = "runtime.executor.pool_size";
    public static final String DEFAULT_RESOURCE = "wayfinding.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final PMap properties;
    private final int poolSize;
    private final SyntaxConfig syntax;
    private final VisibilityConfig visibility;
    private final SimulationConfig simulation;
    private final ScoringConfig scoring;

    public WayfindingConfig(PMap properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
        PropertyReader reader = new PropertyReader(properties);
        this.poolSize = resolvePoolSize(reader);
        this.syntax = new SyntaxConfig(reader);
        this.visibility = new VisibilityConfig(reader);
        this.simulation = new SimulationConfig(reader);
        this.scoring = new ScoringConfig(reader);
    }

    /**
     * @return Configuration with every setting at its built-in default
     */
    public static WayfindingConfig defaults() {
        return new WayfindingConfig(new PMap());
    }

    /**
     * Load settings from the {@value #DEFAULT_RESOURCE} classpath resource, or the built-in defaults
     * when the resource is absent.
     *
     * @throws IOException if the resource exists but cannot be read
     */
    public static WayfindingConfig load() throws IOException {
        try (InputStream in = WayfindingConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                LOGGER.info(() -> DEFAULT_RESOURCE + " not found on classpath, using built-in defaults");
                return defaults();
            }
            return new WayfindingConfig(readYaml(in));
        }
    }

    /**
     * Load settings from a YAML file.
     *
     * @throws IOException if the file cannot be read or parsed
     */
    public static WayfindingConfig load(Path yamlFile) throws IOException {
        try (InputStream in = Files.newInputStream(yamlFile)) {
            PMap properties = readYaml(in);
            LOGGER.info(() -> String.format("Loaded %d settings from %s", properties.toMap().size(), yamlFile));
            return new WayfindingConfig(properties);
        }
    }

    /**
     * Parse YAML into flat dotted keys.
     *
     * @throws IOException if the stream is not valid YAML
     */
    public static PMap readYaml(InputStream in) throws IOException {
        JsonNode root = YAML.readTree(in);
        PMap properties = new PMap();
        if (root != null && !root.isNull() && !root.isMissingNode()) {
            if (!root.isObject()) {
                throw new AnalysisException(AnalysisException.INVALID_CONFIGURATION, null,
                        "Configuration root must be a mapping");
            }
            flatten("", root, properties);
        }
        return properties;
    }

    private static void flatten(String prefix, JsonNode node, PMap target) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                flatten(key, value, target);
            } else if (value.isNumber()) {
                target.putObject(key, value.numberValue());
            } else if (value.isBoolean()) {
                target.putObject(key, value.booleanValue());
            } else if (value.isTextual()) {
                target.putObject(key, value.textValue());
            } else if (!value.isNull()) {
                throw new AnalysisException(AnalysisException.INVALID_CONFIGURATION, key,
                        "Expected a scalar or mapping, was " + value.getNodeType());
            }
        }
    }

    private static int resolvePoolSize(PropertyReader reader) {
        int defaultSize = Runtime.getRuntime().availableProcessors();
        int poolSize = reader.getInt(POOL_SIZE, defaultSize);
        return poolSize > 0 ? poolSize : defaultSize;
    }

    /**
     * @return Raw settings as loaded
     */
    public PMap getProperties() {
        return properties;
    }

    /**
     * @return Worker pool size; non-positive values fall back to the number of available processors
     */
    public int getPoolSize() {
        return poolSize;
    }

    public SyntaxConfig getSyntax() {
        return syntax;
    }

    public VisibilityConfig getVisibility() {
        return visibility;
    }

    public SimulationConfig getSimulation() {
        return simulation;
    }

    public ScoringConfig getScoring() {
        return scoring;
    }
}
