package com.forecastsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a {@link ForecastConfig} from YAML and rejects it before any model
 * is built if it cannot describe a single consistent run.
 *
 * <h3>Source</h3>
 * <p>
 * {@link #load()} reads the file named by {@value #ENV_CONFIG_PATH} when that
 * variable is set, otherwise the bundled {@value #DEFAULT_RESOURCE}.
 * {@link #fromFile(String)} and {@link #fromClasspath(String)} read one source
 * directly.
 * </p>
 *
 * <h3>Checks</h3>
 * <ol>
 * <li>Document rules on the raw YAML tree, where it is still visible which
 * keys were written: a quantity given both as a sample count and as a
 * duration, settings that only the other model type understands, and
 * smoothing constants for a Holt-Winters component that is switched
 * off.</li>
 * <li>Binding onto the configuration classes. Unknown keys and values of the
 * wrong type are malformed input.</li>
 * <li>{@link ForecastConfig#validate()} on the bound values.</li>
 * </ol>
 * <p>
 * Every problem found by a stage is reported in one exception.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastConfigLoader.class);

    /** Environment variable naming the configuration file. */
    public static final String ENV_CONFIG_PATH = "FORECAST_CONFIG_PATH";

    /** Classpath resource used when no file is named. */
    public static final String DEFAULT_RESOURCE = "forecast.yml";

    private static final Set<String> HOLT_WINTERS_KEYS = Set.of("trend", "seasonal", "alpha", "beta", "gamma");
    private static final Set<String> ARIMA_KEYS = Set.of("p", "d", "q", "seasonalP", "seasonalD", "seasonalQ");

    private ForecastConfigLoader() {
        // utility class, not instantiable
    }

    /**
     * @return the configuration named by {@value #ENV_CONFIG_PATH}, or the
     *         bundled default
     * @throws IllegalArgumentException if the variable names a missing file
     * @throws IllegalStateException    if the configuration is rejected
     */
    public static ForecastConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank()) {
            return fromFile(envPath);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file; must not be {@code null}
     * @return the checked configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read or the
     *                                  configuration is rejected
     */
    public static ForecastConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        String text;
        try {
            text = Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
        return parse(text, path);
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return the checked configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if the resource cannot be read or the
     *                                  configuration is rejected
     */
    public static ForecastConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        try (InputStream is = ForecastConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Classpath resource not found: " + resource);
            }
            return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8), "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    private static ForecastConfig parse(String text, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(ForecastConfig.class, options));

        Node root;
        try {
            root = yaml.compose(new StringReader(text));
        } catch (YAMLException e) {
            throw malformed(origin, e);
        }
        if (root == null) {
            throw new IllegalStateException("Forecast configuration " + origin + " is empty");
        }
        if (!(root instanceof MappingNode)) {
            throw new IllegalStateException(
                    "Malformed forecast configuration " + origin + ": the top level must be a mapping");
        }

        List<String> problems = checkDocument((MappingNode) root);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Forecast configuration " + origin + " is inconsistent:\n  - "
                    + String.join("\n  - ", problems));
        }

        ForecastConfig config;
        try {
            config = yaml.load(text);
        } catch (YAMLException e) {
            throw malformed(origin, e);
        }
        config.validate();

        LOG.info("Loaded {} configuration from {}: {}", config.getModel().getType(), origin, config);
        return config;
    }

    private static IllegalStateException malformed(String origin, YAMLException e) {
        return new IllegalStateException("Malformed forecast configuration " + origin + ": " + e.getMessage(), e);
    }

    // ---------------------------------------------------------------
    // Document rules
    // ---------------------------------------------------------------

    static List<String> checkDocument(MappingNode root) {
        List<String> problems = new ArrayList<>();
        Map<String, Node> top = entries(root);
        requireOneForm(top, "horizon", "horizonDuration", problems);

        Node modelNode = top.get("model");
        if (!(modelNode instanceof MappingNode)) {
            return problems;
        }
        Map<String, Node> model = entries((MappingNode) modelNode);
        requireOneForm(model, "seasonalPeriod", "seasonalPeriodDuration", problems);

        String type = scalar(model.get("type"));
        type = type != null ? type.trim().toLowerCase(Locale.ROOT) : null;
        if (ModelSettings.HOLT_WINTERS.equals(type)) {
            rejectForeignKeys(model, ARIMA_KEYS, type, problems);
            rejectUnusedSmoothing(model, "trend", "beta", problems);
            rejectUnusedSmoothing(model, "seasonal", "gamma", problems);
        } else if (ModelSettings.ARIMA.equals(type)) {
            rejectForeignKeys(model, HOLT_WINTERS_KEYS, type, problems);
        }
        return problems;
    }

    private static void requireOneForm(Map<String, Node> section, String samples, String duration,
                                       List<String> problems) {
        if (section.containsKey(samples) && section.containsKey(duration)) {
            problems.add("Set either '" + samples + "' (samples) or '" + duration + "' (ISO-8601), not both");
        }
    }

    private static void rejectForeignKeys(Map<String, Node> model, Set<String> foreign, String type,
                                          List<String> problems) {
        for (String key : model.keySet()) {
            if (foreign.contains(key)) {
                problems.add("Model setting '" + key + "' does not apply to model type '" + type + "'");
            }
        }
    }

    private static void rejectUnusedSmoothing(Map<String, Node> model, String component, String constant,
                                              List<String> problems) {
        if (model.containsKey(constant) && "none".equalsIgnoreCase(scalar(model.get(component)))) {
            problems.add("Smoothing constant '" + constant + "' is set but '" + component + "' is none");
        }
    }

    private static Map<String, Node> entries(MappingNode node) {
        Map<String, Node> entries = new LinkedHashMap<>();
        for (NodeTuple tuple : node.getValue()) {
            String key = scalar(tuple.getKeyNode());
            if (key != null) {
                entries.put(key, tuple.getValueNode());
            }
        }
        return entries;
    }

    private static String scalar(Node node) {
        return node instanceof ScalarNode ? ((ScalarNode) node).getValue() : null;
    }
}
