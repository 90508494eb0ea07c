package com.raditha.antmetrics.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads flagging configuration from the {@code ant_metrics} section of a YAML
 * file, applying explicit overrides where provided.
 * <p>
 * Configuration priority: overrides > YAML > defaults
 *
 * <pre>
 * ant_metrics:
 *   preset: strict
 *   dead_cut: 5.0
 *   cross_cut: 5.0
 *   parallel_metrics: false
 * </pre>
 */
public class AntennaMetricsSettings {

    private static final String CONFIG_KEY = "ant_metrics";

    private AntennaMetricsSettings() {
    }

    /**
     * Load configuration from a YAML file.
     *
     * @param configFile       YAML file, may be null or missing (defaults are used)
     * @param deadCutOverride  dead cut override (null = use YAML/default)
     * @param crossCutOverride cross cut override (null = use YAML/default)
     * @param presetOverride   preset name override (null = use YAML/default)
     * @return Complete flagging configuration
     * @throws IOException if the file exists but cannot be read
     */
    public static FlaggingConfig loadConfig(Path configFile, Double deadCutOverride,
                                            Double crossCutOverride, String presetOverride) throws IOException {
        Map<String, Object> config = readSection(configFile);

        // Determine preset (override > YAML > default)
        String preset = presetOverride != null ? presetOverride : getString(config, "preset", "default");
        FlaggingConfig base = FlaggingConfig.preset(preset);

        double deadCut = deadCutOverride != null ? deadCutOverride : getDouble(config, "dead_cut", base.deadCut());
        double crossCut = crossCutOverride != null ? crossCutOverride : getDouble(config, "cross_cut", base.crossCut());
        boolean parallel = getBoolean(config, "parallel_metrics", base.parallelMetrics());

        return new FlaggingConfig(deadCut, crossCut, parallel);
    }

    /**
     * Load configuration from a YAML file without overrides.
     */
    public static FlaggingConfig loadConfig(Path configFile) throws IOException {
        return loadConfig(configFile, null, null, null);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readSection(Path configFile) throws IOException {
        if (configFile == null || !Files.exists(configFile)) {
            return Map.of();
        }
        try (InputStream in = Files.newInputStream(configFile)) {
            Object root = new Yaml().load(in);
            if (root instanceof Map<?, ?> rootMap && rootMap.get(CONFIG_KEY) instanceof Map<?, ?> section) {
                return (Map<String, Object>) section;
            }
            return Map.of();
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value != null) {
            throw new IllegalArgumentException(CONFIG_KEY + "." + key + " must be a number, got: " + value);
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new IllegalArgumentException(CONFIG_KEY + "." + key + " must be true or false, got: " + value);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
