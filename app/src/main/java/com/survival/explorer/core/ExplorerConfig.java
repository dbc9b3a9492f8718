package com.survival.explorer.core;

import com.survival.explorer.trace.HighlightMode;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration for the path explorer.
 * Loaded from explorer.yaml in the given directory or uses built-in defaults.
 */
public class ExplorerConfig {

    // Palette defaults
    private String activeColor = "#ffffff";
    private String diedColor = "#F09A48";
    private String survivedColor = "#B8F06E";
    private String tutorialColor = "#ffd700";
    private String hoverColor = "#ffd700";
    private String comparisonAColor = "#B8F06E";
    private String comparisonBColor = "#F09A48";
    private String comparisonSharedColor = "#ffd700";
    private String defaultStrokeColor = "#666";

    // Opacity defaults
    private double inactiveOpacity = 0.4;
    private double hoverOpacity = 0.85;
    private double activeOpacity = 1.0;

    // Edge width range, scaled by samples
    private double minStrokeWidth = 2;
    private double maxStrokeWidth = 20;

    private HighlightMode defaultHighlightMode = HighlightMode.FULL;
    private long revealStepMillis = 500;

    /**
     * Load configuration from YAML file or return defaults.
     */
    public static ExplorerConfig load(Path projectRoot) {
        ExplorerConfig config = new ExplorerConfig();
        Path configFile = projectRoot.resolve("explorer.yaml");

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Map<String, Object> data = yaml.load(is);
                if (data != null) {
                    config.parseYaml(data);
                }
                System.out.println("Loaded configuration from: " + configFile);
            } catch (IOException e) {
                System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
            }
        }
        return config;
    }

    public static ExplorerConfig defaults() {
        return new ExplorerConfig();
    }

    @SuppressWarnings("unchecked")
    private void parseYaml(Map<String, Object> data) {
        if (data.get("palette") instanceof Map) {
            Map<String, Object> palette = (Map<String, Object>) data.get("palette");
            activeColor = getString(palette, "active", activeColor);
            diedColor = getString(palette, "died", diedColor);
            survivedColor = getString(palette, "survived", survivedColor);
            tutorialColor = getString(palette, "tutorial", tutorialColor);
            hoverColor = getString(palette, "hover", hoverColor);
            comparisonAColor = getString(palette, "comparison_a", comparisonAColor);
            comparisonBColor = getString(palette, "comparison_b", comparisonBColor);
            comparisonSharedColor = getString(palette, "comparison_shared", comparisonSharedColor);
            defaultStrokeColor = getString(palette, "default_stroke", defaultStrokeColor);
        }

        if (data.get("opacity") instanceof Map) {
            Map<String, Object> opacity = (Map<String, Object>) data.get("opacity");
            inactiveOpacity = getDouble(opacity, "inactive", inactiveOpacity);
            hoverOpacity = getDouble(opacity, "hover", hoverOpacity);
            activeOpacity = getDouble(opacity, "active", activeOpacity);
        }

        if (data.get("stroke") instanceof Map) {
            Map<String, Object> stroke = (Map<String, Object>) data.get("stroke");
            minStrokeWidth = getDouble(stroke, "min_width", minStrokeWidth);
            maxStrokeWidth = getDouble(stroke, "max_width", maxStrokeWidth);
        }

        if (data.get("highlight") instanceof Map) {
            Map<String, Object> highlight = (Map<String, Object>) data.get("highlight");
            Object mode = highlight.get("default_mode");
            if (mode != null) {
                try {
                    defaultHighlightMode = HighlightMode.parse(String.valueOf(mode));
                } catch (IllegalArgumentException e) {
                    System.err.println("Warning: " + e.getMessage() + ", keeping " + defaultHighlightMode);
                }
            }
        }

        if (data.get("reveal") instanceof Map) {
            Map<String, Object> reveal = (Map<String, Object>) data.get("reveal");
            revealStepMillis = getInt(reveal, "step_millis", (int) revealStepMillis);
        }
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).doubleValue();
        return defaultVal;
    }

    private String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        if (val instanceof String && !((String) val).isBlank())
            return (String) val;
        return defaultVal;
    }

    // === Getters ===

    // Palette
    public String getActiveColor() {
        return activeColor;
    }

    public String getDiedColor() {
        return diedColor;
    }

    public String getSurvivedColor() {
        return survivedColor;
    }

    public String getTutorialColor() {
        return tutorialColor;
    }

    public String getHoverColor() {
        return hoverColor;
    }

    public String getComparisonAColor() {
        return comparisonAColor;
    }

    public String getComparisonBColor() {
        return comparisonBColor;
    }

    public String getComparisonSharedColor() {
        return comparisonSharedColor;
    }

    public String getDefaultStrokeColor() {
        return defaultStrokeColor;
    }

    // Opacity
    public double getInactiveOpacity() {
        return inactiveOpacity;
    }

    public double getHoverOpacity() {
        return hoverOpacity;
    }

    public double getActiveOpacity() {
        return activeOpacity;
    }

    // Stroke
    public double getMinStrokeWidth() {
        return minStrokeWidth;
    }

    public double getMaxStrokeWidth() {
        return maxStrokeWidth;
    }

    public HighlightMode getDefaultHighlightMode() {
        return defaultHighlightMode;
    }

    public long getRevealStepMillis() {
        return revealStepMillis;
    }
}
