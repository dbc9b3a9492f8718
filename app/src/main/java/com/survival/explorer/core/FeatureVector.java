package com.survival.explorer.core;

import java.util.*;

/**
 * Feature values for one passenger profile (sex, pclass, age, fare).
 * Two vectors are equal when they hold the same features with the same values.
 */
public final class FeatureVector {

    private final Map<String, Double> values;

    private FeatureVector(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    public static FeatureVector of(Map<String, ? extends Number> values) {
        Map<String, Double> copy = new TreeMap<>();
        values.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v.doubleValue());
            }
        });
        return new FeatureVector(copy);
    }

    public static FeatureVector empty() {
        return new FeatureVector(Map.of());
    }

    /**
     * Parse "sex=0,pclass=1,age=30" style input.
     *
     * @throws IllegalArgumentException on a malformed pair or a non-numeric value
     */
    public static FeatureVector parse(String text) {
        Map<String, Double> parsed = new TreeMap<>();
        if (text == null || text.isBlank()) {
            return new FeatureVector(parsed);
        }
        for (String pair : text.split(",")) {
            String trimmed = pair.trim();
            if (trimmed.isEmpty())
                continue;
            int eq = trimmed.indexOf('=');
            if (eq <= 0 || eq == trimmed.length() - 1) {
                throw new IllegalArgumentException("Expected feature=value but got '" + trimmed + "'");
            }
            String name = trimmed.substring(0, eq).trim();
            String raw = trimmed.substring(eq + 1).trim();
            try {
                parsed.put(name, Double.parseDouble(raw));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Feature '" + name + "' has non-numeric value '" + raw + "'", e);
            }
        }
        return new FeatureVector(parsed);
    }

    public OptionalDouble get(String feature) {
        Double value = values.get(feature);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean has(String feature) {
        return values.containsKey(feature);
    }

    /**
     * Copy with one feature set or replaced.
     */
    public FeatureVector with(String feature, double value) {
        Map<String, Double> copy = new TreeMap<>(values);
        copy.put(feature, value);
        return new FeatureVector(copy);
    }

    public Map<String, Double> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector other))
            return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
