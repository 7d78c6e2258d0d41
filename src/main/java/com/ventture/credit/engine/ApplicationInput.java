package com.ventture.credit.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw feature values of one credit application, keyed by feature name.
 * A {@code null} value is treated as absent.
 */
public final class ApplicationInput {

    private final Map<String, Double> values;

    public ApplicationInput(Map<String, ? extends Number> values) {
        Map<String, Double> copy = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((k, v) -> copy.put(k, v == null ? null : v.doubleValue()));
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public static ApplicationInput of(Map<String, ? extends Number> values) {
        return new ApplicationInput(values);
    }

    public Double get(String feature) {
        return values.get(feature);
    }

    public boolean has(String feature) {
        return values.get(feature) != null;
    }

    public Map<String, Double> values() {
        return values;
    }

    @Override
    public String toString() {
        return "ApplicationInput" + values;
    }
}
