package com.raditha.antmetrics.metrics;

import com.raditha.antmetrics.model.AntPol;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Averages the absolute values of two standardized metrics.
 */
public final class MetricCombiner {

    private MetricCombiner() {
    }

    /**
     * {@code |a/2| + |b/2|} for every key.
     *
     * @throws IllegalArgumentException if the two metrics have different keys,
     *                                  i.e. were computed against different exclusion sets
     */
    public static Map<AntPol, Double> combine(Map<AntPol, Double> a, Map<AntPol, Double> b) {
        if (!a.keySet().equals(b.keySet())) {
            throw new IllegalArgumentException(
                    "Metrics being averaged have different antenna polarization keys: " + a.keySet() + " vs " + b.keySet());
        }
        Map<AntPol, Double> combined = new LinkedHashMap<>();
        for (Map.Entry<AntPol, Double> entry : a.entrySet()) {
            combined.put(entry.getKey(), Math.abs(entry.getValue() / 2) + Math.abs(b.get(entry.getKey()) / 2));
        }
        return combined;
    }
}
