package com.raditha.antmetrics.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One value per antenna polarization for each of the four antenna metrics.
 * Used both for raw metrics and for their modified z-scores.
 * Iteration order of every per-metric map is the order the values were computed in.
 */
public final class MetricSet {

    private final Map<AntennaMetric, Map<AntPol, Double>> values;

    private MetricSet(Map<AntennaMetric, Map<AntPol, Double>> values) {
        this.values = values;
    }

    public static MetricSet of(Map<AntennaMetric, Map<AntPol, Double>> values) {
        EnumMap<AntennaMetric, Map<AntPol, Double>> copy = new EnumMap<>(AntennaMetric.class);
        for (AntennaMetric metric : AntennaMetric.values()) {
            Map<AntPol, Double> metricValues = values.get(metric);
            copy.put(metric, metricValues == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(metricValues)));
        }
        return new MetricSet(Collections.unmodifiableMap(copy));
    }

    public static MetricSet empty() {
        return of(Map.of());
    }

    public Map<AntPol, Double> get(AntennaMetric metric) {
        return values.get(metric);
    }

    public Map<AntennaMetric, Map<AntPol, Double>> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof MetricSet other && values.equals(other.values);
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
