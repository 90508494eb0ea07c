package com.raditha.antmetrics.stats;

import com.raditha.antmetrics.model.AntPol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Robust standardization of a per-antenna metric.
 * <p>
 * Keys are grouped by feed polarization; within each group the score is
 * {@code 0.6745 * (value - median) / MAD}. A zero MAD is not guarded: the
 * score becomes infinite (or NaN for values equal to the median) and callers
 * are expected to cope with that.
 */
public final class ModifiedZScore {

    /** Makes the MAD-based score comparable to a standard z-score for Gaussian data */
    public static final double GAUSSIAN_SCALE = 0.6745;

    private ModifiedZScore() {
    }

    /**
     * Standardize a raw metric per polarization.
     *
     * @param metric raw metric keyed by antenna polarization
     * @return modified z-scores with the same keys, in the same order
     */
    public static Map<AntPol, Double> standardize(Map<AntPol, Double> metric) {
        Map<String, List<AntPol>> byPol = new LinkedHashMap<>();
        for (AntPol key : metric.keySet()) {
            byPol.computeIfAbsent(key.pol(), p -> new ArrayList<>()).add(key);
        }

        Map<AntPol, Double> scores = new LinkedHashMap<>();
        for (AntPol key : metric.keySet()) {
            scores.put(key, Double.NaN);
        }
        for (List<AntPol> group : byPol.values()) {
            double[] values = group.stream().mapToDouble(metric::get).toArray();
            double median = RobustStatistics.median(values);
            double mad = RobustStatistics.medianAbsoluteDeviation(values, median);
            for (AntPol key : group) {
                scores.put(key, GAUSSIAN_SCALE * (metric.get(key) - median) / mad);
            }
        }
        return scores;
    }
}
