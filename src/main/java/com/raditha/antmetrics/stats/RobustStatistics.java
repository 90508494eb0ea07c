package com.raditha.antmetrics.stats;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.ranking.NaNStrategy;

import java.util.Arrays;

/**
 * NaN-ignoring central tendency estimators.
 * An empty or all-NaN input yields NaN rather than an exception.
 */
public final class RobustStatistics {

    private RobustStatistics() {
    }

    public static double median(double[] values) {
        double[] filtered = withoutNaN(values);
        if (filtered.length == 0) {
            return Double.NaN;
        }
        return new Median().withNaNStrategy(NaNStrategy.REMOVED).evaluate(filtered);
    }

    /**
     * Median of |value - median(values)|.
     */
    public static double medianAbsoluteDeviation(double[] values, double median) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    public static double nanMean(double[] values) {
        double[] filtered = withoutNaN(values);
        if (filtered.length == 0) {
            return Double.NaN;
        }
        return new Mean().evaluate(filtered);
    }

    private static double[] withoutNaN(double[] values) {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
    }
}
