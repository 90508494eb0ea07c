package com.raditha.antmetrics.metrics;

import com.raditha.antmetrics.model.AntPol;
import com.raditha.antmetrics.model.Baseline;
import com.raditha.antmetrics.model.VisibilityPol;
import com.raditha.antmetrics.source.ArrayLayout;
import com.raditha.antmetrics.source.VisibilitySource;
import com.raditha.antmetrics.stats.ModifiedZScore;
import com.raditha.antmetrics.stats.RobustStatistics;
import org.apache.commons.math3.complex.Complex;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * How far an antenna's average |Vij| deviates from the other antennas.
 * Very small or very large values are probably bad antennas.
 */
public class MeanAmplitudeMetric {

    private final VisibilitySource source;
    private final ArrayLayout layout;

    public MeanAmplitudeMetric(VisibilitySource source, ArrayLayout layout) {
        this.source = source;
        this.layout = layout;
    }

    /**
     * Mean visibility amplitude of every non-excluded antenna polarization over
     * all cross-correlation baselines in the given polarizations.
     *
     * @param pols     visibility polarizations to include
     * @param excluded antenna polarizations to skip; not modified
     * @return time and frequency averaged amplitude per antenna polarization
     * @throws IllegalStateException if a non-excluded key takes part in no baseline
     */
    public Map<AntPol, Double> raw(Collection<VisibilityPol> pols, Set<AntPol> excluded) {
        Set<AntPol> xants = Set.copyOf(excluded);
        Map<AntPol, double[][]> amplitudeSums = new LinkedHashMap<>();
        Map<AntPol, Integer> counts = new LinkedHashMap<>();
        for (int ant : layout.antennas()) {
            for (String feed : layout.feeds()) {
                AntPol key = new AntPol(ant, feed);
                if (!xants.contains(key)) {
                    amplitudeSums.put(key, null);
                    counts.put(key, 0);
                }
            }
        }

        for (Baseline baseline : layout.baselines()) {
            if (baseline.isAutoCorrelation()) {
                continue;
            }
            for (VisibilityPol pol : pols) {
                Complex[][] data = source.data(baseline, pol);
                accumulate(amplitudeSums, counts, xants, new AntPol(baseline.i(), pol.firstFeed()), data);
                accumulate(amplitudeSums, counts, xants, new AntPol(baseline.j(), pol.secondFeed()), data);
            }
        }

        Map<AntPol, Double> means = new LinkedHashMap<>();
        for (Map.Entry<AntPol, double[][]> entry : amplitudeSums.entrySet()) {
            int count = counts.get(entry.getKey());
            if (count == 0) {
                throw new IllegalStateException(
                        "Antenna polarization " + entry.getKey() + " takes part in no included baseline");
            }
            means.put(entry.getKey(), meanOfAverage(entry.getValue(), count));
        }
        return means;
    }

    /**
     * Modified z-scores of {@link #raw(Collection, Set)}.
     */
    public Map<AntPol, Double> zScores(Collection<VisibilityPol> pols, Set<AntPol> excluded) {
        return ModifiedZScore.standardize(raw(pols, excluded));
    }

    /**
     * Raw metric over every visibility polarization in the data.
     */
    public Map<AntPol, Double> raw(Set<AntPol> excluded) {
        return raw(layout.polarizations(), excluded);
    }

    private static void accumulate(Map<AntPol, double[][]> sums, Map<AntPol, Integer> counts,
                                   Set<AntPol> xants, AntPol key, Complex[][] data) {
        if (xants.contains(key)) {
            return;
        }
        if (!counts.containsKey(key)) {
            throw new IllegalArgumentException("Baseline antenna " + key + " is not part of the array layout");
        }
        double[][] sum = sums.get(key);
        if (sum == null) {
            sum = new double[data.length][data[0].length];
            sums.put(key, sum);
        }
        for (int t = 0; t < data.length; t++) {
            for (int f = 0; f < data[t].length; f++) {
                sum[t][f] += data[t][f].abs();
            }
        }
        counts.merge(key, 1, Integer::sum);
    }

    private static double meanOfAverage(double[][] sum, int count) {
        double[] averages = new double[sum.length * sum[0].length];
        int n = 0;
        for (double[] row : sum) {
            for (double value : row) {
                averages[n++] = value / count;
            }
        }
        return RobustStatistics.nanMean(averages);
    }
}
