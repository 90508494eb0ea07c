package com.raditha.antmetrics.metrics;

import com.raditha.antmetrics.model.AntPol;
import com.raditha.antmetrics.model.Baseline;
import com.raditha.antmetrics.model.RedundantGroup;
import com.raditha.antmetrics.model.VisibilityPol;
import com.raditha.antmetrics.source.ArrayLayout;
import com.raditha.antmetrics.source.VisibilitySource;
import com.raditha.antmetrics.stats.ModifiedZScore;
import com.raditha.antmetrics.stats.RobustStatistics;
import org.apache.commons.math3.complex.Complex;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Extent to which baselines involving an antenna fail to correlate with the
 * baselines they are nominally redundant with.
 * <p>
 * For every pair of baselines in a redundant group the normalized correlation
 * {@code median_f |sum_t V0 conj(V1)| / sqrt(P0 P1)} is credited to the antenna
 * polarizations involved, where P is the auto-power
 * {@code median_f sum_t |V|^2}. The metric is the mean credited correlation.
 * Very small values are probably bad antennas.
 */
public class RedundantCorrelationMetric {

    private record AutoPowerKey(Baseline baseline, VisibilityPol pol) {
    }

    private final VisibilitySource source;
    private final ArrayLayout layout;
    private final Map<AutoPowerKey, Double> autoPowers = new ConcurrentHashMap<>();

    public RedundantCorrelationMetric(VisibilitySource source, ArrayLayout layout) {
        this.source = source;
        this.layout = layout;
    }

    /**
     * Mean redundant correlation per antenna polarization.
     * <p>
     * A baseline pair touching any excluded key is skipped entirely. Keys that
     * receive no correlations keep the value 0.0.
     *
     * @param pols     visibility polarizations to pair up
     * @param excluded antenna polarizations to skip; not modified
     * @param mode     same-polarization or singly-flipped pairs
     */
    public Map<AntPol, Double> raw(Collection<VisibilityPol> pols, Set<AntPol> excluded, CorrelationMode mode) {
        Set<AntPol> xants = Set.copyOf(excluded);
        Map<AntPol, Double> correlations = new LinkedHashMap<>();
        Map<AntPol, Integer> counts = new LinkedHashMap<>();
        for (int ant : layout.antennas()) {
            for (String feed : layout.feeds()) {
                AntPol key = new AntPol(ant, feed);
                if (!xants.contains(key)) {
                    correlations.put(key, 0.0);
                    counts.put(key, 0);
                }
            }
        }

        for (VisibilityPol pol0 : pols) {
            for (VisibilityPol pol1 : pols) {
                boolean crossedI = !pol0.firstFeed().equals(pol1.firstFeed());
                boolean crossedJ = !pol0.secondFeed().equals(pol1.secondFeed());
                boolean include = switch (mode) {
                    case SAME_POL -> pol0.equals(pol1);
                    case CROSS_POL -> crossedI ^ crossedJ;
                };
                if (include) {
                    for (RedundantGroup group : layout.reds()) {
                        correlateGroup(group, pol0, pol1, mode, crossedI, xants, correlations, counts);
                    }
                }
            }
        }

        for (Map.Entry<AntPol, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > 0) {
                correlations.compute(entry.getKey(), (key, sum) -> sum / entry.getValue());
            }
        }
        return correlations;
    }

    /**
     * Modified z-scores of {@link #raw(Collection, Set, CorrelationMode)}.
     */
    public Map<AntPol, Double> zScores(Collection<VisibilityPol> pols, Set<AntPol> excluded, CorrelationMode mode) {
        return ModifiedZScore.standardize(raw(pols, excluded, mode));
    }

    private void correlateGroup(RedundantGroup group, VisibilityPol pol0, VisibilityPol pol1,
                                CorrelationMode mode, boolean crossedI, Set<AntPol> xants,
                                Map<AntPol, Double> correlations, Map<AntPol, Integer> counts) {
        List<Baseline> baselines = group.baselines();
        for (int n = 0; n < baselines.size(); n++) {
            Baseline bl0 = baselines.get(n);
            for (int m = n + 1; m < baselines.size(); m++) {
                Baseline bl1 = baselines.get(m);
                List<AntPol> involved = List.of(
                        new AntPol(bl0.i(), pol0.firstFeed()),
                        new AntPol(bl0.j(), pol0.secondFeed()),
                        new AntPol(bl1.i(), pol1.firstFeed()),
                        new AntPol(bl1.j(), pol1.secondFeed()));
                if (involved.stream().anyMatch(xants::contains)) {
                    continue;
                }

                double corr = correlation(source.data(bl0, pol0), source.data(bl1, pol1))
                        / Math.sqrt(autoPower(bl0, pol0) * autoPower(bl1, pol1));

                if (mode == CorrelationMode.CROSS_POL) {
                    // only the flipped side is credited
                    involved = crossedI
                            ? List.of(involved.get(0), involved.get(2))
                            : List.of(involved.get(1), involved.get(3));
                }
                for (AntPol key : involved) {
                    if (!counts.containsKey(key)) {
                        throw new IllegalArgumentException("Redundant baseline antenna " + key
                                + " is not part of the array layout");
                    }
                    correlations.merge(key, corr, Double::sum);
                    counts.merge(key, 1, Integer::sum);
                }
            }
        }
    }

    /**
     * Median over frequency of the summed squared amplitude over time.
     * Computed once per baseline and polarization.
     */
    double autoPower(Baseline baseline, VisibilityPol pol) {
        return autoPowers.computeIfAbsent(new AutoPowerKey(baseline, pol), key -> {
            Complex[][] data = source.data(baseline, pol);
            double[] power = new double[data[0].length];
            for (Complex[] row : data) {
                for (int f = 0; f < row.length; f++) {
                    double re = row[f].getReal();
                    double im = row[f].getImaginary();
                    power[f] += re * re + im * im;
                }
            }
            return RobustStatistics.median(power);
        });
    }

    /**
     * Median over frequency of |sum over time of v0 * conj(v1)|.
     */
    static double correlation(Complex[][] data0, Complex[][] data1) {
        int nFreqs = data0[0].length;
        double[] magnitudes = new double[nFreqs];
        for (int f = 0; f < nFreqs; f++) {
            Complex sum = Complex.ZERO;
            for (int t = 0; t < data0.length; t++) {
                sum = sum.add(data0[t][f].multiply(data1[t][f].conjugate()));
            }
            magnitudes[f] = sum.abs();
        }
        return RobustStatistics.median(magnitudes);
    }
}
