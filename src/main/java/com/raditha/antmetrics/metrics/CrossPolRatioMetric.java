package com.raditha.antmetrics.metrics;

import com.raditha.antmetrics.model.AntPol;
import com.raditha.antmetrics.source.ArrayLayout;
import com.raditha.antmetrics.stats.ModifiedZScore;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base class for metrics that flag cross-polarized antennas through the ratio
 * of a cross-polarization metric to a same-polarization metric.
 * <p>
 * Both underlying metrics are computed with every polarization of a partially
 * excluded antenna excluded as well. The ratio of the two metrics, each summed
 * over both feed polarizations, is stored under both polarization keys of the
 * antenna. Very large values are probably cross-polarized antennas.
 */
public abstract class CrossPolRatioMetric {

    protected final ArrayLayout layout;

    protected CrossPolRatioMetric(ArrayLayout layout) {
        this.layout = layout;
    }

    /**
     * Raw cross / same ratio for every fully included antenna.
     *
     * @param excluded antenna polarizations to skip; not modified
     */
    public Map<AntPol, Double> raw(Set<AntPol> excluded) {
        Set<AntPol> fullExcluded = expandPartialExclusions(layout.feeds(), excluded);
        Map<AntPol, Double> cross = crossMetric(fullExcluded);
        Map<AntPol, Double> same = sameMetric(fullExcluded);
        return sumRatio(layout.antennas(), layout.feeds(), cross, same, fullExcluded);
    }

    public Map<AntPol, Double> zScores(Set<AntPol> excluded) {
        return ModifiedZScore.standardize(raw(excluded));
    }

    /**
     * Metric restricted to cross-polarization combinations.
     */
    protected abstract Map<AntPol, Double> crossMetric(Set<AntPol> fullExcluded);

    /**
     * Metric restricted to same-polarization combinations.
     */
    protected abstract Map<AntPol, Double> sameMetric(Set<AntPol> fullExcluded);

    /**
     * Add every feed polarization of each excluded antenna to the exclusion set.
     * An antenna excluded in one polarization cannot yield a meaningful
     * cross-pol ratio.
     */
    public static Set<AntPol> expandPartialExclusions(List<String> feeds, Collection<AntPol> excluded) {
        Set<AntPol> expanded = new LinkedHashSet<>(excluded);
        for (AntPol key : excluded) {
            for (String feed : feeds) {
                expanded.add(new AntPol(key.antenna(), feed));
            }
        }
        return expanded;
    }

    /**
     * Ratio of two antenna metrics, each summed over the feed polarizations,
     * stored with the same value under every polarization of the antenna.
     * Antennas whose first feed polarization is excluded are skipped; a zero
     * same-pol sum is not guarded.
     */
    public static Map<AntPol, Double> sumRatio(List<Integer> antennas, List<String> feeds,
                                               Map<AntPol, Double> crossMetrics,
                                               Map<AntPol, Double> sameMetrics,
                                               Set<AntPol> excluded) {
        Map<AntPol, Double> ratios = new LinkedHashMap<>();
        for (int ant : antennas) {
            if (excluded.contains(new AntPol(ant, feeds.get(0)))) {
                continue;
            }
            double crossSum = 0.0;
            double sameSum = 0.0;
            for (String feed : feeds) {
                crossSum += crossMetrics.get(new AntPol(ant, feed));
                sameSum += sameMetrics.get(new AntPol(ant, feed));
            }
            for (String feed : feeds) {
                ratios.put(new AntPol(ant, feed), crossSum / sameSum);
            }
        }
        return ratios;
    }
}
