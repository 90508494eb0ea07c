package com.raditha.antmetrics.metrics;

import com.raditha.antmetrics.model.AntPol;
import com.raditha.antmetrics.model.MetricSet;

import java.util.Set;

/**
 * Computes the raw values of all four antenna metrics for one exclusion set.
 */
@FunctionalInterface
public interface AntennaMetricCalculator {

    /**
     * @param excluded antenna polarizations removed so far; must not be modified
     * @return raw metrics, each keyed by the antenna polarizations it covers
     */
    MetricSet compute(Set<AntPol> excluded);
}
