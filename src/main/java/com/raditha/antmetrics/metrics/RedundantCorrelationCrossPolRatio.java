package com.raditha.antmetrics.metrics;

import com.raditha.antmetrics.model.AntPol;
import com.raditha.antmetrics.source.ArrayLayout;

import java.util.Map;
import java.util.Set;

/**
 * Ratio of the redundant correlation with singly polarization-flipped
 * visibilities to the ordinary same-pol redundant correlation.
 */
public class RedundantCorrelationCrossPolRatio extends CrossPolRatioMetric {

    private final RedundantCorrelationMetric redundantCorrelation;

    public RedundantCorrelationCrossPolRatio(RedundantCorrelationMetric redundantCorrelation, ArrayLayout layout) {
        super(layout);
        this.redundantCorrelation = redundantCorrelation;
    }

    @Override
    protected Map<AntPol, Double> crossMetric(Set<AntPol> fullExcluded) {
        return redundantCorrelation.raw(layout.polarizations(), fullExcluded, CorrelationMode.CROSS_POL);
    }

    @Override
    protected Map<AntPol, Double> sameMetric(Set<AntPol> fullExcluded) {
        return redundantCorrelation.raw(layout.coPolarizations(), fullExcluded, CorrelationMode.SAME_POL);
    }
}
