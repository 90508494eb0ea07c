package com.raditha.antmetrics.metrics;

import com.raditha.antmetrics.model.AntPol;
import com.raditha.antmetrics.source.ArrayLayout;

import java.util.Map;
import java.util.Set;

/**
 * Ratio of mean cross-pol to mean same-pol visibility amplitude,
 * (|Vxy| + |Vyx|) / (|Vxx| + |Vyy|).
 */
public class MeanAmplitudeCrossPolRatio extends CrossPolRatioMetric {

    private final MeanAmplitudeMetric meanAmplitude;

    public MeanAmplitudeCrossPolRatio(MeanAmplitudeMetric meanAmplitude, ArrayLayout layout) {
        super(layout);
        this.meanAmplitude = meanAmplitude;
    }

    @Override
    protected Map<AntPol, Double> crossMetric(Set<AntPol> fullExcluded) {
        return meanAmplitude.raw(layout.crossPolarizations(), fullExcluded);
    }

    @Override
    protected Map<AntPol, Double> sameMetric(Set<AntPol> fullExcluded) {
        return meanAmplitude.raw(layout.coPolarizations(), fullExcluded);
    }
}
