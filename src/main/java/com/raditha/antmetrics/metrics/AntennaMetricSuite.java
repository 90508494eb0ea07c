package com.raditha.antmetrics.metrics;

import com.raditha.antmetrics.model.AntPol;
import com.raditha.antmetrics.model.AntennaMetric;
import com.raditha.antmetrics.model.MetricSet;
import com.raditha.antmetrics.source.ArrayLayout;
import com.raditha.antmetrics.source.VisibilitySource;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * The four antenna metrics used for flagging:
 * <ul>
 * <li>mean amplitude over all polarizations</li>
 * <li>redundant correlation over co-polarizations</li>
 * <li>mean amplitude cross-pol ratio</li>
 * <li>redundant correlation cross-pol ratio</li>
 * </ul>
 * The metrics only read shared state, so with an executor they are computed
 * concurrently.
 */
public class AntennaMetricSuite implements AntennaMetricCalculator {

    private final ArrayLayout layout;
    private final MeanAmplitudeMetric meanAmplitude;
    private final RedundantCorrelationMetric redundantCorrelation;
    private final MeanAmplitudeCrossPolRatio meanAmplitudeCrossPol;
    private final RedundantCorrelationCrossPolRatio redundantCorrelationCrossPol;
    private final Executor executor;

    /**
     * Create a suite that computes the metrics one after another.
     */
    public AntennaMetricSuite(VisibilitySource source, ArrayLayout layout) {
        this(source, layout, null);
    }

    /**
     * @param executor runs the four metrics concurrently; null computes them sequentially
     */
    public AntennaMetricSuite(VisibilitySource source, ArrayLayout layout, Executor executor) {
        this.layout = layout;
        this.meanAmplitude = new MeanAmplitudeMetric(source, layout);
        this.redundantCorrelation = new RedundantCorrelationMetric(source, layout);
        this.meanAmplitudeCrossPol = new MeanAmplitudeCrossPolRatio(meanAmplitude, layout);
        this.redundantCorrelationCrossPol = new RedundantCorrelationCrossPolRatio(redundantCorrelation, layout);
        this.executor = executor;
    }

    @Override
    public MetricSet compute(Set<AntPol> excluded) {
        Set<AntPol> xants = Set.copyOf(excluded);
        Map<AntennaMetric, Supplier<Map<AntPol, Double>>> tasks = new EnumMap<>(AntennaMetric.class);
        tasks.put(AntennaMetric.MEAN_VIJ, () -> meanAmplitude.raw(layout.polarizations(), xants));
        tasks.put(AntennaMetric.RED_CORR, () -> redundantCorrelation.raw(
                layout.coPolarizations(), xants, CorrelationMode.SAME_POL));
        tasks.put(AntennaMetric.MEAN_VIJ_XPOL, () -> meanAmplitudeCrossPol.raw(xants));
        tasks.put(AntennaMetric.RED_CORR_XPOL, () -> redundantCorrelationCrossPol.raw(xants));

        Map<AntennaMetric, Map<AntPol, Double>> results = new EnumMap<>(AntennaMetric.class);
        if (executor == null) {
            tasks.forEach((metric, task) -> results.put(metric, task.get()));
            return MetricSet.of(results);
        }

        Map<AntennaMetric, CompletableFuture<Map<AntPol, Double>>> futures = new EnumMap<>(AntennaMetric.class);
        tasks.forEach((metric, task) -> futures.put(metric, CompletableFuture.supplyAsync(task, executor)));
        try {
            futures.forEach((metric, future) -> results.put(metric, future.join()));
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
        return MetricSet.of(results);
    }
}
