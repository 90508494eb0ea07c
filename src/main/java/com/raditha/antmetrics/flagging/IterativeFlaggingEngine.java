package com.raditha.antmetrics.flagging;

import com.raditha.antmetrics.config.FlaggingConfig;
import com.raditha.antmetrics.metrics.AntennaMetricCalculator;
import com.raditha.antmetrics.metrics.AntennaMetricSuite;
import com.raditha.antmetrics.metrics.MetricCombiner;
import com.raditha.antmetrics.model.AntPol;
import com.raditha.antmetrics.model.AntennaMetric;
import com.raditha.antmetrics.model.FlaggingResult;
import com.raditha.antmetrics.model.IterationRecord;
import com.raditha.antmetrics.model.MetricSet;
import com.raditha.antmetrics.model.RedundantGroup;
import com.raditha.antmetrics.model.RemovalReason;
import com.raditha.antmetrics.source.ArrayLayout;
import com.raditha.antmetrics.source.VisibilitySource;
import com.raditha.antmetrics.stats.ModifiedZScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Finds dead and cross-polarized antennas one at a time.
 * <p>
 * Each round computes all four metrics against the current exclusion set,
 * combines them into a dead statistic and a cross-polarization statistic, and
 * removes the single worst antenna if it exceeds its cut. The run ends when
 * nothing exceeds either cut, or after antennas x feed polarizations rounds.
 * <p>
 * An engine may be run several times; every run starts from an empty exclusion set.
 */
public class IterativeFlaggingEngine {

    private static final Logger logger = LoggerFactory.getLogger(IterativeFlaggingEngine.class);

    private final VisibilitySource source;
    private final ArrayLayout layout;
    private final FlaggingConfig config;
    private final AntennaMetricCalculator calculator;

    /**
     * Create engine with the default 5 sigma cuts.
     */
    public IterativeFlaggingEngine(VisibilitySource source, List<RedundantGroup> reds) {
        this(source, reds, FlaggingConfig.defaults());
    }

    /**
     * Create engine with custom configuration.
     *
     * @throws IllegalArgumentException if the source is not dual-polarization
     */
    public IterativeFlaggingEngine(VisibilitySource source, List<RedundantGroup> reds, FlaggingConfig config) {
        this.source = source;
        this.layout = ArrayLayout.from(source, reds);
        this.config = config;
        this.calculator = null;
    }

    /**
     * Create engine around a custom metric calculator.
     */
    public IterativeFlaggingEngine(ArrayLayout layout, FlaggingConfig config, AntennaMetricCalculator calculator) {
        this.source = null;
        this.layout = layout;
        this.config = config;
        this.calculator = calculator;
    }

    /**
     * Run all four metrics repeatedly, removing the worst antenna each round.
     *
     * @return the exclusion decisions and full metric history of this run
     */
    public FlaggingResult run() {
        if (calculator != null) {
            return new FlaggingRun(calculator).execute();
        }
        if (!config.parallelMetrics()) {
            return new FlaggingRun(new AntennaMetricSuite(source, layout)).execute();
        }
        ExecutorService executor = Executors.newFixedThreadPool(AntennaMetric.values().length);
        try {
            return new FlaggingRun(new AntennaMetricSuite(source, layout, executor)).execute();
        } finally {
            executor.shutdownNow();
        }
    }

    public ArrayLayout layout() {
        return layout;
    }

    public FlaggingConfig config() {
        return config;
    }

    /**
     * Mutable state of one run. Discarded once the result is built.
     */
    private final class FlaggingRun {
        private final AntennaMetricCalculator metrics;
        private final Set<AntPol> excluded = new LinkedHashSet<>();
        private final List<AntPol> crossedRemoved = new ArrayList<>();
        private final List<AntPol> deadRemoved = new ArrayList<>();
        private final Map<AntPol, Integer> removalRound = new LinkedHashMap<>();
        private final Map<AntennaMetric, Map<AntPol, Double>> finalMetrics = new EnumMap<>(AntennaMetric.class);
        private final Map<AntennaMetric, Map<AntPol, Double>> finalZScores = new EnumMap<>(AntennaMetric.class);
        private final List<IterationRecord> iterations = new ArrayList<>();

        FlaggingRun(AntennaMetricCalculator metrics) {
            this.metrics = metrics;
        }

        FlaggingResult execute() {
            int maxRounds = layout.maxRounds();
            boolean terminated = false;
            for (int round = 0; round < maxRounds && !terminated; round++) {
                terminated = runRound(round);
            }
            if (terminated) {
                logger.info("Flagging finished after {} rounds: {} dead, {} cross-polarized antenna polarizations",
                        iterations.size(), deadRemoved.size(), crossedRemoved.size());
            } else {
                logger.info("Flagging stopped at the round cap of {}", maxRounds);
            }

            return new FlaggingResult(
                    new ArrayList<>(excluded),
                    crossedRemoved,
                    deadRemoved,
                    removalRound,
                    MetricSet.of(finalMetrics),
                    MetricSet.of(finalZScores),
                    iterations,
                    config.crossCut(),
                    config.deadCut());
        }

        /**
         * @return true if this was the terminal round
         */
        private boolean runRound(int round) {
            MetricSet raw = metrics.compute(Set.copyOf(excluded));
            MetricSet zScores = standardize(raw);
            recordFinalValues(raw, zScores);

            Map<AntPol, Double> deadStatistic = MetricCombiner.combine(
                    zScores.get(AntennaMetric.MEAN_VIJ), zScores.get(AntennaMetric.RED_CORR));
            Map<AntPol, Double> crossStatistic = MetricCombiner.combine(
                    zScores.get(AntennaMetric.MEAN_VIJ_XPOL), zScores.get(AntennaMetric.RED_CORR_XPOL));
            warnIfDegenerate(round, "dead", deadStatistic);
            warnIfDegenerate(round, "cross-polarization", crossStatistic);

            FlaggingDecision decision = FlaggingDecision.decide(
                    deadStatistic, crossStatistic, config.deadCut(), config.crossCut());
            logger.debug("Round {}: worst dead {} (ratio {}), worst crossed {} (ratio {})",
                    round, decision.worstDead(), decision.deadRatio(),
                    decision.worstCross(), decision.crossRatio());

            switch (decision.outcome()) {
                case FLAG_CROSSED -> {
                    List<AntPol> keys = layout.feeds().stream()
                            .map(feed -> new AntPol(decision.worstCross().antenna(), feed))
                            .toList();
                    remove(round, keys, RemovalReason.CROSSED);
                    iterations.add(new IterationRecord(round, raw, zScores, keys, RemovalReason.CROSSED));
                    return false;
                }
                case FLAG_DEAD -> {
                    List<AntPol> keys = List.of(decision.worstDead());
                    remove(round, keys, RemovalReason.DEAD);
                    iterations.add(new IterationRecord(round, raw, zScores, keys, RemovalReason.DEAD));
                    return false;
                }
                default -> {
                    iterations.add(new IterationRecord(round, raw, zScores, List.of(), null));
                    return true;
                }
            }
        }

        private void remove(int round, List<AntPol> keys, RemovalReason reason) {
            for (AntPol key : keys) {
                if (!excluded.add(key)) {
                    throw new IllegalStateException("Antenna polarization " + key + " was already excluded");
                }
                if (reason == RemovalReason.CROSSED) {
                    crossedRemoved.add(key);
                } else {
                    deadRemoved.add(key);
                }
                removalRound.put(key, round);
                logger.info("On round {} flagging {} as {}", round, key,
                        reason == RemovalReason.CROSSED ? "cross-polarized" : "dead");
            }
        }

        private MetricSet standardize(MetricSet raw) {
            Map<AntennaMetric, Map<AntPol, Double>> scores = new EnumMap<>(AntennaMetric.class);
            for (AntennaMetric metric : AntennaMetric.values()) {
                scores.put(metric, ModifiedZScore.standardize(raw.get(metric)));
            }
            return MetricSet.of(scores);
        }

        private void recordFinalValues(MetricSet raw, MetricSet zScores) {
            for (AntennaMetric metric : AntennaMetric.values()) {
                finalMetrics.computeIfAbsent(metric, m -> new LinkedHashMap<>()).putAll(raw.get(metric));
                finalZScores.computeIfAbsent(metric, m -> new LinkedHashMap<>()).putAll(zScores.get(metric));
            }
        }

        private void warnIfDegenerate(int round, String name, Map<AntPol, Double> statistic) {
            if (!statistic.isEmpty() && statistic.values().stream().allMatch(v -> v.isNaN())) {
                logger.warn("Round {}: every {} statistic is NaN, no candidate from it", round, name);
            }
        }
    }
}
