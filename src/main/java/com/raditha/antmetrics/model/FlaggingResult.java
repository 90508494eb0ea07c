package com.raditha.antmetrics.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable outcome of one iterative flagging run.
 *
 * @param excluded       every removed key, in removal order
 * @param crossedRemoved keys removed as cross-polarized
 * @param deadRemoved    keys removed as dead
 * @param removalRound   round in which each removed key was flagged
 * @param finalMetrics   per metric, the last raw value computed for each key
 * @param finalZScores   per metric, the last modified z-score computed for each key
 * @param iterations     one record per round, in order
 * @param crossCut       cross-polarization cut used for the run
 * @param deadCut        dead-antenna cut used for the run
 */
public record FlaggingResult(
        List<AntPol> excluded,
        List<AntPol> crossedRemoved,
        List<AntPol> deadRemoved,
        Map<AntPol, Integer> removalRound,
        MetricSet finalMetrics,
        MetricSet finalZScores,
        List<IterationRecord> iterations,
        double crossCut,
        double deadCut) {

    public FlaggingResult {
        excluded = List.copyOf(excluded);
        crossedRemoved = List.copyOf(crossedRemoved);
        deadRemoved = List.copyOf(deadRemoved);
        removalRound = Collections.unmodifiableMap(new LinkedHashMap<>(removalRound));
        iterations = List.copyOf(iterations);
    }

    public Set<AntPol> excludedSet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(excluded));
    }

    /**
     * Antenna indices with at least one removed polarization.
     */
    public Set<Integer> flaggedAntennas() {
        Set<Integer> antennas = new LinkedHashSet<>();
        excluded.forEach(key -> antennas.add(key.antenna()));
        return antennas;
    }

    public int roundCount() {
        return iterations.size();
    }

    /**
     * True if the last round found nothing beyond either cut. False means the
     * run stopped at the round cap.
     */
    public boolean reachedTerminalState() {
        return !iterations.isEmpty() && !iterations.get(iterations.size() - 1).hasRemoval();
    }

    public List<MetricSet> allMetrics() {
        return iterations.stream().map(IterationRecord::rawMetrics).toList();
    }

    public List<MetricSet> allZScores() {
        return iterations.stream().map(IterationRecord::zScores).toList();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(Locale.ROOT,
                "Flagged %d antenna polarizations (%d dead, %d cross-polarized) in %d rounds (dead cut %.1f, cross cut %.1f)",
                excluded.size(),
                deadRemoved.size(),
                crossedRemoved.size(),
                iterations.size(),
                deadCut,
                crossCut);
    }
}
