package com.raditha.antmetrics.flagging;

import com.raditha.antmetrics.model.AntPol;

import java.util.Map;
import java.util.Optional;

/**
 * Outcome of comparing one round's worst dead and worst cross-polarized
 * candidates against their cuts.
 *
 * @param outcome    what the engine does next
 * @param worstDead  key with the largest dead statistic, null if none is defined
 * @param deadRatio  |worst dead statistic| / dead cut, 0 if none is defined
 * @param worstCross key with the largest cross statistic, null if none is defined
 * @param crossRatio |worst cross statistic| / cross cut, 0 if none is defined
 */
public record FlaggingDecision(
        Outcome outcome,
        AntPol worstDead,
        double deadRatio,
        AntPol worstCross,
        double crossRatio) {

    public enum Outcome {
        /** Remove both polarizations of the worst cross-polarized antenna */
        FLAG_CROSSED,

        /** Remove the single worst dead antenna polarization */
        FLAG_DEAD,

        /** Nothing exceeds its cut; stop */
        TERMINATE
    }

    /**
     * Decide from the combined statistics of one round.
     */
    public static FlaggingDecision decide(Map<AntPol, Double> deadStatistic, Map<AntPol, Double> crossStatistic,
                                          double deadCut, double crossCut) {
        Optional<Map.Entry<AntPol, Double>> dead = worst(deadStatistic);
        Optional<Map.Entry<AntPol, Double>> cross = worst(crossStatistic);

        double deadRatio = dead.map(e -> Math.abs(e.getValue()) / deadCut).orElse(0.0);
        double crossRatio = cross.map(e -> Math.abs(e.getValue()) / crossCut).orElse(0.0);

        return new FlaggingDecision(
                outcome(deadRatio, crossRatio),
                dead.map(Map.Entry::getKey).orElse(null),
                deadRatio,
                cross.map(Map.Entry::getKey).orElse(null),
                crossRatio);
    }

    /**
     * Cross-polarization wins ties; a ratio of exactly 1.0 is enough for a
     * cross flag but not for a dead flag.
     */
    static Outcome outcome(double deadRatio, double crossRatio) {
        if (crossRatio >= deadRatio && crossRatio >= 1.0) {
            return Outcome.FLAG_CROSSED;
        } else if (deadRatio > crossRatio && deadRatio > 1.0) {
            return Outcome.FLAG_DEAD;
        }
        return Outcome.TERMINATE;
    }

    /**
     * Entry with the largest value. NaN never wins, and the first of several
     * equal values is kept. Empty if every value is NaN.
     */
    static Optional<Map.Entry<AntPol, Double>> worst(Map<AntPol, Double> statistic) {
        Map.Entry<AntPol, Double> best = null;
        for (Map.Entry<AntPol, Double> entry : statistic.entrySet()) {
            if (entry.getValue().isNaN()) {
                continue;
            }
            if (best == null || entry.getValue() > best.getValue()) {
                best = entry;
            }
        }
        return Optional.ofNullable(best).map(e -> Map.entry(e.getKey(), e.getValue()));
    }
}
