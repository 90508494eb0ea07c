package com.raditha.antmetrics.config;

/**
 * Configuration for iterative antenna flagging.
 * Both cuts are modified z-score thresholds in units of robust sigmas.
 *
 * @param deadCut         Cut on the combined dead-antenna statistic
 * @param crossCut        Cut on the combined cross-polarization statistic
 * @param parallelMetrics Compute the four metrics of a round concurrently
 */
public record FlaggingConfig(
        double deadCut,
        double crossCut,
        boolean parallelMetrics) {
    /**
     * Validate configuration.
     */
    public FlaggingConfig {
        if (!(deadCut > 0.0) || Double.isInfinite(deadCut)) {
            throw new IllegalArgumentException("deadCut must be a positive finite number, got " + deadCut);
        }
        if (!(crossCut > 0.0) || Double.isInfinite(crossCut)) {
            throw new IllegalArgumentException("crossCut must be a positive finite number, got " + crossCut);
        }
    }

    public FlaggingConfig(double deadCut, double crossCut) {
        this(deadCut, crossCut, false);
    }

    /**
     * Default preset: 5 sigma for both dead and cross-polarized antennas.
     */
    public static FlaggingConfig defaults() {
        return new FlaggingConfig(5.0, 5.0, false);
    }

    /**
     * Strict preset: flags more aggressively (4 sigma).
     */
    public static FlaggingConfig strict() {
        return new FlaggingConfig(4.0, 4.0, false);
    }

    /**
     * Lenient preset: only very clear outliers (7 sigma).
     */
    public static FlaggingConfig lenient() {
        return new FlaggingConfig(7.0, 7.0, false);
    }

    /**
     * Look up a preset by name.
     *
     * @throws IllegalArgumentException for an unknown preset
     */
    public static FlaggingConfig preset(String name) {
        return switch (name) {
            case "default" -> defaults();
            case "strict" -> strict();
            case "lenient" -> lenient();
            default -> throw new IllegalArgumentException("Unknown flagging preset: " + name);
        };
    }

    public FlaggingConfig withParallelMetrics(boolean parallel) {
        return new FlaggingConfig(deadCut, crossCut, parallel);
    }
}
