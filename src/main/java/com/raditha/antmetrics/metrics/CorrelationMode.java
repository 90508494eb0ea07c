package com.raditha.antmetrics.metrics;

/**
 * Which visibility polarization pairs the redundant correlation metric compares.
 */
public enum CorrelationMode {
    /** Both baselines in the same visibility polarization */
    SAME_POL,

    /**
     * Exactly one feed differs between the two visibility polarizations.
     * Only antennas on the flipped side are credited.
     */
    CROSS_POL
}
