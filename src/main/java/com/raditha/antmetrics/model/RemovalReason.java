package com.raditha.antmetrics.model;

/**
 * Why an antenna polarization was removed from further metric computation.
 */
public enum RemovalReason {
    /** Low amplitude or poor redundant correlation; one polarization per round */
    DEAD,

    /** Polarizations appear swapped; both polarizations removed together */
    CROSSED
}
