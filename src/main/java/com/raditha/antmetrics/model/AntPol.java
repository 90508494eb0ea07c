package com.raditha.antmetrics.model;

/**
 * An antenna paired with one of its feed polarizations.
 * Every per-antenna metric is keyed by this value.
 *
 * @param antenna antenna index
 * @param pol     feed polarization label (e.g. "x" or "y")
 */
public record AntPol(int antenna, String pol) {

    public AntPol {
        if (pol == null || pol.isBlank()) {
            throw new IllegalArgumentException("Feed polarization cannot be empty");
        }
    }

    @Override
    public String toString() {
        return "(" + antenna + ", " + pol + ")";
    }
}
