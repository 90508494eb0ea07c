package com.raditha.antmetrics.model;

/**
 * Ordered antenna pair. A self-baseline (i == j) carries auto-correlations.
 */
public record Baseline(int i, int j) {

    public boolean isAutoCorrelation() {
        return i == j;
    }

    @Override
    public String toString() {
        return "(" + i + ", " + j + ")";
    }
}
