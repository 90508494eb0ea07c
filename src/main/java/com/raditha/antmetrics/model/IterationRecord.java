package com.raditha.antmetrics.model;

import java.util.List;

/**
 * Everything computed in one flagging round.
 *
 * @param round     zero-based round index
 * @param rawMetrics raw values of the four metrics under this round's exclusion set
 * @param zScores   modified z-scores of the raw metrics
 * @param removed   keys removed at the end of this round, empty on the terminal round
 * @param reason    why they were removed, null on the terminal round
 */
public record IterationRecord(
        int round,
        MetricSet rawMetrics,
        MetricSet zScores,
        List<AntPol> removed,
        RemovalReason reason) {

    public IterationRecord {
        removed = removed == null ? List.of() : List.copyOf(removed);
        if (removed.isEmpty() != (reason == null)) {
            throw new IllegalArgumentException("A removal reason is required exactly when keys are removed");
        }
    }

    public boolean hasRemoval() {
        return !removed.isEmpty();
    }
}
