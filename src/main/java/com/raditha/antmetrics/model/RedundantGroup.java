package com.raditha.antmetrics.model;

import java.util.List;

/**
 * Baselines that should measure the same sky signal in an ideal array.
 * Order matters: baseline pairs are formed from each baseline and those after it.
 */
public record RedundantGroup(List<Baseline> baselines) {

    public RedundantGroup {
        baselines = baselines == null ? List.of() : List.copyOf(baselines);
    }

    public static RedundantGroup of(Baseline... baselines) {
        return new RedundantGroup(List.of(baselines));
    }
}
