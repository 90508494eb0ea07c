package com.raditha.antmetrics.model;

/**
 * The four antenna metrics computed in every flagging round.
 * Two detect dead antennas, two detect cross-polarized ones.
 */
public enum AntennaMetric {
    /** Mean visibility amplitude over all polarizations */
    MEAN_VIJ("meanVij"),

    /** Mean redundant-group correlation over co-polarizations */
    RED_CORR("redCorr"),

    /** Cross-pol to same-pol ratio of mean visibility amplitude */
    MEAN_VIJ_XPOL("meanVijXPol"),

    /** Singly-flipped to same-pol ratio of redundant correlation */
    RED_CORR_XPOL("redCorrXPol");

    private final String key;

    AntennaMetric(String key) {
        this.key = key;
    }

    /**
     * Name used in persisted metric records.
     */
    public String key() {
        return key;
    }

    public static AntennaMetric fromKey(String key) {
        for (AntennaMetric metric : values()) {
            if (metric.key.equals(key)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown antenna metric: " + key);
    }
}
