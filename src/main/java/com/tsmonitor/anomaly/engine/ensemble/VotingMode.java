package com.tsmonitor.anomaly.engine.ensemble;

import com.tsmonitor.anomaly.exception.InvalidConfigurationException;

public enum VotingMode {
    // Fraction of members flagging the point
    MAJORITY("majority", 0.5),
    // Weighted blend of per-member min-max normalized scores
    WEIGHTED("weighted", 0.6);

    private final String value;
    private final double defaultThreshold;

    VotingMode(String value, double defaultThreshold) {
        this.value = value;
        this.defaultThreshold = defaultThreshold;
    }

    public String getValue() {
        return value;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public static VotingMode fromValue(String value) {
        for (VotingMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new InvalidConfigurationException("Unknown voting mode: '" + value + "'. Expected majority or weighted");
    }
}
