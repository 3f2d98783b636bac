package com.tsmonitor.anomaly.engine;

import com.tsmonitor.anomaly.exception.InvalidConfigurationException;

public enum DetectorType {
    STATISTICAL("statistical"),
    ISOLATION_FOREST("isolation_forest"),
    LOF("lof"),
    ENSEMBLE("ensemble");

    private final String value;

    DetectorType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static DetectorType fromValue(String value) {
        for (DetectorType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new InvalidConfigurationException("Unknown detection method: '" + value
                + "'. Expected statistical, isolation_forest, lof or ensemble");
    }
}
