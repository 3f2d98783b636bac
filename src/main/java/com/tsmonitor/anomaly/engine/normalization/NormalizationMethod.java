package com.tsmonitor.anomaly.engine.normalization;

import com.tsmonitor.anomaly.exception.InvalidConfigurationException;

import java.util.Arrays;

public enum NormalizationMethod {
    // (x - mean) / std
    STANDARD("standard"),
    // (x - min) / (max - min)
    MINMAX("minmax"),
    // (x - median) / IQR
    ROBUST("robust");

    private final String value;

    NormalizationMethod(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static NormalizationMethod fromValue(String value) {
        for (NormalizationMethod method : values()) {
            if (method.value.equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new InvalidConfigurationException("Unknown normalization method: '" + value
                + "'. Expected one of " + Arrays.toString(Arrays.stream(values()).map(m -> m.value).toArray()));
    }
}
