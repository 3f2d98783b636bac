package com.tsmonitor.anomaly.engine.statistical;

import com.tsmonitor.anomaly.exception.InvalidConfigurationException;

public enum StatisticalMethod {
    ZSCORE("zscore"),
    IQR("iqr"),
    MOVING_AVERAGE("moving_average");

    private final String value;

    StatisticalMethod(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static StatisticalMethod fromValue(String value) {
        for (StatisticalMethod method : values()) {
            if (method.value.equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new InvalidConfigurationException("Unknown statistical method: '" + value
                + "'. Expected zscore, iqr or moving_average");
    }
}
