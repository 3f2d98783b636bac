package com.tsmonitor.anomaly.exception;

/**
 * Unknown method names, mismatched weight vectors, out-of-range parameters.
 */
public class InvalidConfigurationException extends AnomalyDetectionException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
