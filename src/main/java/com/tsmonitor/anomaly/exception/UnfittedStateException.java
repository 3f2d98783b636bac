package com.tsmonitor.anomaly.exception;

/**
 * Raised when a scaler or detector is used for scoring before it has been fitted.
 */
public class UnfittedStateException extends AnomalyDetectionException {

    public UnfittedStateException(String component) {
        super(component + " must be fitted before use");
    }
}
