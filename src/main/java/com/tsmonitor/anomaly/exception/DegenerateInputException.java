package com.tsmonitor.anomaly.exception;

/**
 * Raised when training input cannot support a model at all (e.g. an empty sample).
 * Zero-variance input is not an error: it is absorbed by an epsilon guard and logged.
 */
public class DegenerateInputException extends AnomalyDetectionException {

    public DegenerateInputException(String message) {
        super(message);
    }
}
