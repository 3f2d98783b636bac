package com.tsmonitor.anomaly.exception;

/**
 * Base type for every error raised by the detection engine.
 */
public class AnomalyDetectionException extends RuntimeException {

    public AnomalyDetectionException(String message) {
        super(message);
    }

    public AnomalyDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
