package com.tsmonitor.anomaly.exception;

/**
 * Raised by an ensemble when none of its members produced a usable result for a call.
 * Distinguishes "no detector could judge these points" from "every point is normal".
 */
public class NoVerdictException extends AnomalyDetectionException {

    public NoVerdictException(String message) {
        super(message);
    }
}
