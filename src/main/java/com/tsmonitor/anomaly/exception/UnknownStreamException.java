package com.tsmonitor.anomaly.exception;

public class UnknownStreamException extends AnomalyDetectionException {

    public UnknownStreamException(String source) {
        super("No stream registered for source '" + source + "'");
    }
}
