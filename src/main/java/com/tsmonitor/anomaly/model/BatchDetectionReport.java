package com.tsmonitor.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Results of running several detectors over the test part of one series.
 */
@Value
@Builder
public class BatchDetectionReport {

    int trainSize;

    int testSize;

    // Raw (un-normalized) test values, aligned with each result's predictions
    List<Double> testData;

    // Keyed by method name, in request order
    Map<String, DetectionResult> results;

    // Methods that failed and were left out, with the reason
    Map<String, String> skipped;
}
