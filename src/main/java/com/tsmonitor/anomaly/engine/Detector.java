package com.tsmonitor.anomaly.engine;

import com.tsmonitor.anomaly.model.DetectionResult;

import java.util.Map;

/**
 * Contract shared by every anomaly detector variant.
 * Each implementation learns "normal" from a training sample and then scores new points,
 * where a higher score means more anomalous.
 */
public interface Detector {

    /**
     * Learn from a sample of (mostly) normal behavior. Re-fitting replaces the previous state.
     */
    void fit(double[] data);

    /**
     * Binary verdict per point: 1 = anomaly, 0 = normal.
     */
    int[] predict(double[] data);

    /**
     * Anomaly score per point, consistent with {@link #predict}: for the threshold reported by
     * {@link #predictWithScores}, {@code predict(x) == 1} exactly when {@code score(x) > threshold}.
     */
    double[] score(double[] data);

    /**
     * Predictions, scores and summary for the batch.
     *
     * @throws com.tsmonitor.anomaly.exception.UnfittedStateException if {@link #fit} was never called
     */
    DetectionResult predictWithScores(double[] data);

    /**
     * Move the decision boundary without retraining.
     */
    void setThreshold(double threshold);

    double getThreshold();

    String getName();

    boolean isFitted();

    /**
     * Free-form statistics captured by the last fit.
     */
    Map<String, Object> getMetadata();
}
