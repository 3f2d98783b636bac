package com.tsmonitor.anomaly.engine;

import com.tsmonitor.anomaly.exception.DegenerateInputException;
import com.tsmonitor.anomaly.exception.InvalidConfigurationException;
import com.tsmonitor.anomaly.exception.UnfittedStateException;
import com.tsmonitor.anomaly.model.DetectionResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Holds the state every detector carries (name, threshold, fitted flag, metadata)
 * and shapes the common {@link DetectionResult}.
 */
public abstract class AbstractDetector implements Detector {

    protected final String name;
    protected volatile double threshold;
    protected volatile boolean fitted;
    protected volatile Map<String, Object> metadata = Collections.emptyMap();

    protected AbstractDetector(String name, double threshold) {
        this.name = name;
        this.threshold = threshold;
    }

    @Override
    public DetectionResult predictWithScores(double[] data) {
        checkFitted();
        double boundary = threshold;
        double[] scores = score(data);
        return DetectionResult.of(name, thresholded(scores, boundary), scores, boundary, metadata);
    }

    @Override
    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public double getThreshold() {
        return threshold;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isFitted() {
        return fitted;
    }

    @Override
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    protected void checkFitted() {
        if (!fitted) {
            throw new UnfittedStateException(name);
        }
    }

    protected void publishMetadata(Map<String, Object> values) {
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    protected static void requireNonEmpty(double[] data, String detectorName) {
        if (data == null || data.length == 0) {
            throw new DegenerateInputException(detectorName + " cannot be fitted on an empty sample");
        }
    }

    protected void requireFeatures(double[][] rows, int expected) {
        for (double[] row : rows) {
            if (row.length != expected) {
                throw new InvalidConfigurationException(String.format(
                        "%s was fitted on %d features, got a row with %d", name, expected, row.length));
            }
        }
    }

    protected static int[] thresholded(double[] scores, double threshold) {
        int[] predictions = new int[scores.length];
        for (int i = 0; i < scores.length; i++) {
            predictions[i] = scores[i] > threshold ? 1 : 0;
        }
        return predictions;
    }

    /**
     * Reshape a univariate series into one single-feature row per point.
     */
    protected static double[][] asColumn(double[] data) {
        double[][] rows = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            rows[i] = new double[] {data[i]};
        }
        return rows;
    }
}
