package com.tsmonitor.anomaly.engine.preprocessing;

import com.tsmonitor.anomaly.engine.statistical.SampleStatistics;
import com.tsmonitor.anomaly.exception.InvalidConfigurationException;

import java.util.Arrays;

/**
 * Preparation steps applied to a raw series before training.
 */
public final class SeriesPreprocessor {

    private SeriesPreprocessor() {}

    /**
     * Chronological split: the first {@code floor(n * trainRatio)} points train, the rest test.
     */
    public static Split split(double[] data, double trainRatio) {
        if (trainRatio <= 0.0 || trainRatio >= 1.0) {
            throw new InvalidConfigurationException("trainRatio must be in (0, 1), got " + trainRatio);
        }
        int splitIdx = (int) (data.length * trainRatio);
        return new Split(Arrays.copyOfRange(data, 0, splitIdx), Arrays.copyOfRange(data, splitIdx, data.length));
    }

    /**
     * Drop points outside the IQR fences ({@code iqr}, inclusive bounds) or with a z-score of
     * {@code threshold} or more ({@code zscore}). Other method names return the data unchanged.
     */
    public static double[] removeOutliers(double[] data, String method, double threshold) {
        if (data.length == 0) {
            return data;
        }
        SampleStatistics stats = SampleStatistics.of(data);
        if ("iqr".equalsIgnoreCase(method)) {
            double lower = stats.q1() - threshold * stats.iqr();
            double upper = stats.q3() + threshold * stats.iqr();
            return Arrays.stream(data).filter(v -> v >= lower && v <= upper).toArray();
        }
        if ("zscore".equalsIgnoreCase(method)) {
            if (stats.std() == 0.0) {
                return data.clone();
            }
            return Arrays.stream(data)
                    .filter(v -> Math.abs((v - stats.mean()) / stats.std()) < threshold)
                    .toArray();
        }
        return data;
    }

    /**
     * Sliding look-back windows: row i holds {@code data[i .. i+lookback)} and target i is
     * {@code data[i+lookback]}.
     */
    public static Sequences createSequences(double[] data, int lookback) {
        if (lookback < 1) {
            throw new InvalidConfigurationException("lookback must be >= 1, got " + lookback);
        }
        int rows = Math.max(0, data.length - lookback);
        double[][] windows = new double[rows][];
        double[] targets = new double[rows];
        for (int i = 0; i < rows; i++) {
            windows[i] = Arrays.copyOfRange(data, i, i + lookback);
            targets[i] = data[i + lookback];
        }
        return new Sequences(windows, targets);
    }

    public record Split(double[] train, double[] test) {}

    public record Sequences(double[][] windows, double[] targets) {}
}
