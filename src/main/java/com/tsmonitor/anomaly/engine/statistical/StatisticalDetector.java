package com.tsmonitor.anomaly.engine.statistical;

import com.tsmonitor.anomaly.engine.AbstractDetector;
import com.tsmonitor.anomaly.exception.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores points by their distance from the training distribution.
 *
 * <ul>
 *   <li>zscore: |x - mean| / (std + eps)</li>
 *   <li>iqr: the z-score for points outside [Q1 - 1.5 IQR, Q3 + 1.5 IQR], 0 inside the fences</li>
 *   <li>moving_average: |x - ma(x)| / (std + eps), where ma is a centered moving average of
 *       {@code window} points and the first {@code window} positions use the running mean</li>
 * </ul>
 *
 * A point is flagged when its score exceeds the threshold (default 2.5, roughly 98.8% confidence).
 */
public class StatisticalDetector extends AbstractDetector {

    private static final Logger log = LoggerFactory.getLogger(StatisticalDetector.class);

    public static final double EPSILON = 1e-8;
    public static final double DEFAULT_THRESHOLD = 2.5;
    public static final int DEFAULT_WINDOW = 10;

    private final StatisticalMethod method;
    private final int window;
    private volatile SampleStatistics stats;

    public StatisticalDetector(double threshold, StatisticalMethod method, int window) {
        super("StatisticalDetector(" + method.getValue() + ")", threshold);
        if (window < 1) {
            throw new InvalidConfigurationException("Moving average window must be >= 1, got " + window);
        }
        this.method = method;
        this.window = window;
    }

    public StatisticalDetector(double threshold, StatisticalMethod method) {
        this(threshold, method, DEFAULT_WINDOW);
    }

    public StatisticalDetector(double threshold) {
        this(threshold, StatisticalMethod.ZSCORE, DEFAULT_WINDOW);
    }

    public StatisticalDetector() {
        this(DEFAULT_THRESHOLD);
    }

    @Override
    public void fit(double[] data) {
        requireNonEmpty(data, name);
        SampleStatistics fittedStats = SampleStatistics.of(data);
        if (fittedStats.std() == 0.0) {
            log.warn("{} fitted on constant data (mean={}); scores degenerate to |x - mean| / {}",
                    name, fittedStats.mean(), EPSILON);
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("mean", fittedStats.mean());
        meta.put("std", fittedStats.std());
        meta.put("median", fittedStats.median());
        meta.put("mad", fittedStats.mad());
        meta.put("Q1", fittedStats.q1());
        meta.put("Q3", fittedStats.q3());
        meta.put("IQR", fittedStats.iqr());
        meta.put("method", method.getValue());
        if (method == StatisticalMethod.MOVING_AVERAGE) {
            meta.put("window", window);
        }

        this.stats = fittedStats;
        publishMetadata(meta);
        this.fitted = true;
    }

    @Override
    public double[] score(double[] data) {
        checkFitted();
        SampleStatistics s = stats;
        double denominator = s.std() + EPSILON;
        double[] scores = new double[data.length];

        switch (method) {
            case ZSCORE -> {
                for (int i = 0; i < data.length; i++) {
                    scores[i] = Math.abs(data[i] - s.mean()) / denominator;
                }
            }
            case IQR -> {
                double lower = s.lowerFence();
                double upper = s.upperFence();
                for (int i = 0; i < data.length; i++) {
                    boolean outside = data[i] < lower || data[i] > upper;
                    scores[i] = outside ? Math.abs(data[i] - s.mean()) / denominator : 0.0;
                }
            }
            case MOVING_AVERAGE -> {
                double[] ma = movingAverage(data, window);
                for (int i = 0; i < data.length; i++) {
                    scores[i] = Math.abs(data[i] - ma[i]) / denominator;
                }
            }
        }
        return scores;
    }

    @Override
    public int[] predict(double[] data) {
        return thresholded(score(data), threshold);
    }

    /**
     * Centered moving average with zero padding beyond both ends, except that the first
     * {@code window} positions are replaced by the mean of all points up to and including them.
     */
    static double[] movingAverage(double[] data, int window) {
        int n = data.length;
        double[] ma = new double[n];
        int offset = (window - 1) / 2;
        for (int i = 0; i < n; i++) {
            int hi = i + offset;
            int lo = hi - window + 1;
            double sum = 0.0;
            for (int k = Math.max(lo, 0); k <= Math.min(hi, n - 1); k++) {
                sum += data[k];
            }
            ma[i] = sum / window;
        }

        double running = 0.0;
        for (int i = 0; i < Math.min(window, n); i++) {
            running += data[i];
            ma[i] = running / (i + 1);
        }
        return ma;
    }

    public StatisticalMethod getMethod() {
        return method;
    }

    public int getWindow() {
        return window;
    }
}
