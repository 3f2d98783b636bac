package com.tsmonitor.anomaly.engine.lof;

import com.tsmonitor.anomaly.engine.AbstractDetector;
import com.tsmonitor.anomaly.exception.DegenerateInputException;
import com.tsmonitor.anomaly.exception.InvalidConfigurationException;
import com.tsmonitor.anomaly.model.DetectionResult;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Puts a {@link LocalOutlierFactor} model behind the detector contract.
 *
 * Scores are the outlier factors of the batch, min-max normalized to [0, 1] within the batch
 * (with a 1e-8 guard on the range). The threshold held by the detector is in raw LOF units:
 * fitting sets it to the factor above which a {@code contamination} fraction of the training
 * sample lies. Each call maps that raw boundary into the batch's normalized scale and flags
 * points whose normalized score exceeds it. {@link #predictWithScores} reports the raw threshold,
 * the same value {@link #getThreshold} returns and {@link #setThreshold} accepts, and puts the
 * mapped value under {@code normalized_threshold} in the result metadata.
 */
public class LofDetector extends AbstractDetector {

    private static final Logger log = LoggerFactory.getLogger(LofDetector.class);

    public static final int DEFAULT_NEIGHBORS = 20;
    public static final double DEFAULT_CONTAMINATION = 0.05;
    static final double RANGE_EPSILON = 1e-8;

    private final int nNeighbors;
    private final double contamination;
    private volatile LocalOutlierFactor model;

    public LofDetector(int nNeighbors, double contamination) {
        super("LocalOutlierFactor", 0.0);
        if (nNeighbors < 1) {
            throw new InvalidConfigurationException("nNeighbors must be >= 1, got " + nNeighbors);
        }
        if (contamination <= 0.0 || contamination > 0.5) {
            throw new InvalidConfigurationException("contamination must be in (0, 0.5], got " + contamination);
        }
        this.nNeighbors = nNeighbors;
        this.contamination = contamination;
    }

    public LofDetector() {
        this(DEFAULT_NEIGHBORS, DEFAULT_CONTAMINATION);
    }

    @Override
    public void fit(double[] data) {
        requireNonEmpty(data, name);
        fit(asColumn(data));
    }

    public void fit(double[][] data) {
        if (data == null || data.length < 2) {
            throw new DegenerateInputException(name + " needs at least 2 training rows");
        }
        LocalOutlierFactor trained = LocalOutlierFactor.fit(data, nNeighbors);
        double boundary = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(trained.getTrainingFactors(), 100.0 * (1.0 - contamination));

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("n_neighbors", trained.getNeighbors());
        meta.put("contamination", contamination);
        meta.put("n_features", data[0].length);
        meta.put("n_samples", data.length);
        meta.put("decision_threshold", boundary);

        this.model = trained;
        this.threshold = boundary;
        publishMetadata(meta);
        this.fitted = true;

        if (trained.getNeighbors() < nNeighbors) {
            log.warn("{}: only {} training rows, neighbourhood reduced from {} to {}",
                    name, data.length, nNeighbors, trained.getNeighbors());
        }
    }

    @Override
    public double[] score(double[] data) {
        return score(asColumn(data));
    }

    public double[] score(double[][] data) {
        return evaluate(data).normalized;
    }

    @Override
    public int[] predict(double[] data) {
        return predict(asColumn(data));
    }

    public int[] predict(double[][] data) {
        BatchScores batch = evaluate(data);
        return thresholded(batch.normalized, batch.normalizedBoundary);
    }

    @Override
    public DetectionResult predictWithScores(double[] data) {
        return predictWithScores(asColumn(data));
    }

    public DetectionResult predictWithScores(double[][] data) {
        double boundary = threshold;
        BatchScores batch = evaluate(data, boundary);
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("normalized_threshold", batch.normalizedBoundary);
        return DetectionResult.of(name, thresholded(batch.normalized, batch.normalizedBoundary),
                batch.normalized, boundary, meta);
    }

    private BatchScores evaluate(double[][] data) {
        return evaluate(data, threshold);
    }

    private BatchScores evaluate(double[][] data, double boundary) {
        checkFitted();
        requireFeatures(data, model.getFeatureCount());
        double[] raw = model.outlierFactors(data);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double r : raw) {
            min = Math.min(min, r);
            max = Math.max(max, r);
        }
        double denominator = (max - min) + RANGE_EPSILON;
        double[] normalized = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            normalized[i] = (raw[i] - min) / denominator;
        }
        double mappedBoundary = raw.length == 0 ? boundary : (boundary - min) / denominator;
        return new BatchScores(normalized, mappedBoundary);
    }

    public double getContamination() {
        return contamination;
    }

    public int getNeighbors() {
        return nNeighbors;
    }

    private record BatchScores(double[] normalized, double normalizedBoundary) {}
}
