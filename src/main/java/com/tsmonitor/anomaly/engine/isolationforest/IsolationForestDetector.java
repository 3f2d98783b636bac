package com.tsmonitor.anomaly.engine.isolationforest;

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
 * Puts an {@link IsolationForest} behind the detector contract.
 *
 * The score is the forest's anomaly score (larger = more anomalous). Fitting also learns
 * the decision boundary: the training-score quantile above which a {@code contamination}
 * fraction of the training sample lies. That boundary becomes the threshold, so
 * {@code predict} is {@code score > threshold}. Changing the contamination means re-fitting.
 */
public class IsolationForestDetector extends AbstractDetector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

    public static final double DEFAULT_CONTAMINATION = 0.05;
    public static final int DEFAULT_NUM_TREES = 100;
    public static final int DEFAULT_SAMPLE_SIZE = 256;
    public static final long DEFAULT_SEED = 42L;

    private final double contamination;
    private final int numTrees;
    private final int sampleSize;
    private final long seed;
    private volatile IsolationForest forest;

    public IsolationForestDetector(double contamination, int numTrees, int sampleSize, long seed) {
        super("IsolationForest", 0.0);
        if (contamination <= 0.0 || contamination > 0.5) {
            throw new InvalidConfigurationException("contamination must be in (0, 0.5], got " + contamination);
        }
        if (numTrees < 1 || sampleSize < 2) {
            throw new InvalidConfigurationException(String.format(
                    "numTrees must be >= 1 and sampleSize >= 2, got %d and %d", numTrees, sampleSize));
        }
        this.contamination = contamination;
        this.numTrees = numTrees;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    public IsolationForestDetector(double contamination) {
        this(contamination, DEFAULT_NUM_TREES, DEFAULT_SAMPLE_SIZE, DEFAULT_SEED);
    }

    public IsolationForestDetector() {
        this(DEFAULT_CONTAMINATION);
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
        IsolationForest trained = IsolationForest.train(data, numTrees, sampleSize, seed);
        double[] trainingScores = trained.anomalyScores(data);
        double boundary = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(trainingScores, 100.0 * (1.0 - contamination));

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("contamination", contamination);
        meta.put("n_estimators", numTrees);
        meta.put("max_samples", trained.getSampleSize());
        meta.put("n_features", data[0].length);
        meta.put("n_samples", data.length);
        meta.put("decision_threshold", boundary);

        this.forest = trained;
        this.threshold = boundary;
        publishMetadata(meta);
        this.fitted = true;

        log.info("Trained {}: {} trees, {} samples, {} features, boundary={}",
                name, numTrees, data.length, data[0].length, String.format("%.4f", boundary));
    }

    @Override
    public double[] score(double[] data) {
        return score(asColumn(data));
    }

    public double[] score(double[][] data) {
        checkFitted();
        requireFeatures(data, forest.getFeatureCount());
        return forest.anomalyScores(data);
    }

    @Override
    public int[] predict(double[] data) {
        return predict(asColumn(data));
    }

    public int[] predict(double[][] data) {
        return thresholded(score(data), threshold);
    }

    public DetectionResult predictWithScores(double[][] data) {
        checkFitted();
        double[] scores = score(data);
        double boundary = threshold;
        return DetectionResult.of(name, thresholded(scores, boundary), scores, boundary, metadata);
    }

    public double getContamination() {
        return contamination;
    }
}
