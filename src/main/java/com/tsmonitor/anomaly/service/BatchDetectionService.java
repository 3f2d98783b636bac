package com.tsmonitor.anomaly.service;

import com.tsmonitor.anomaly.config.DetectionConfig;
import com.tsmonitor.anomaly.config.MetricsConfig;
import com.tsmonitor.anomaly.engine.Detector;
import com.tsmonitor.anomaly.engine.DetectorType;
import com.tsmonitor.anomaly.engine.normalization.Normalizer;
import com.tsmonitor.anomaly.engine.preprocessing.SeriesPreprocessor;
import com.tsmonitor.anomaly.exception.AnomalyDetectionException;
import com.tsmonitor.anomaly.exception.InvalidConfigurationException;
import com.tsmonitor.anomaly.model.BatchDetectionReport;
import com.tsmonitor.anomaly.model.DetectionResult;
import com.tsmonitor.anomaly.model.MethodComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Offline detection over a complete series: split into train/test, fit the scaler on the
 * train part, scale the test part with it, fit each requested detector and score the test part.
 * Fitted detectors are published to the {@link DetectorRegistry} under their method name.
 */
@Service
public class BatchDetectionService {

    private static final Logger log = LoggerFactory.getLogger(BatchDetectionService.class);

    static final double COMPARISON_TRAIN_RATIO = 0.7;

    private final DetectorFactory detectorFactory;
    private final DetectorRegistry registry;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public BatchDetectionService(DetectorFactory detectorFactory, DetectorRegistry registry,
                                 DetectionConfig config, MetricsConfig metricsConfig) {
        this.detectorFactory = detectorFactory;
        this.registry = registry;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public BatchDetectionReport detect(double[] series, Collection<String> methods) {
        return detect(series, methods, null, config.getTrainRatio());
    }

    /**
     * @param thresholdOverride replaces the configured statistical threshold when non-null
     */
    public BatchDetectionReport detect(double[] series, Collection<String> methods,
                                       Double thresholdOverride, double trainRatio) {
        requireLength(series, config.getMinSeriesLength());
        Set<DetectorType> types = parseMethods(methods);

        SeriesPreprocessor.Split split = SeriesPreprocessor.split(series, trainRatio);
        Normalizer normalizer = detectorFactory.normalizer();
        double[] trainNormalized = normalizer.transform(split.train(), true);
        double[] testNormalized = normalizer.transform(split.test(), false);

        Map<String, DetectionResult> results = new LinkedHashMap<>();
        Map<String, String> skipped = new LinkedHashMap<>();

        for (DetectorType type : types) {
            Detector detector = type == DetectorType.STATISTICAL && thresholdOverride != null
                    ? detectorFactory.statistical(thresholdOverride)
                    : detectorFactory.create(type);
            try {
                detector.fit(trainNormalized);
                DetectionResult result = detector.predictWithScores(testNormalized);
                registry.register(type.getValue(), detector);
                registry.recordResult(type.getValue(), result);
                metricsConfig.recordBatch(type.getValue(), testNormalized.length, result.getAnomalyCount());
                results.put(type.getValue(), result);
                log.info("{}: {} anomalies in {} test points ({})", detector.getName(),
                        result.getAnomalyCount(), testNormalized.length,
                        String.format("%.1f%%", result.getAnomalyRate() * 100));
            } catch (AnomalyDetectionException e) {
                // One method failing (typically LOF on a tiny train split) must not sink the rest
                log.warn("Skipping {}: {}", type.getValue(), e.getMessage());
                skipped.put(type.getValue(), e.getMessage());
            }
        }

        return BatchDetectionReport.builder()
                .trainSize(split.train().length)
                .testSize(split.test().length)
                .testData(DetectionResult.toList(split.test()))
                .results(results)
                .skipped(skipped)
                .build();
    }

    /**
     * Side-by-side summary of the statistical detector (threshold 2.5) and the isolation forest
     * over a 70/30 split.
     */
    public List<MethodComparison> compare(double[] series) {
        requireLength(series, config.getMinComparisonLength());

        SeriesPreprocessor.Split split = SeriesPreprocessor.split(series, COMPARISON_TRAIN_RATIO);
        Normalizer normalizer = detectorFactory.normalizer();
        double[] train = normalizer.transform(split.train(), true);
        double[] test = normalizer.transform(split.test(), false);

        List<MethodComparison> comparison = new ArrayList<>();
        comparison.add(summarize(DetectorType.STATISTICAL, "Statistical (Z-Score)",
                detectorFactory.statistical(2.5), train, test));
        comparison.add(summarize(DetectorType.ISOLATION_FOREST, "Isolation Forest",
                detectorFactory.create(DetectorType.ISOLATION_FOREST), train, test));
        return comparison;
    }

    private MethodComparison summarize(DetectorType type, String label, Detector detector,
                                       double[] train, double[] test) {
        detector.fit(train);
        DetectionResult result = detector.predictWithScores(test);
        metricsConfig.recordBatch(type.getValue(), test.length, result.getAnomalyCount());
        return MethodComparison.builder()
                .method(type.getValue())
                .label(label)
                .anomalies(result.getAnomalyCount())
                .rate(result.getAnomalyRate())
                .meanScore(result.getMeanScore())
                .maxScore(result.getMaxScore())
                .build();
    }

    private Set<DetectorType> parseMethods(Collection<String> methods) {
        if (methods == null || methods.isEmpty()) {
            return Set.of(DetectorType.STATISTICAL);
        }
        Set<DetectorType> types = new LinkedHashSet<>();
        for (String method : methods) {
            types.add(DetectorType.fromValue(method));
        }
        return types;
    }

    private static void requireLength(double[] series, int minimum) {
        if (series == null || series.length < minimum) {
            throw new InvalidConfigurationException(String.format("Need at least %d data points, got %d",
                    minimum, series == null ? 0 : series.length));
        }
    }
}
