package com.tsmonitor.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // standard | minmax | robust
    private String normalizationMethod = "standard";

    // Fraction of a batch series used for training; the rest is scored.
    private double trainRatio = 0.8;

    // Shortest series accepted by the batch pipeline.
    private int minSeriesLength = 10;

    // Shortest series accepted by the method comparison.
    private int minComparisonLength = 20;

    private Statistical statistical = new Statistical();

    private IsolationForest isolationForest = new IsolationForest();

    private Lof lof = new Lof();

    private Ensemble ensemble = new Ensemble();

    private Streaming streaming = new Streaming();

    @Data
    public static class Statistical {
        // Z-score threshold (2.5 ~ 98.8% confidence)
        private double threshold = 2.5;
        // zscore | iqr | moving_average
        private String method = "zscore";
        private int window = 10;
    }

    @Data
    public static class IsolationForest {
        private double contamination = 0.08;
        private int numTrees = 100;
        private int sampleSize = 256;
        private long seed = 42L;
    }

    @Data
    public static class Lof {
        private int neighbors = 20;
        private double contamination = 0.08;
    }

    @Data
    public static class Ensemble {
        // majority | weighted
        private String voting = "majority";
        // One weight per member (statistical, isolation forest, LOF); normalized to sum 1.
        private List<Double> weights = new ArrayList<>(List.of(1.0, 1.0, 1.0));
        // Decision boundary for weighted voting; majority always starts at 0.5.
        private double weightedThreshold = 0.6;
        private double statisticalThreshold = 3.0;
        private double contamination = 0.05;
        private int neighbors = 20;
    }

    @Data
    public static class Streaming {
        private int capacity = 100;
        private int minPointsForVerdict = 10;
        private double statisticalThreshold = 2.5;
        private double contamination = 0.08;
        // How often the single writer drains queued points into their windows.
        private long drainIntervalMs = 1000;
        // Anomaly verdicts retained per source for readers.
        private int recentAnomalyCapacity = 1000;
    }
}
