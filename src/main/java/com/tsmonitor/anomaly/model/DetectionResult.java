package com.tsmonitor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of scoring a batch of points with one detector.
 * Built fresh on every call; list and map fields are unmodifiable copies.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DetectionResult {

    String detectorName;

    // 1 = anomaly, 0 = normal, one entry per input point
    List<Integer> predictions;

    // Higher = more anomalous, same length as predictions
    List<Double> scores;

    double threshold;

    int anomalyCount;

    // anomalyCount / predictions.size(), 0.0 for empty input
    double anomalyRate;

    double meanScore;

    double maxScore;

    Map<String, Object> metadata;

    // Ensemble only: |score - 0.5| * 2 per point
    List<Double> confidence;

    // Ensemble only
    String votingMode;

    public static DetectionResult of(String detectorName, int[] predictions, double[] scores,
                                     double threshold, Map<String, Object> metadata) {
        return baseBuilder(detectorName, predictions, scores, threshold, metadata).build();
    }

    /**
     * Pre-populates the common fields so variants only add what is specific to them.
     */
    public static DetectionResultBuilder baseBuilder(String detectorName, int[] predictions, double[] scores,
                                                     double threshold, Map<String, Object> metadata) {
        int anomalies = 0;
        for (int p : predictions) {
            anomalies += p;
        }
        double sum = 0.0;
        double max = scores.length == 0 ? 0.0 : Double.NEGATIVE_INFINITY;
        for (double s : scores) {
            sum += s;
            max = Math.max(max, s);
        }
        return DetectionResult.builder()
                .detectorName(detectorName)
                .predictions(toList(predictions))
                .scores(toList(scores))
                .threshold(threshold)
                .anomalyCount(anomalies)
                .anomalyRate(predictions.length == 0 ? 0.0 : (double) anomalies / predictions.length)
                .meanScore(scores.length == 0 ? 0.0 : sum / scores.length)
                .maxScore(max)
                .metadata(metadata == null ? Map.of() : Map.copyOf(metadata));
    }

    public static List<Integer> toList(int[] values) {
        Integer[] boxed = new Integer[values.length];
        for (int i = 0; i < values.length; i++) boxed[i] = values[i];
        return List.of(boxed);
    }

    public static List<Double> toList(double[] values) {
        Double[] boxed = new Double[values.length];
        for (int i = 0; i < values.length; i++) boxed[i] = values[i];
        return List.of(boxed);
    }
}
