package com.tsmonitor.anomaly.engine.streaming;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Point-in-time copy of a stream's running totals. Buffer statistics are 0 while the buffer is
 * empty and score statistics are 0 until the first verdict.
 */
@Value
@Builder
public class StreamStats {
    long totalPoints;
    long anomalies;
    double anomalyRate;
    long verdicts;
    int bufferSize;
    int capacity;
    double minValue;
    double meanValue;
    double maxValue;
    double avgScore;
    double maxScore;
    boolean trained;
    Duration uptime;
}
