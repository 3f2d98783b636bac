package com.tsmonitor.anomaly.engine.streaming;

import java.time.Instant;

/**
 * Verdict for the newest point of a stream.
 *
 * @param sequence      1-based position of the point in the stream
 * @param value         raw value as received
 * @param anomaly       true when either underlying detector flagged the point
 * @param score         max of the two detector scores
 * @param fastScore     score of the statistical detector
 * @param heavyScore    score of the isolation-based detector
 */
public record StreamVerdict(long sequence, double value, Instant observedAt, boolean anomaly,
                            double score, double fastScore, double heavyScore,
                            boolean fastFlagged, boolean heavyFlagged) {
}
