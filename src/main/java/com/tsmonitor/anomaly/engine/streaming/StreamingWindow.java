package com.tsmonitor.anomaly.engine.streaming;

import com.tsmonitor.anomaly.engine.Detector;
import com.tsmonitor.anomaly.engine.isolationforest.IsolationForestDetector;
import com.tsmonitor.anomaly.engine.normalization.Normalizer;
import com.tsmonitor.anomaly.engine.statistical.StatisticalDetector;
import com.tsmonitor.anomaly.exception.InvalidConfigurationException;
import com.tsmonitor.anomaly.model.DetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Optional;

/**
 * Turns a pair of batch detectors into an online one over a bounded FIFO buffer.
 *
 * Each new point is appended (evicting the oldest at capacity), the whole buffer is scaled with
 * the normalizer fitted at {@link #train} time, both detectors score the buffer, and only the
 * newest position is reported. Verdicts are OR-ed and scores combined with max. Cost per point
 * is linear in the window size.
 *
 * All mutations are serialized on an internal lock; {@link #getStats()} copies state under the
 * same lock so readers never observe a half-applied point.
 */
public class StreamingWindow {

    private static final Logger log = LoggerFactory.getLogger(StreamingWindow.class);

    public static final int DEFAULT_CAPACITY = 100;
    public static final int DEFAULT_MIN_POINTS = 10;

    private final Object lock = new Object();
    private final int capacity;
    private final int minPointsForVerdict;
    private final Normalizer normalizer;
    private final Detector fastDetector;
    private final Detector heavyDetector;
    private final Clock clock;
    private final Instant createdAt;

    private final ArrayDeque<Double> values;
    private final ArrayDeque<Integer> predictions;
    private final ArrayDeque<Double> scores;
    private long totalPointsSeen;
    private long anomalyCount;
    private long verdictCount;
    private boolean trained;

    public StreamingWindow(int capacity, int minPointsForVerdict, Normalizer normalizer,
                           Detector fastDetector, Detector heavyDetector, Clock clock) {
        if (capacity < 1) {
            throw new InvalidConfigurationException("Window capacity must be >= 1, got " + capacity);
        }
        if (minPointsForVerdict < 1 || minPointsForVerdict > capacity) {
            throw new InvalidConfigurationException(String.format(
                    "minPointsForVerdict must be in [1, %d], got %d", capacity, minPointsForVerdict));
        }
        this.capacity = capacity;
        this.minPointsForVerdict = minPointsForVerdict;
        this.normalizer = normalizer;
        this.fastDetector = fastDetector;
        this.heavyDetector = heavyDetector;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.values = new ArrayDeque<>(capacity);
        this.predictions = new ArrayDeque<>(capacity);
        this.scores = new ArrayDeque<>(capacity);
    }

    public StreamingWindow(int capacity, Normalizer normalizer, Detector fastDetector, Detector heavyDetector) {
        this(capacity, DEFAULT_MIN_POINTS, normalizer, fastDetector, heavyDetector, Clock.systemUTC());
    }

    /**
     * Standard scaling, a z-score detector (threshold 2.5) and an isolation forest (8% contamination).
     */
    public StreamingWindow(int capacity) {
        this(capacity, new Normalizer(), new StatisticalDetector(StatisticalDetector.DEFAULT_THRESHOLD),
                new IsolationForestDetector(0.08));
    }

    public StreamingWindow() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Fit the scaler and both detectors once on a representative historical batch.
     */
    public void train(double[] initialBatch) {
        synchronized (lock) {
            double[] normalized = normalizer.transform(initialBatch, true);
            fastDetector.fit(normalized);
            heavyDetector.fit(normalized);
            trained = true;
        }
        log.info("Streaming window trained on {} points (capacity={}, {} + {})",
                initialBatch.length, capacity, fastDetector.getName(), heavyDetector.getName());
    }

    /**
     * Append a point and judge it.
     *
     * @return the verdict for this point, or empty while untrained or while fewer than
     *         {@code minPointsForVerdict} points are buffered
     */
    public Optional<StreamVerdict> addPoint(double value) {
        synchronized (lock) {
            if (values.size() == capacity) {
                values.pollFirst();
            }
            values.addLast(value);
            totalPointsSeen++;

            if (!trained || values.size() < minPointsForVerdict) {
                return Optional.empty();
            }

            double[] buffer = toArray(values);
            double[] normalized = normalizer.transform(buffer, false);
            int last = normalized.length - 1;

            DetectionResult fast = fastDetector.predictWithScores(normalized);
            DetectionResult heavy = heavyDetector.predictWithScores(normalized);
            boolean fastFlag = fast.getPredictions().get(last) == 1;
            boolean heavyFlag = heavy.getPredictions().get(last) == 1;
            double fastScore = fast.getScores().get(last);
            double heavyScore = heavy.getScores().get(last);

            boolean anomaly = fastFlag || heavyFlag;
            double combined = Math.max(fastScore, heavyScore);

            append(predictions, anomaly ? 1 : 0);
            append(scores, combined);
            verdictCount++;
            if (anomaly) {
                anomalyCount++;
            }

            StreamVerdict verdict = new StreamVerdict(totalPointsSeen, value, clock.instant(), anomaly,
                    combined, fastScore, heavyScore, fastFlag, heavyFlag);
            log.debug("Point #{} value={} anomaly={} score={}", totalPointsSeen, value, anomaly, combined);
            return Optional.of(verdict);
        }
    }

    public StreamStats getStats() {
        double[] bufferCopy;
        double[] scoreCopy;
        long total;
        long anomalies;
        long verdicts;
        boolean isTrained;
        synchronized (lock) {
            bufferCopy = toArray(values);
            scoreCopy = toArray(scores);
            total = totalPointsSeen;
            anomalies = anomalyCount;
            verdicts = verdictCount;
            isTrained = trained;
        }

        double min = 0.0, max = 0.0, sum = 0.0;
        if (bufferCopy.length > 0) {
            min = Double.POSITIVE_INFINITY;
            max = Double.NEGATIVE_INFINITY;
            for (double v : bufferCopy) {
                min = Math.min(min, v);
                max = Math.max(max, v);
                sum += v;
            }
        }
        double scoreSum = 0.0, scoreMax = 0.0;
        if (scoreCopy.length > 0) {
            scoreMax = Double.NEGATIVE_INFINITY;
            for (double s : scoreCopy) {
                scoreSum += s;
                scoreMax = Math.max(scoreMax, s);
            }
        }

        return StreamStats.builder()
                .totalPoints(total)
                .anomalies(anomalies)
                .anomalyRate((double) anomalies / Math.max(total, 1))
                .verdicts(verdicts)
                .bufferSize(bufferCopy.length)
                .capacity(capacity)
                .minValue(min)
                .meanValue(bufferCopy.length == 0 ? 0.0 : sum / bufferCopy.length)
                .maxValue(max)
                .avgScore(scoreCopy.length == 0 ? 0.0 : scoreSum / scoreCopy.length)
                .maxScore(scoreMax)
                .trained(isTrained)
                .uptime(Duration.between(createdAt, clock.instant()))
                .build();
    }

    /**
     * Copy of the raw values currently buffered, oldest first.
     */
    public double[] bufferSnapshot() {
        synchronized (lock) {
            return toArray(values);
        }
    }

    /**
     * Copy of the buffered verdicts (1 = anomaly), oldest first.
     */
    public int[] predictionSnapshot() {
        synchronized (lock) {
            int[] out = new int[predictions.size()];
            int i = 0;
            for (Integer p : predictions) {
                out[i++] = p;
            }
            return out;
        }
    }

    public boolean isTrained() {
        synchronized (lock) {
            return trained;
        }
    }

    public int getCapacity() {
        return capacity;
    }

    private <T> void append(ArrayDeque<T> deque, T item) {
        if (deque.size() == capacity) {
            deque.pollFirst();
        }
        deque.addLast(item);
    }

    private static double[] toArray(ArrayDeque<Double> deque) {
        double[] out = new double[deque.size()];
        Iterator<Double> it = deque.iterator();
        for (int i = 0; i < out.length; i++) {
            out[i] = it.next();
        }
        return out;
    }
}
