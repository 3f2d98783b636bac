package com.tsmonitor.anomaly.service;

import com.tsmonitor.anomaly.config.DetectionConfig;
import com.tsmonitor.anomaly.config.MetricsConfig;
import com.tsmonitor.anomaly.engine.streaming.StreamStats;
import com.tsmonitor.anomaly.engine.streaming.StreamVerdict;
import com.tsmonitor.anomaly.engine.streaming.StreamingWindow;
import com.tsmonitor.anomaly.exception.UnknownStreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Live monitoring of any number of independent sources, one {@link StreamingWindow} each.
 *
 * Producers hand points over with {@link #publish}; the scheduled {@link #drainInboxes} loop is
 * the single writer that feeds them into the windows in arrival order. {@link #process} applies a
 * point immediately for callers that need the verdict inline; the window's own lock keeps it
 * serialized with the drain loop. Readers only ever get copies.
 */
@Service
public class StreamMonitorService {

    private static final Logger log = LoggerFactory.getLogger(StreamMonitorService.class);

    private final DetectorFactory detectorFactory;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    private final ConcurrentHashMap<String, MonitoredStream> streams = new ConcurrentHashMap<>();

    public StreamMonitorService(DetectorFactory detectorFactory, DetectionConfig config,
                                MetricsConfig metricsConfig) {
        this.detectorFactory = detectorFactory;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Create (or replace) the window for {@code source} and train it on historical values.
     * Points still queued for a replaced window move to the new one, in order.
     */
    public void open(String source, double[] history) {
        StreamingWindow window = detectorFactory.streamingWindow();
        window.train(history);
        MonitoredStream opened = new MonitoredStream(window, config.getStreaming().getRecentAnomalyCapacity());
        MonitoredStream previous = streams.put(source, opened);
        metricsConfig.updateActiveStreams(streams.size());
        if (previous == null) {
            log.info("Opened stream '{}' trained on {} points", source, history.length);
            return;
        }
        int carried = previous.inbox.drainTo(opened.inbox);
        log.info("Reopened stream '{}' trained on {} points, {} queued points carried over",
                source, history.length, carried);
    }

    public boolean close(String source) {
        MonitoredStream removed = streams.remove(source);
        metricsConfig.updateActiveStreams(streams.size());
        if (removed != null) {
            log.info("Closed stream '{}' after {} points", source, removed.window.getStats().getTotalPoints());
        }
        return removed != null;
    }

    /**
     * Queue a point for the drain loop.
     */
    public void publish(String source, double value) {
        require(source).inbox.add(value);
    }

    /**
     * Apply a point now and return its verdict, if the window can judge it yet.
     */
    public Optional<StreamVerdict> process(String source, double value) {
        return apply(source, require(source), value);
    }

    @Scheduled(fixedDelayString = "${detection.streaming.drain-interval-ms:1000}")
    public void drainInboxes() {
        streams.forEach((source, stream) -> {
            List<Double> batch = new ArrayList<>();
            stream.inbox.drainTo(batch);
            for (Double value : batch) {
                try {
                    apply(source, stream, value);
                } catch (RuntimeException e) {
                    // Keep draining the remaining sources; the failing point is dropped
                    log.error("Failed to process point {} for stream '{}'", value, source, e);
                }
            }
        });
    }

    public StreamStats getStats(String source) {
        return require(source).window.getStats();
    }

    /**
     * Most recent anomaly verdicts for the source, oldest first.
     */
    public List<StreamVerdict> getRecentAnomalies(String source) {
        MonitoredStream stream = require(source);
        synchronized (stream.recentAnomalies) {
            return List.copyOf(stream.recentAnomalies);
        }
    }

    public Optional<StreamVerdict> getLastVerdict(String source) {
        return Optional.ofNullable(require(source).lastVerdict);
    }

    public int pendingPoints(String source) {
        return require(source).inbox.size();
    }

    public Set<String> sources() {
        return new TreeSet<>(streams.keySet());
    }

    private Optional<StreamVerdict> apply(String source, MonitoredStream stream, double value) {
        Optional<StreamVerdict> verdict = stream.window.addPoint(value);
        verdict.ifPresent(v -> {
            stream.lastVerdict = v;
            metricsConfig.recordStreamPoint(source, v.anomaly(), v.score());
            if (v.anomaly()) {
                stream.rememberAnomaly(v);
                log.warn("ANOMALY DETECTED in '{}': value={} score={} (statistical={}, isolation={})",
                        source, value, String.format("%.4f", v.score()),
                        v.fastFlagged(), v.heavyFlagged());
            }
        });
        return verdict;
    }

    private MonitoredStream require(String source) {
        MonitoredStream stream = streams.get(source);
        if (stream == null) {
            throw new UnknownStreamException(source);
        }
        return stream;
    }

    private static final class MonitoredStream {
        private final StreamingWindow window;
        private final LinkedBlockingQueue<Double> inbox = new LinkedBlockingQueue<>();
        private final ArrayDeque<StreamVerdict> recentAnomalies;
        private final int recentCapacity;
        private volatile StreamVerdict lastVerdict;

        private MonitoredStream(StreamingWindow window, int recentCapacity) {
            this.window = window;
            this.recentCapacity = Math.max(1, recentCapacity);
            this.recentAnomalies = new ArrayDeque<>(this.recentCapacity);
        }

        private void rememberAnomaly(StreamVerdict verdict) {
            synchronized (recentAnomalies) {
                if (recentAnomalies.size() == recentCapacity) {
                    recentAnomalies.pollFirst();
                }
                recentAnomalies.addLast(verdict);
            }
        }
    }
}
