package com.tsmonitor.anomaly.service;

import com.tsmonitor.anomaly.engine.Detector;
import com.tsmonitor.anomaly.exception.AnomalyDetectionException;
import com.tsmonitor.anomaly.model.DetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Named detectors shared by callers of the engine.
 *
 * Every entry has its own read/write lock: fitting and threshold changes take the write lock
 * (one writer per entry), scoring takes the read lock. Entries are independent of each other.
 */
@Component
public class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public void register(String name, Detector detector) {
        Entry previous = entries.put(name, new Entry(detector));
        if (previous != null) {
            log.info("Replaced detector '{}' ({} -> {})", name,
                    previous.detector.getName(), detector.getName());
        } else {
            log.info("Registered detector '{}' -> {}", name, detector.getName());
        }
    }

    /**
     * Fit the named detector under its write lock.
     */
    public void fit(String name, double[] data) {
        Entry entry = require(name);
        entry.lock.writeLock().lock();
        try {
            entry.detector.fit(data);
        } finally {
            entry.lock.writeLock().unlock();
        }
    }

    public void setThreshold(String name, double threshold) {
        Entry entry = require(name);
        entry.lock.writeLock().lock();
        try {
            entry.detector.setThreshold(threshold);
        } finally {
            entry.lock.writeLock().unlock();
        }
    }

    /**
     * Score a batch with the named detector and remember the result as that entry's latest.
     */
    public DetectionResult detect(String name, double[] data) {
        Entry entry = require(name);
        DetectionResult result;
        entry.lock.readLock().lock();
        try {
            result = entry.detector.predictWithScores(data);
        } finally {
            entry.lock.readLock().unlock();
        }
        entry.lastResult = result;
        return result;
    }

    public void recordResult(String name, DetectionResult result) {
        require(name).lastResult = result;
    }

    public Optional<DetectionResult> lastResult(String name) {
        Entry entry = entries.get(name);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.lastResult);
    }

    public Optional<Detector> find(String name) {
        Entry entry = entries.get(name);
        return entry == null ? Optional.empty() : Optional.of(entry.detector);
    }

    public boolean remove(String name) {
        return entries.remove(name) != null;
    }

    public Set<String> names() {
        return new TreeSet<>(entries.keySet());
    }

    /**
     * Fitted metadata of every registered detector, keyed by entry name.
     */
    public Map<String, Map<String, Object>> describe() {
        Map<String, Map<String, Object>> out = new TreeMap<>();
        entries.forEach((name, entry) -> out.put(name, entry.detector.getMetadata()));
        return out;
    }

    private Entry require(String name) {
        Entry entry = entries.get(name);
        if (entry == null) {
            throw new AnomalyDetectionException("No detector registered under '" + name + "'");
        }
        return entry;
    }

    private static final class Entry {
        private final Detector detector;
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private volatile DetectionResult lastResult;

        private Entry(Detector detector) {
            this.detector = detector;
        }
    }
}
