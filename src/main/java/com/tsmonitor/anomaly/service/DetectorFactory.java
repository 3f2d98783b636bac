package com.tsmonitor.anomaly.service;

import com.tsmonitor.anomaly.config.DetectionConfig;
import com.tsmonitor.anomaly.config.MetricsConfig;
import com.tsmonitor.anomaly.engine.Detector;
import com.tsmonitor.anomaly.engine.DetectorType;
import com.tsmonitor.anomaly.engine.ensemble.EnsembleConfig;
import com.tsmonitor.anomaly.engine.ensemble.EnsembleDetector;
import com.tsmonitor.anomaly.engine.ensemble.VotingMode;
import com.tsmonitor.anomaly.engine.isolationforest.IsolationForestDetector;
import com.tsmonitor.anomaly.engine.lof.LofDetector;
import com.tsmonitor.anomaly.engine.normalization.Normalizer;
import com.tsmonitor.anomaly.engine.statistical.StatisticalDetector;
import com.tsmonitor.anomaly.engine.statistical.StatisticalMethod;
import com.tsmonitor.anomaly.engine.streaming.StreamingWindow;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Builds unfitted detectors, scalers and stream windows from {@link DetectionConfig}.
 * String settings are parsed here, so a bad method name fails when the first detector is built.
 */
@Component
public class DetectorFactory {

    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public DetectorFactory(DetectionConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = Clock.systemUTC();
    }

    public Detector create(String method) {
        return create(DetectorType.fromValue(method));
    }

    public Detector create(DetectorType type) {
        return switch (type) {
            case STATISTICAL -> statistical(config.getStatistical().getThreshold());
            case ISOLATION_FOREST -> isolationForest(config.getIsolationForest().getContamination());
            case LOF -> new LofDetector(config.getLof().getNeighbors(), config.getLof().getContamination());
            case ENSEMBLE -> ensemble();
        };
    }

    public StatisticalDetector statistical(double threshold) {
        DetectionConfig.Statistical s = config.getStatistical();
        return new StatisticalDetector(threshold, StatisticalMethod.fromValue(s.getMethod()), s.getWindow());
    }

    public IsolationForestDetector isolationForest(double contamination) {
        DetectionConfig.IsolationForest f = config.getIsolationForest();
        return new IsolationForestDetector(contamination, f.getNumTrees(), f.getSampleSize(), f.getSeed());
    }

    public EnsembleDetector ensemble() {
        DetectionConfig.Ensemble e = config.getEnsemble();
        DetectionConfig.IsolationForest f = config.getIsolationForest();
        List<Detector> members = List.of(
                new StatisticalDetector(e.getStatisticalThreshold(), StatisticalMethod.ZSCORE),
                new IsolationForestDetector(e.getContamination(), f.getNumTrees(), f.getSampleSize(), f.getSeed()),
                new LofDetector(e.getNeighbors(), e.getContamination()));

        VotingMode mode = VotingMode.fromValue(e.getVoting());
        EnsembleDetector ensemble = new EnsembleDetector(members,
                EnsembleConfig.of(mode, e.getWeights(), members.size()));
        if (mode == VotingMode.WEIGHTED) {
            ensemble.setThreshold(e.getWeightedThreshold());
        }
        ensemble.setMemberFailureListener((member, phase, error) ->
                metricsConfig.recordMemberFailure(member.getName(), phase));
        return ensemble;
    }

    public Normalizer normalizer() {
        return new Normalizer(config.getNormalizationMethod());
    }

    /**
     * Window over a z-score detector and an isolation forest, sized and tuned from the streaming settings.
     */
    public StreamingWindow streamingWindow() {
        DetectionConfig.Streaming s = config.getStreaming();
        return new StreamingWindow(s.getCapacity(), s.getMinPointsForVerdict(), normalizer(),
                new StatisticalDetector(s.getStatisticalThreshold(), StatisticalMethod.ZSCORE),
                isolationForest(s.getContamination()),
                clock);
    }
}
