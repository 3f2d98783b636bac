package com.tsmonitor.anomaly.service;

import com.tsmonitor.anomaly.config.DetectionConfig;
import com.tsmonitor.anomaly.config.MetricsConfig;
import com.tsmonitor.anomaly.engine.Detector;
import com.tsmonitor.anomaly.engine.DetectorType;
import com.tsmonitor.anomaly.engine.ensemble.EnsembleDetector;
import com.tsmonitor.anomaly.engine.ensemble.VotingMode;
import com.tsmonitor.anomaly.engine.isolationforest.IsolationForestDetector;
import com.tsmonitor.anomaly.engine.lof.LofDetector;
import com.tsmonitor.anomaly.engine.normalization.NormalizationMethod;
import com.tsmonitor.anomaly.engine.statistical.StatisticalDetector;
import com.tsmonitor.anomaly.engine.statistical.StatisticalMethod;
import com.tsmonitor.anomaly.engine.streaming.StreamingWindow;
import com.tsmonitor.anomaly.exception.InvalidConfigurationException;
import com.tsmonitor.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DetectorFactoryTest {

    @Mock
    private MetricsConfig metricsConfig;

    private DetectionConfig config;
    private DetectorFactory factory;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.smallConfig();
        factory = new DetectorFactory(config, metricsConfig);
    }

    @Test
    void create_buildsUnfittedDetectorPerMethodName() {
        assertThat(factory.create("statistical")).isInstanceOf(StatisticalDetector.class);
        assertThat(factory.create("isolation_forest")).isInstanceOf(IsolationForestDetector.class);
        assertThat(factory.create("lof")).isInstanceOf(LofDetector.class);
        assertThat(factory.create(DetectorType.ENSEMBLE)).isInstanceOf(EnsembleDetector.class);
        assertThat(factory.create("statistical").isFitted()).isFalse();
    }

    @Test
    void create_appliesConfiguredSettings() {
        config.getStatistical().setThreshold(3.5);
        config.getStatistical().setMethod("iqr");
        config.getLof().setNeighbors(7);

        StatisticalDetector statistical = (StatisticalDetector) factory.create("statistical");
        LofDetector lof = (LofDetector) factory.create("lof");

        assertThat(statistical.getThreshold()).isEqualTo(3.5);
        assertThat(statistical.getMethod()).isEqualTo(StatisticalMethod.IQR);
        assertThat(lof.getNeighbors()).isEqualTo(7);
        assertThat(factory.isolationForest(0.2).getContamination()).isEqualTo(0.2);
    }

    @Test
    void weightedEnsemble_usesWeightedBoundary() {
        config.getEnsemble().setVoting("weighted");
        config.getEnsemble().setWeights(List.of(2.0, 1.0, 1.0));

        EnsembleDetector ensemble = factory.ensemble();

        assertThat(ensemble.getConfig().getVotingMode()).isEqualTo(VotingMode.WEIGHTED);
        assertThat(ensemble.getConfig().getWeights()).containsExactly(0.5, 0.25, 0.25);
        assertThat(ensemble.getThreshold()).isEqualTo(0.6);
    }

    @Test
    void ensembleMemberFailures_areReportedToMetrics() {
        Detector ensemble = factory.ensemble();

        // A single point is too few for the forest and for LOF; the z-score member still fits
        ensemble.fit(new double[] {1.0});

        verify(metricsConfig, times(2)).recordMemberFailure(anyString(), eq("fit"));
        assertThat(ensemble.isFitted()).isTrue();
    }

    @Test
    void unknownNames_failAtBuildTime() {
        assertThatThrownBy(() -> factory.create("prophet"))
                .isInstanceOf(InvalidConfigurationException.class);

        config.getStatistical().setMethod("grubbs");
        assertThatThrownBy(() -> factory.create("statistical"))
                .isInstanceOf(InvalidConfigurationException.class);

        config.setNormalizationMethod("quantile");
        assertThatThrownBy(() -> factory.normalizer())
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void streamingWindow_isSizedFromStreamingSettings() {
        config.setNormalizationMethod("robust");

        StreamingWindow window = factory.streamingWindow();

        assertThat(window.getCapacity()).isEqualTo(50);
        assertThat(window.isTrained()).isFalse();
        assertThat(factory.normalizer().getMethod()).isEqualTo(NormalizationMethod.ROBUST);
    }
}
