package com.tsmonitor.anomaly.service;

import com.tsmonitor.anomaly.config.DetectionConfig;
import com.tsmonitor.anomaly.config.MetricsConfig;
import com.tsmonitor.anomaly.exception.InvalidConfigurationException;
import com.tsmonitor.anomaly.model.BatchDetectionReport;
import com.tsmonitor.anomaly.model.DetectionResult;
import com.tsmonitor.anomaly.model.MethodComparison;
import com.tsmonitor.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchDetectionServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private DetectorRegistry detectorRegistry;
    private BatchDetectionService service;

    @BeforeEach
    void setUp() {
        DetectionConfig config = TestDataFactory.smallConfig();
        meterRegistry = new SimpleMeterRegistry();
        MetricsConfig metricsConfig = new MetricsConfig(meterRegistry);
        detectorRegistry = new DetectorRegistry();
        service = new BatchDetectionService(new DetectorFactory(config, metricsConfig),
                detectorRegistry, config, metricsConfig);
    }

    @Test
    void detect_defaultsToStatisticalOnChronologicalSplit() {
        double[] series = TestDataFactory.seriesWithSpike(100, 90, 7L);

        BatchDetectionReport report = service.detect(series, null);

        assertThat(report.getTrainSize()).isEqualTo(80);
        assertThat(report.getTestSize()).isEqualTo(20);
        assertThat(report.getTestData().get(10)).isEqualTo(80.0);
        assertThat(report.getResults()).containsOnlyKeys("statistical");
        DetectionResult result = report.getResults().get("statistical");
        assertThat(result.getPredictions()).hasSize(20);
        assertThat(result.getPredictions().get(10)).isEqualTo(1);
        assertThat(report.getSkipped()).isEmpty();
    }

    @Test
    void detect_runsEveryRequestedMethodAndRegistersIt() {
        double[] series = TestDataFactory.seriesWithSpike(120, 110, 8L);

        BatchDetectionReport report = service.detect(series,
                List.of("statistical", "isolation_forest", "lof", "ensemble"));

        assertThat(report.getResults()).containsOnlyKeys("statistical", "isolation_forest", "lof", "ensemble");
        assertThat(report.getResults().values())
                .allSatisfy(r -> assertThat(r.getPredictions()).hasSize(report.getTestSize()));
        assertThat(report.getResults().get("ensemble").getVotingMode()).isEqualTo("majority");
        assertThat(detectorRegistry.names()).containsExactly("ensemble", "isolation_forest", "lof", "statistical");
        assertThat(detectorRegistry.lastResult("lof")).contains(report.getResults().get("lof"));
        assertThat(meterRegistry.get("detection.batch.count").tag("detector", "isolation_forest")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("detection.point.count").tag("detector", "statistical")
                .counter().count()).isEqualTo(report.getTestSize());
    }

    @Test
    void detect_thresholdOverrideAppliesToStatistical() {
        double[] series = TestDataFactory.seriesWithSpike(100, 90, 9L);

        BatchDetectionReport report = service.detect(series, List.of("statistical"), 1000.0, 0.8);

        assertThat(report.getResults().get("statistical").getThreshold()).isEqualTo(1000.0);
        assertThat(report.getResults().get("statistical").getAnomalyCount()).isZero();
    }

    @Test
    void detect_methodThatCannotFitIsSkipped() {
        double[] series = TestDataFactory.gaussian(10, 5.0, 1.0, 10L);

        // A 10% split leaves a single training point, too few for LOF
        BatchDetectionReport report = service.detect(series, List.of("statistical", "lof"), null, 0.1);

        assertThat(report.getResults()).containsOnlyKeys("statistical");
        assertThat(report.getSkipped()).containsKey("lof");
    }

    @Test
    void detect_rejectsShortSeriesAndUnknownMethods() {
        assertThatThrownBy(() -> service.detect(new double[5], null))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessage("Need at least 10 data points, got 5");
        assertThatThrownBy(() -> service.detect(new double[20], List.of("arima")))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void compare_summarizesStatisticalAndForest() {
        double[] series = TestDataFactory.seriesWithSpike(100, 85, 11L);

        List<MethodComparison> comparison = service.compare(series);

        assertThat(comparison).extracting(MethodComparison::getMethod)
                .containsExactly("statistical", "isolation_forest");
        assertThat(comparison).extracting(MethodComparison::getLabel)
                .containsExactly("Statistical (Z-Score)", "Isolation Forest");
        assertThat(comparison.get(0).getAnomalies()).isGreaterThanOrEqualTo(1);
        assertThatThrownBy(() -> service.compare(new double[19]))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
