package com.tsmonitor.anomaly.service;

import com.tsmonitor.anomaly.config.DetectionConfig;
import com.tsmonitor.anomaly.config.MetricsConfig;
import com.tsmonitor.anomaly.engine.streaming.StreamStats;
import com.tsmonitor.anomaly.engine.streaming.StreamVerdict;
import com.tsmonitor.anomaly.exception.UnknownStreamException;
import com.tsmonitor.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamMonitorServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private StreamMonitorService service;

    @BeforeEach
    void setUp() {
        DetectionConfig config = TestDataFactory.smallConfig();
        config.getStreaming().setRecentAnomalyCapacity(3);
        meterRegistry = new SimpleMeterRegistry();
        MetricsConfig metricsConfig = new MetricsConfig(meterRegistry);
        service = new StreamMonitorService(new DetectorFactory(config, metricsConfig), config, metricsConfig);
        service.open("cpu", TestDataFactory.gaussian(200, 50.0, 1.0, 71L));
    }

    private void feedNormal(String source, int n, long seed) {
        for (double v : TestDataFactory.gaussian(n, 50.0, 1.0, seed)) {
            service.process(source, v);
        }
    }

    @Test
    void process_flagsSpikeAndRemembersIt() {
        feedNormal("cpu", 15, 72L);

        Optional<StreamVerdict> verdict = service.process("cpu", 80.0);

        assertThat(verdict).isPresent();
        assertThat(verdict.get().anomaly()).isTrue();
        assertThat(service.getLastVerdict("cpu")).isEqualTo(verdict);
        assertThat(service.getRecentAnomalies("cpu")).last()
                .satisfies(v -> assertThat(v.value()).isEqualTo(80.0));
        assertThat(meterRegistry.get("stream.anomaly.count").tag("source", "cpu").counter().count())
                .isGreaterThanOrEqualTo(1.0);
        assertThat(meterRegistry.get("stream.point.count").tag("source", "cpu").counter().count())
                .isEqualTo(16 - 9);
    }

    @Test
    void recentAnomalies_areBounded() {
        feedNormal("cpu", 15, 73L);
        for (int i = 0; i < 6; i++) {
            service.process("cpu", 90.0 + i * 10);
        }

        assertThat(service.getRecentAnomalies("cpu")).hasSize(3);
    }

    @Test
    void publishedPoints_areAppliedByDrain() {
        for (double v : TestDataFactory.gaussian(12, 50.0, 1.0, 74L)) {
            service.publish("cpu", v);
        }
        assertThat(service.pendingPoints("cpu")).isEqualTo(12);
        assertThat(service.getStats("cpu").getTotalPoints()).isZero();

        service.drainInboxes();

        StreamStats stats = service.getStats("cpu");
        assertThat(service.pendingPoints("cpu")).isZero();
        assertThat(stats.getTotalPoints()).isEqualTo(12);
        assertThat(stats.getVerdicts()).isEqualTo(3);
        assertThat(stats.isTrained()).isTrue();
    }

    @Test
    void reopen_carriesQueuedPointsToTheNewWindow() {
        feedNormal("cpu", 12, 77L);
        for (double v : TestDataFactory.gaussian(5, 50.0, 1.0, 78L)) {
            service.publish("cpu", v);
        }

        service.open("cpu", TestDataFactory.gaussian(200, 50.0, 1.0, 79L));

        assertThat(service.pendingPoints("cpu")).isEqualTo(5);
        assertThat(service.getStats("cpu").getTotalPoints()).isZero();
        service.drainInboxes();
        assertThat(service.getStats("cpu").getTotalPoints()).isEqualTo(5);
    }

    @Test
    void sourcesAreIndependent() {
        service.open("memory", TestDataFactory.gaussian(200, 1000.0, 20.0, 75L));
        feedNormal("cpu", 20, 76L);

        assertThat(service.sources()).containsExactly("cpu", "memory");
        assertThat(service.getStats("memory").getTotalPoints()).isZero();
        assertThat(meterRegistry.get("stream.active.count").gauge().value()).isEqualTo(2.0);

        assertThat(service.close("memory")).isTrue();
        assertThat(service.close("memory")).isFalse();
        assertThat(meterRegistry.get("stream.active.count").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void unknownSource_isRejected() {
        assertThatThrownBy(() -> service.process("disk", 1.0)).isInstanceOf(UnknownStreamException.class);
        assertThatThrownBy(() -> service.publish("disk", 1.0)).isInstanceOf(UnknownStreamException.class);
        assertThatThrownBy(() -> service.getStats("disk")).isInstanceOf(UnknownStreamException.class);
    }
}
