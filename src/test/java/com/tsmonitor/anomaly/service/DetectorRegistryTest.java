package com.tsmonitor.anomaly.service;

import com.tsmonitor.anomaly.engine.statistical.StatisticalDetector;
import com.tsmonitor.anomaly.exception.AnomalyDetectionException;
import com.tsmonitor.anomaly.model.DetectionResult;
import com.tsmonitor.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorRegistryTest {

    private DetectorRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DetectorRegistry();
        registry.register("cpu", new StatisticalDetector(2.5));
    }

    @Test
    void fitThenDetect_remembersLastResult() {
        registry.fit("cpu", TestDataFactory.gaussian(100, 0.0, 1.0, 61L));

        DetectionResult result = registry.detect("cpu", new double[] {0.0, 9.0});

        assertThat(result.getPredictions()).containsExactly(0, 1);
        assertThat(registry.lastResult("cpu")).contains(result);
        assertThat(registry.lastResult("memory")).isEmpty();
        assertThat(registry.describe()).containsKey("cpu");
        assertThat(registry.describe().get("cpu")).containsKey("mean");
    }

    @Test
    void setThreshold_changesSubsequentVerdicts() {
        registry.fit("cpu", TestDataFactory.gaussian(100, 0.0, 1.0, 62L));
        registry.setThreshold("cpu", 20.0);

        assertThat(registry.detect("cpu", new double[] {9.0}).getPredictions()).containsExactly(0);
        assertThat(registry.find("cpu").orElseThrow().getThreshold()).isEqualTo(20.0);
    }

    @Test
    void unknownName_isRejected() {
        assertThatThrownBy(() -> registry.detect("disk", new double[] {1.0}))
                .isInstanceOf(AnomalyDetectionException.class)
                .hasMessageContaining("disk");
        assertThat(registry.remove("disk")).isFalse();
        assertThat(registry.remove("cpu")).isTrue();
        assertThat(registry.names()).isEmpty();
    }

    @Test
    void concurrentReadersAndRefits_alwaysSeeAConsistentModel() throws Exception {
        double[] train = TestDataFactory.gaussian(200, 0.0, 1.0, 63L);
        registry.fit("cpu", train);
        double[] probe = {0.0, 10.0};
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<DetectionResult>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                if (i % 20 == 0) {
                    pool.submit(() -> registry.fit("cpu", train));
                }
                futures.add(pool.submit(() -> registry.detect("cpu", probe)));
            }
            for (Future<DetectionResult> f : futures) {
                assertThat(f.get(10, TimeUnit.SECONDS).getPredictions()).containsExactly(0, 1);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
