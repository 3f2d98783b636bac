package com.tsmonitor.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeStreams;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeStreams = registry.gauge("stream.active.count", new AtomicInteger(0));
    }

    public void recordBatch(String detector, int points, int anomalies) {
        Counter.builder("detection.batch.count")
                .tag("detector", detector)
                .register(registry)
                .increment();

        Counter.builder("detection.point.count")
                .tag("detector", detector)
                .register(registry)
                .increment(points);

        Counter.builder("detection.anomaly.count")
                .tag("detector", detector)
                .register(registry)
                .increment(anomalies);
    }

    public void recordMemberFailure(String member, String phase) {
        Counter.builder("ensemble.member.failure.count")
                .tag("member", member)
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordStreamPoint(String source, boolean anomaly, double score) {
        Counter.builder("stream.point.count")
                .tag("source", source)
                .register(registry)
                .increment();

        DistributionSummary.builder("stream.score")
                .tag("source", source)
                .register(registry)
                .record(score);

        if (anomaly) {
            Counter.builder("stream.anomaly.count")
                    .tag("source", source)
                    .register(registry)
                    .increment();
        }
    }

    public void updateActiveStreams(int count) {
        activeStreams.set(count);
    }
}
