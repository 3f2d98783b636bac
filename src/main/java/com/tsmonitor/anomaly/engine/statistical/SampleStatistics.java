package com.tsmonitor.anomaly.engine.statistical;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Location and spread of a training sample.
 *
 * std is the population standard deviation; quartiles use linear interpolation between
 * closest ranks.
 */
public record SampleStatistics(double mean, double std, double median, double mad,
                               double q1, double q3) {

    public static SampleStatistics of(double[] data) {
        DescriptiveStatistics stats = descriptive(data);
        double median = stats.getPercentile(50.0);

        double[] deviations = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            deviations[i] = Math.abs(data[i] - median);
        }
        double mad = descriptive(deviations).getPercentile(50.0);

        return new SampleStatistics(
                stats.getMean(),
                Math.sqrt(stats.getPopulationVariance()),
                median,
                mad,
                stats.getPercentile(25.0),
                stats.getPercentile(75.0));
    }

    public double iqr() {
        return q3 - q1;
    }

    public double lowerFence() {
        return q1 - 1.5 * iqr();
    }

    public double upperFence() {
        return q3 + 1.5 * iqr();
    }

    private static DescriptiveStatistics descriptive(double[] values) {
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        stats.setPercentileImpl(new Percentile().withEstimationType(Percentile.EstimationType.R_7));
        return stats;
    }
}
