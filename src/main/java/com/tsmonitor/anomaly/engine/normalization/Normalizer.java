package com.tsmonitor.anomaly.engine.normalization;

import com.tsmonitor.anomaly.exception.DegenerateInputException;
import com.tsmonitor.anomaly.exception.InvalidConfigurationException;
import com.tsmonitor.anomaly.exception.UnfittedStateException;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits a per-feature scaling transform on a reference sample and applies or reverses it.
 *
 * A feature whose spread is zero (constant column) gets a scale of 1 so that it is only
 * re-centered, which keeps {@link #inverse} exact.
 */
public class Normalizer {

    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    private final NormalizationMethod method;
    private volatile NormalizationState state;

    public Normalizer(NormalizationMethod method) {
        this.method = method;
        this.state = NormalizationState.unfitted(method);
    }

    public Normalizer(String method) {
        this(NormalizationMethod.fromValue(method));
    }

    public Normalizer() {
        this(NormalizationMethod.STANDARD);
    }

    public void fit(double[] sample) {
        fit(column(sample));
    }

    public void fit(double[][] sample) {
        if (sample == null || sample.length == 0) {
            throw new DegenerateInputException("Normalizer cannot be fitted on an empty sample");
        }
        int features = sample[0].length;
        double[] center = new double[features];
        double[] scale = new double[features];

        for (int f = 0; f < features; f++) {
            double[] values = feature(sample, f);
            switch (method) {
                case STANDARD -> {
                    DescriptiveStatistics stats = new DescriptiveStatistics(values);
                    center[f] = stats.getMean();
                    scale[f] = Math.sqrt(stats.getPopulationVariance());
                }
                case MINMAX -> {
                    DescriptiveStatistics stats = new DescriptiveStatistics(values);
                    center[f] = stats.getMin();
                    scale[f] = stats.getMax() - stats.getMin();
                }
                case ROBUST -> {
                    Percentile percentile = linearPercentile();
                    percentile.setData(values);
                    center[f] = percentile.evaluate(50.0);
                    scale[f] = percentile.evaluate(75.0) - percentile.evaluate(25.0);
                }
            }
            if (scale[f] == 0.0) {
                log.warn("Feature {} has zero spread under {} scaling; values will only be re-centered",
                        f, method.getValue());
                scale[f] = 1.0;
            }
        }

        this.state = new NormalizationState(method, center, scale, true);
        log.debug("Fitted {} normalizer on {} samples x {} features", method.getValue(), sample.length, features);
    }

    /**
     * Scale a univariate series, fitting on it first when {@code fit} is true.
     */
    public double[] transform(double[] data, boolean fit) {
        return flatten(transform(column(data), fit));
    }

    public double[][] transform(double[][] data, boolean fit) {
        if (fit) {
            fit(data);
        }
        NormalizationState current = requireFitted(data);
        double[][] out = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            out[i] = new double[data[i].length];
            for (int f = 0; f < data[i].length; f++) {
                out[i][f] = (data[i][f] - current.centerAt(f)) / current.scaleAt(f);
            }
        }
        return out;
    }

    public double[] inverse(double[] data) {
        return flatten(inverse(column(data)));
    }

    public double[][] inverse(double[][] data) {
        NormalizationState current = requireFitted(data);
        double[][] out = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            out[i] = new double[data[i].length];
            for (int f = 0; f < data[i].length; f++) {
                out[i][f] = data[i][f] * current.scaleAt(f) + current.centerAt(f);
            }
        }
        return out;
    }

    public boolean isFitted() {
        return state.isFitted();
    }

    public NormalizationMethod getMethod() {
        return method;
    }

    public NormalizationState getState() {
        return state;
    }

    private NormalizationState requireFitted(double[][] data) {
        NormalizationState current = state;
        if (!current.isFitted()) {
            throw new UnfittedStateException("Normalizer");
        }
        if (data.length > 0 && data[0].length != current.features()) {
            throw new InvalidConfigurationException(String.format(
                    "Normalizer was fitted on %d features but received %d", current.features(), data[0].length));
        }
        return current;
    }

    static Percentile linearPercentile() {
        // R_7 is the linear interpolation numpy uses by default
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7);
    }

    private static double[][] column(double[] data) {
        double[][] rows = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            rows[i] = new double[] {data[i]};
        }
        return rows;
    }

    private static double[] flatten(double[][] rows) {
        double[] out = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            out[i] = rows[i][0];
        }
        return out;
    }

    private static double[] feature(double[][] sample, int f) {
        double[] values = new double[sample.length];
        for (int i = 0; i < sample.length; i++) {
            values[i] = sample[i][f];
        }
        return values;
    }
}
