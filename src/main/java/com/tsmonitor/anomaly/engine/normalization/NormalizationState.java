package com.tsmonitor.anomaly.engine.normalization;

import lombok.Value;

/**
 * Fitted transform parameters: {@code normalized = (x - center) / scale} per feature.
 * For minmax the center is the minimum and the scale the range.
 */
@Value
public class NormalizationState {

    NormalizationMethod method;
    double[] center;
    double[] scale;
    boolean fitted;

    static NormalizationState unfitted(NormalizationMethod method) {
        return new NormalizationState(method, new double[0], new double[0], false);
    }

    public double[] getCenter() {
        return center.clone();
    }

    public double[] getScale() {
        return scale.clone();
    }

    int features() {
        return center.length;
    }

    double centerAt(int feature) {
        return center[feature];
    }

    double scaleAt(int feature) {
        return scale[feature];
    }
}
