package com.tsmonitor.anomaly.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MethodComparison {
    String method;
    String label;
    int anomalies;
    double rate;
    double meanScore;
    double maxScore;
}
