package com.experiment.framework.core.shadow;

import lombok.Value;

import java.time.Instant;

@Value
public class ShadowMetric {

    String userId;
    String metric;
    double value;
    Instant timestamp;
    boolean shadow;
}
