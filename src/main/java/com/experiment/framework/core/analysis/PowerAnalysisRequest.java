package com.experiment.framework.core.analysis;

import com.experiment.framework.domain.MetricType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PowerAnalysisRequest {

    double baselineRate;
    double minimumDetectableEffect;
    double confidenceLevel;
    double power;
    int variants;
    MetricType metricType;
    /** Continuous metrics only; defaults to 0.5 * baselineRate when null. */
    Double standardDeviation;
    int dailyTraffic;
}
