package com.experiment.framework.core.analysis;

import com.experiment.framework.domain.MetricType;
import lombok.Value;

import java.time.Duration;

@Value
public class PowerAnalysisResult {

    long sampleSizePerVariant;
    long totalSampleSize;
    Duration minRunTime;
    MetricType metricType;
    PowerAnalysisRequest parameters;
}
