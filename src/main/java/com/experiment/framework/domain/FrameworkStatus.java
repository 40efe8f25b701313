package com.experiment.framework.domain;

import com.experiment.framework.core.FrameworkPerformanceMetrics;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class FrameworkStatus {

    boolean initialized;
    int totalExperiments;
    int activeExperiments;
    int stoppedExperiments;
    FrameworkPerformanceMetrics.Snapshot performance;
    /** Engine name to its capabilities, or "disabled". */
    Map<String, Object> engines;
}
