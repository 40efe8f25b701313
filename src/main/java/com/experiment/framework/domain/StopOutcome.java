package com.experiment.framework.domain;

import com.experiment.framework.core.analysis.AnalysisResult;
import lombok.Value;

/**
 * Result of stopping an experiment: the stopped snapshot and its final analysis
 * (null when the final analysis itself failed).
 */
@Value
public class StopOutcome {

    Experiment experiment;
    AnalysisResult results;
}
