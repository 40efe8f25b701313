package com.experiment.framework.core.analysis;

import lombok.Value;

/**
 * Two-sided interval at the given level. Used both for frequentist confidence intervals and Bayesian credible intervals.
 */
@Value
public class ConfidenceInterval {

    double lower;
    double upper;
    double level;

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
