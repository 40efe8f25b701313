package com.experiment.framework.core;

import com.experiment.framework.core.analysis.MultipleTestingCorrection;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable engine settings. Built from {@code experiment.framework.*} properties in a Spring context,
 * or directly with the builder in plain Java.
 */
@Value
@Builder(toBuilder = true)
public class FrameworkSettings {

    public static final int MIN_BAYESIAN_SIMULATIONS = 10_000;

    @Builder.Default
    double confidenceLevel = 0.95;
    @Builder.Default
    double power = 0.8;
    /** Floor for the per-variant sample size produced by power analysis. */
    @Builder.Default
    int minSampleSize = 100;
    @Builder.Default
    Duration maxExperimentDuration = Duration.ofDays(30);
    @Builder.Default
    MultipleTestingCorrection multipleTestingCorrection = MultipleTestingCorrection.BONFERRONI;
    @Builder.Default
    boolean enableBayesian = true;
    @Builder.Default
    boolean enableSequentialTesting = true;
    @Builder.Default
    int bayesianSimulations = MIN_BAYESIAN_SIMULATIONS;
    @Builder.Default
    double bayesianDecisionThreshold = 0.95;
    @Builder.Default
    double banditEpsilon = 0.1;
    @Builder.Default
    double banditLearningRate = 0.01;
    @Builder.Default
    int defaultDailyTraffic = 1000;

    public static FrameworkSettings defaults() {
        return FrameworkSettings.builder().build();
    }

    public double getAlpha() {
        return 1.0 - confidenceLevel;
    }

    public int getEffectiveBayesianSimulations() {
        return Math.max(bayesianSimulations, MIN_BAYESIAN_SIMULATIONS);
    }
}
