package com.experiment.framework.core.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Frequentist comparison of control vs treatment for the primary metric and each secondary metric.
 * Secondary metrics that could not be tested are listed in {@code failedMetrics} with the reason.
 */
@Value
@Builder
public class FrequentistResult {

    MetricTestResult primaryMetric;
    @Singular(ignoreNullCollections = true)
    Map<String, MetricTestResult> secondaryMetrics;
    @Singular(ignoreNullCollections = true)
    Map<String, String> failedMetrics;
    SampleRatioCheck sampleRatioCheck;
    /** Null when only one metric was tested. */
    MultipleTestingCorrection correction;

    @Value
    @Builder(toBuilder = true)
    public static class MetricTestResult {
        String metric;
        TestType testType;
        double statistic;
        double pValue;
        /** Set when a multiple testing correction was applied, else equal to pValue. */
        double adjustedPValue;
        /** Welch-Satterthwaite df for the t-test, 1 for chi-square, null for Mann-Whitney. */
        Double degreesOfFreedom;
        /** Normal approximation z for Mann-Whitney; null otherwise. */
        Double zScore;
        int controlSampleSize;
        int treatmentSampleSize;
        double controlMean;
        double treatmentMean;
        /** treatment mean minus control mean (rate difference for binary metrics). */
        double difference;
        /** difference / control mean; null when the control mean is 0. */
        Double relativeDifference;
        double effectSize;
        String effectSizeType;
        ConfidenceInterval confidenceInterval;
        boolean significant;
    }

    /**
     * Chi-square goodness of fit of observed users per variant against the configured weights.
     */
    @Value
    public static class SampleRatioCheck {
        boolean mismatchDetected;
        double chiSquare;
        double pValue;
        int degreesOfFreedom;
        Map<String, Integer> observed;
        Map<String, Double> expected;
    }
}
