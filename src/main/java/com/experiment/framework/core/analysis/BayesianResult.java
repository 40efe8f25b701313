package com.experiment.framework.core.analysis;

import com.experiment.framework.domain.MetricType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class BayesianResult {

    MetricPosterior primaryMetric;
    @Singular(ignoreNullCollections = true)
    Map<String, MetricPosterior> secondaryMetrics;
    @Singular(ignoreNullCollections = true)
    Map<String, String> failedMetrics;

    /**
     * Posterior comparison of every variant on one metric.
     */
    @Value
    @Builder
    public static class MetricPosterior {
        String metric;
        MetricType metricType;
        @Singular(ignoreNullCollections = true)
        Map<String, Posterior> posteriors;
        @Singular(value = "variantProbabilityOfBeingBest", ignoreNullCollections = true)
        Map<String, Double> probabilityOfBeingBest;
        @Singular(value = "variantExpectedLoss", ignoreNullCollections = true)
        Map<String, Double> expectedLoss;
        @Singular(ignoreNullCollections = true)
        Map<String, ConfidenceInterval> credibleIntervals;
        /** Variant whose probability of being best exceeds the decision threshold; null if none does. */
        String leadingVariant;
        int simulations;
    }

    /**
     * Beta(alpha, beta) for binary metrics, Normal(mu, 1/tau) for continuous ones. Unused parameters are null.
     */
    @Value
    @Builder
    public static class Posterior {
        Double alpha;
        Double beta;
        Double mu;
        Double tau;
        double mean;
        double variance;
        int sampleSize;
    }
}
