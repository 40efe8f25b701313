package com.experiment.framework.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Caller-supplied definition of a new experiment. Null optional fields fall back to framework defaults
 * when the experiment is created.
 */
@Value
@Builder
public class ExperimentConfig {

    /** Optional; generated as {@code exp_<uuid>} when absent. */
    String id;
    String name;
    String description;
    @Singular
    List<VariantSpec> variants;
    String primaryMetric;
    @Singular
    List<String> secondaryMetrics;
    /** Strategy config name, e.g. "deterministic". Defaults to "random". */
    String assignmentStrategy;
    @Singular
    Map<String, Object> targetingRules;
    Double baselineRate;
    Double minimumDetectableEffect;
    Double confidenceLevel;
    Double power;
    /** Overrides inference from the primary metric's name. */
    MetricType primaryMetricType;
    Double estimatedStandardDeviation;
    Integer dailyTraffic;
    boolean shadowMode;
    String controlVariant;
    String treatmentVariant;

    @Value
    public static class VariantSpec {
        String name;
        double weight;

        public static VariantSpec of(String name, double weight) {
            return new VariantSpec(name, weight);
        }
    }
}
