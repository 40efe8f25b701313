package com.experiment.framework.domain;

import com.experiment.framework.core.analysis.PowerAnalysisResult;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable experiment snapshot. A status change produces a new instance via {@code toBuilder()};
 * variants and their normalized weights never change after creation.
 */
@Value
@Builder(toBuilder = true)
public class Experiment {

    String id;
    String name;
    String description;
    ExperimentStatus status;
    List<Variant> variants;
    String primaryMetric;
    List<String> secondaryMetrics;
    AssignmentStrategyType assignmentStrategy;
    Map<String, Object> targetingRules;
    long requiredSampleSize;
    Duration minRunTime;
    PowerAnalysisResult powerAnalysis;
    boolean shadowMode;
    String controlVariant;
    String treatmentVariant;
    Instant createdAt;
    Instant startTime;
    Instant endTime;
    String stopReason;

    public boolean isActive() {
        return status == ExperimentStatus.ACTIVE;
    }

    public Optional<Variant> findVariant(String variantName) {
        return variants.stream().filter(v -> v.getName().equals(variantName)).findFirst();
    }

    public List<String> variantNames() {
        return variants.stream().map(Variant::getName).collect(Collectors.toList());
    }

    /** Primary metric first, then secondaries in declaration order. */
    public List<String> allMetrics() {
        List<String> metrics = new ArrayList<>();
        metrics.add(primaryMetric);
        for (String m : secondaryMetrics) {
            if (!metrics.contains(m)) {
                metrics.add(m);
            }
        }
        return metrics;
    }

    public boolean declaresMetric(String metricName) {
        return primaryMetric.equals(metricName) || secondaryMetrics.contains(metricName);
    }
}
