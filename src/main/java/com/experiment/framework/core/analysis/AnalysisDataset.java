package com.experiment.framework.core.analysis;

import com.experiment.framework.core.MetricStore.MetricRecord;
import com.experiment.framework.domain.Experiment;
import lombok.Getter;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Values of every metric per variant, prepared once per analysis and shared by all engines.
 * Variants are in the experiment's declaration order; variants without data have empty arrays.
 */
public final class AnalysisDataset {

    private static final double[] EMPTY = new double[0];

    @Getter
    private final Experiment experiment;
    private final Map<String, Map<String, double[]>> values;
    private final Map<String, Integer> sampleSizes;

    private AnalysisDataset(Experiment experiment, Map<String, Map<String, double[]>> values, Map<String, Integer> sampleSizes) {
        this.experiment = experiment;
        this.values = values;
        this.sampleSizes = sampleSizes;
    }

    /**
     * Build from a metric store snapshot (variant to metric to records).
     * Sample size of a variant is its number of distinct users with at least one metric.
     */
    public static AnalysisDataset from(Experiment experiment, Map<String, Map<String, List<MetricRecord>>> snapshot) {
        Map<String, Map<String, double[]>> values = new LinkedHashMap<>();
        Map<String, Integer> sampleSizes = new LinkedHashMap<>();
        for (String variant : experiment.variantNames()) {
            Map<String, List<MetricRecord>> byMetric = snapshot.getOrDefault(variant, Map.of());
            Map<String, double[]> variantValues = new LinkedHashMap<>();
            Set<String> users = new HashSet<>();
            byMetric.forEach((metric, records) -> {
                variantValues.put(metric, records.stream().mapToDouble(MetricRecord::getValue).toArray());
                records.forEach(r -> users.add(r.getUserId()));
            });
            values.put(variant, variantValues);
            sampleSizes.put(variant, users.size());
        }
        return new AnalysisDataset(experiment, values, Collections.unmodifiableMap(sampleSizes));
    }

    /**
     * Copy of the values of {@code metric} for {@code variant}; empty if none.
     */
    public double[] values(String variant, String metric) {
        double[] v = values.getOrDefault(variant, Map.of()).get(metric);
        return v != null ? v.clone() : EMPTY;
    }

    public boolean hasVariant(String variant) {
        return values.containsKey(variant);
    }

    public List<String> variants() {
        return List.copyOf(values.keySet());
    }

    public Map<String, Integer> getSampleSizes() {
        return sampleSizes;
    }

    public int getTotalSampleSize() {
        return sampleSizes.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * True when every value of the metric, across all variants, is 0 or 1 and at least one value exists.
     */
    public boolean isBinary(String metric) {
        boolean any = false;
        for (Map<String, double[]> byMetric : values.values()) {
            double[] v = byMetric.get(metric);
            if (v == null) {
                continue;
            }
            for (double x : v) {
                if (x != 0.0 && x != 1.0) {
                    return false;
                }
                any = true;
            }
        }
        return any;
    }
}
