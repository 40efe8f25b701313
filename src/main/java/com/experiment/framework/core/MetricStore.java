package com.experiment.framework.core;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raw metric values per experiment, variant and metric. Append-only; readers get copies.
 */
@Component
public class MetricStore {

    private final Map<String, Map<String, Map<String, List<MetricRecord>>>> store = new ConcurrentHashMap<>();

    public void append(String experimentId, String variant, String metricName, MetricRecord record) {
        store.computeIfAbsent(experimentId, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(variant, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(metricName, k -> Collections.synchronizedList(new ArrayList<>()))
                .add(record);
    }

    public boolean hasMetrics(String experimentId) {
        Map<String, Map<String, List<MetricRecord>>> byVariant = store.get(experimentId);
        return byVariant != null && !byVariant.isEmpty();
    }

    /**
     * Point-in-time copy: variant to metric to records.
     */
    public Map<String, Map<String, List<MetricRecord>>> snapshot(String experimentId) {
        Map<String, Map<String, List<MetricRecord>>> byVariant = store.get(experimentId);
        if (byVariant == null) {
            return Map.of();
        }
        Map<String, Map<String, List<MetricRecord>>> copy = new LinkedHashMap<>();
        byVariant.forEach((variant, byMetric) -> {
            Map<String, List<MetricRecord>> metrics = new LinkedHashMap<>();
            byMetric.forEach((metric, records) -> {
                synchronized (records) {
                    metrics.put(metric, List.copyOf(records));
                }
            });
            copy.put(variant, metrics);
        });
        return copy;
    }

    @Value
    public static class MetricRecord {
        String userId;
        double value;
        Map<String, Object> metadata;
        Instant timestamp;
    }
}
