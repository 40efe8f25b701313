package com.experiment.framework.core.metrics;

import com.experiment.framework.domain.Experiment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Append-only per-(experiment, variant) storage shared by the collectors.
 */
abstract class AbstractMetricCollector<T, S> implements MetricCollector<S> {

    private final Map<String, List<T>> records = new ConcurrentHashMap<>();

    protected void append(String experimentId, String variant, T record) {
        records.computeIfAbsent(key(experimentId, variant), k -> Collections.synchronizedList(new ArrayList<>()))
                .add(record);
    }

    protected List<T> records(String experimentId, String variant) {
        List<T> list = records.get(key(experimentId, variant));
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    /**
     * Apply {@code summarize} to each variant's records, skipping variants without data. The returned map is read-only.
     */
    protected Map<String, S> perVariant(Experiment experiment, Function<List<T>, S> summarize) {
        Map<String, S> result = new LinkedHashMap<>();
        for (String variant : experiment.variantNames()) {
            List<T> data = records(experiment.getId(), variant);
            if (!data.isEmpty()) {
                result.put(variant, summarize.apply(data));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private static String key(String experimentId, String variant) {
        return experimentId + ":" + variant;
    }
}
