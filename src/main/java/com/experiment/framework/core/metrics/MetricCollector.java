package com.experiment.framework.core.metrics;

import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.MetricEvent;

import java.util.Map;

/**
 * Accumulates events for one metric name and derives per-variant statistics on demand.
 *
 * @param <S> per-variant statistics type
 */
public interface MetricCollector<S> {

    /**
     * Metric name this collector receives events for.
     */
    String getMetricName();

    /**
     * Record an event for a user already assigned to {@code variant}. Implementations must be thread-safe.
     */
    void collect(String variant, MetricEvent event);

    /**
     * Variant to statistics, for variants of the experiment that have data.
     */
    Map<String, S> calculate(Experiment experiment);
}
