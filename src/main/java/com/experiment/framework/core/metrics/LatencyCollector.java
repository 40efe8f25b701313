package com.experiment.framework.core.metrics;

import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.MetricEvent;
import lombok.Value;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Response latencies in milliseconds. Percentiles use the nearest-rank index floor(n * q) on sorted values.
 */
@Component
public class LatencyCollector extends AbstractMetricCollector<Double, LatencyCollector.LatencyStats> {

    public static final String METRIC = "latency";

    @Override
    public String getMetricName() {
        return METRIC;
    }

    @Override
    public void collect(String variant, MetricEvent event) {
        append(event.getExperimentId(), variant, event.numericValue());
    }

    @Override
    public Map<String, LatencyStats> calculate(Experiment experiment) {
        return perVariant(experiment, LatencyCollector::summarize);
    }

    private static LatencyStats summarize(List<Double> values) {
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        return new LatencyStats(
                StatUtils.mean(sorted),
                percentile(sorted, 0.5),
                percentile(sorted, 0.95),
                percentile(sorted, 0.99),
                sorted.length);
    }

    /** Nearest-rank with a floor index, no interpolation: every reported percentile is an observed latency. */
    static double percentile(double[] sorted, double quantile) {
        int index = (int) Math.floor(sorted.length * quantile);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    @Value
    public static class LatencyStats {
        double mean;
        double median;
        double p95;
        double p99;
        int count;
    }
}
