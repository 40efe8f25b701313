package com.experiment.framework.core.metrics;

import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.MetricEvent;
import lombok.Value;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Model confidence scores in [0, 1]: mean, standard deviation and a 5-bin histogram.
 */
@Component
public class ConfidenceCollector extends AbstractMetricCollector<Double, ConfidenceCollector.ConfidenceStats> {

    public static final String METRIC = "confidence";
    static final int BINS = 5;

    @Override
    public String getMetricName() {
        return METRIC;
    }

    @Override
    public void collect(String variant, MetricEvent event) {
        append(event.getExperimentId(), variant, event.numericValue());
    }

    @Override
    public Map<String, ConfidenceStats> calculate(Experiment experiment) {
        return perVariant(experiment, ConfidenceCollector::summarize);
    }

    private static ConfidenceStats summarize(List<Double> values) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        int[] histogram = new int[BINS];
        for (double v : values) {
            stats.addValue(v);
            int bin = (int) Math.floor(v * BINS);
            histogram[Math.max(0, Math.min(BINS - 1, bin))]++;
        }
        List<Integer> distribution = Arrays.stream(histogram).boxed().collect(Collectors.toList());
        return new ConfidenceStats(stats.getMean(), stats.getStandardDeviation(), values.size(),
                Collections.unmodifiableList(distribution));
    }

    @Value
    public static class ConfidenceStats {
        double mean;
        double std;
        int count;
        /** Counts for [0, 0.2), [0.2, 0.4), ..., [0.8, 1.0]. */
        List<Integer> distribution;
    }
}
