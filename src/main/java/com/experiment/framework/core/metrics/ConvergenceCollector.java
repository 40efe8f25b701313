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
 * Training/quality curves reported value by value. A variant has converged when the standard deviation of its
 * last 10 moving averages (window 100) drops below 0.01.
 */
@Component
public class ConvergenceCollector extends AbstractMetricCollector<Double, ConvergenceCollector.ConvergenceStats> {

    public static final String METRIC = "convergence";
    static final int WINDOW = 100;
    static final int RECENT = 10;
    static final double THRESHOLD = 0.01;

    @Override
    public String getMetricName() {
        return METRIC;
    }

    @Override
    public void collect(String variant, MetricEvent event) {
        append(event.getExperimentId(), variant, event.numericValue());
    }

    @Override
    public Map<String, ConvergenceStats> calculate(Experiment experiment) {
        return perVariant(experiment, ConvergenceCollector::summarize);
    }

    private static ConvergenceStats summarize(List<Double> values) {
        double[] data = values.stream().mapToDouble(Double::doubleValue).toArray();
        double[] movingAverages = movingAverages(data);
        if (movingAverages.length < 2) {
            return new ConvergenceStats(false, 0.0, 0.0, StatUtils.mean(data), movingAverages.length, data.length);
        }
        double[] recent = Arrays.copyOfRange(movingAverages,
                Math.max(0, movingAverages.length - RECENT), movingAverages.length);
        double recentMean = StatUtils.mean(recent);
        double recentStd = Math.sqrt(StatUtils.variance(recent, recentMean));
        return new ConvergenceStats(recentStd < THRESHOLD, convergenceRate(movingAverages), 1 - recentStd,
                recentMean, movingAverages.length, data.length);
    }

    static double[] movingAverages(double[] data) {
        if (data.length < WINDOW) {
            return new double[0];
        }
        double[] averages = new double[data.length - WINDOW + 1];
        double sum = 0.0;
        for (int i = 0; i < data.length; i++) {
            sum += data[i];
            if (i >= WINDOW) {
                sum -= data[i - WINDOW];
            }
            if (i >= WINDOW - 1) {
                averages[i - WINDOW + 1] = sum / WINDOW;
            }
        }
        return averages;
    }

    /**
     * Relative drop in variance between the first and last block of 10 moving averages, clamped to [0, 1].
     */
    static double convergenceRate(double[] movingAverages) {
        int blocks = (movingAverages.length - 1) / RECENT;
        if (blocks < 2) {
            return 0.0;
        }
        double initial = blockVariance(movingAverages, RECENT);
        double last = blockVariance(movingAverages, blocks * RECENT);
        if (initial == 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, (initial - last) / initial));
    }

    private static double blockVariance(double[] values, int end) {
        double[] block = Arrays.copyOfRange(values, end - RECENT, end);
        return StatUtils.populationVariance(block);
    }

    @Value
    public static class ConvergenceStats {
        boolean converged;
        double convergenceRate;
        double stability;
        double finalValue;
        int movingAverages;
        int count;
    }
}
