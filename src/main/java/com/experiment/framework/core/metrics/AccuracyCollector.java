package com.experiment.framework.core.metrics;

import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.MetricEvent;
import com.experiment.framework.domain.Prediction;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Binary classification quality from predicted/actual pairs. Ratios that would divide by zero are 0.
 */
@Slf4j
@Component
public class AccuracyCollector extends AbstractMetricCollector<Prediction, AccuracyCollector.AccuracyStats> {

    public static final String METRIC = "accuracy";

    @Override
    public String getMetricName() {
        return METRIC;
    }

    @Override
    public void collect(String variant, MetricEvent event) {
        if (event.getPrediction() == null) {
            log.warn("Accuracy event without prediction ignored experimentId={}, userId={}", event.getExperimentId(), event.getUserId());
            return;
        }
        append(event.getExperimentId(), variant, event.getPrediction());
    }

    @Override
    public Map<String, AccuracyStats> calculate(Experiment experiment) {
        return perVariant(experiment, AccuracyCollector::summarize);
    }

    private static AccuracyStats summarize(List<Prediction> predictions) {
        int tp = 0;
        int tn = 0;
        int fp = 0;
        int fn = 0;
        for (Prediction p : predictions) {
            if (p.isPredicted() && p.isActual()) {
                tp++;
            } else if (!p.isPredicted() && !p.isActual()) {
                tn++;
            } else if (p.isPredicted()) {
                fp++;
            } else {
                fn++;
            }
        }
        double accuracy = ratio(tp + tn, predictions.size());
        double precision = ratio(tp, tp + fp);
        double recall = ratio(tp, tp + fn);
        double f1 = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
        return new AccuracyStats(accuracy, precision, recall, f1, tp, tn, fp, fn, predictions.size());
    }

    private static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    @Value
    public static class AccuracyStats {
        double accuracy;
        double precision;
        double recall;
        double f1Score;
        int truePositives;
        int trueNegatives;
        int falsePositives;
        int falseNegatives;
        int count;
    }
}
