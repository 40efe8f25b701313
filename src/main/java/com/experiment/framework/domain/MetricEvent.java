package com.experiment.framework.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * A single observation reported for a user taking part in an experiment.
 * Carries either a numeric value or, for accuracy metrics, a predicted/actual pair.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MetricEvent {

    String userId;
    String experimentId;
    String metricName;
    Double value;
    Prediction prediction;
    Map<String, Object> metadata;
    /** When the event happened. Null means "now" at ingestion. */
    Instant timestamp;

    /**
     * Value fed to the statistical engines. A prediction without a numeric value counts 1 when correct, else 0.
     *
     * @throws IllegalArgumentException if the event has neither a value nor a prediction
     */
    public double numericValue() {
        if (value != null) {
            return value;
        }
        if (prediction != null) {
            return prediction.isCorrect() ? 1.0 : 0.0;
        }
        throw new IllegalArgumentException("Metric event " + metricName + " for user " + userId + " has no value");
    }
}
