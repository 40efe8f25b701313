package com.experiment.framework.api;

import com.experiment.framework.domain.Prediction;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * REST API request body for reporting a metric. Either {@code value} or {@code prediction} must be set.
 */
@Data
public class MetricEventRequestDto {

    @NotBlank(message = "userId is required")
    private String userId;

    @NotBlank(message = "metricName is required")
    private String metricName;

    private Double value;
    private Prediction prediction;
    private Map<String, Object> metadata;
    private Instant timestamp;
}
