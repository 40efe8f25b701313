package com.experiment.framework.api;

import com.experiment.framework.domain.MetricType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API request body for creating an experiment. Optional fields fall back to framework defaults.
 */
@Data
public class CreateExperimentRequestDto {

    /** Optional; generated when absent. */
    private String id;

    @NotBlank(message = "name is required")
    private String name;

    private String description;

    @NotEmpty(message = "variants are required")
    @Valid
    private List<VariantDto> variants = new ArrayList<>();

    @NotBlank(message = "primaryMetric is required")
    private String primaryMetric;

    private List<String> secondaryMetrics = new ArrayList<>();

    /** random, deterministic, stratified, multiArmedBandit or contextual. */
    private String assignmentStrategy;

    private Map<String, Object> targetingRules = new LinkedHashMap<>();
    private Double baselineRate;
    private Double minimumDetectableEffect;
    private Double confidenceLevel;
    private Double power;
    private MetricType primaryMetricType;
    private Double estimatedStandardDeviation;
    private Integer dailyTraffic;
    private boolean shadowMode;
    private String controlVariant;
    private String treatmentVariant;
}
