package com.experiment.framework.core.analysis;

import com.experiment.framework.api.ExperimentValidationException;
import com.experiment.framework.domain.MetricType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Sample size and minimum runtime for a two-sided test at the requested confidence and power.
 */
@Slf4j
@Component
public class PowerAnalysisCalculator {

    private static final Set<String> BINARY_METRICS = Set.of("conversion", "success", "click", "purchase");
    static final double DEFAULT_SD_FACTOR = 0.5;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0, 1);

    /**
     * Metric type implied by the metric's name: conversion, success, click and purchase are binary.
     */
    public static MetricType inferMetricType(String metricName) {
        return metricName != null && BINARY_METRICS.contains(metricName.toLowerCase(Locale.ROOT))
                ? MetricType.BINARY : MetricType.CONTINUOUS;
    }

    /**
     * @throws ExperimentValidationException for out-of-range inputs
     */
    public PowerAnalysisResult calculate(PowerAnalysisRequest request) {
        validate(request);
        double zAlpha = STANDARD_NORMAL.inverseCumulativeProbability(1 - (1 - request.getConfidenceLevel()) / 2);
        double zBeta = STANDARD_NORMAL.inverseCumulativeProbability(request.getPower());
        double mde = request.getMinimumDetectableEffect();

        double perVariant;
        if (request.getMetricType() == MetricType.BINARY) {
            double p1 = request.getBaselineRate();
            double p2 = p1 + mde;
            if (p2 <= 0 || p2 >= 1) {
                throw new ExperimentValidationException("baselineRate + minimumDetectableEffect must be within (0, 1), was " + p2);
            }
            double pooled = (p1 + p2) / 2;
            double numerator = zAlpha * Math.sqrt(2 * pooled * (1 - pooled))
                    + zBeta * Math.sqrt(p1 * (1 - p1) + p2 * (1 - p2));
            perVariant = numerator * numerator / (mde * mde);
        } else {
            double sigma = request.getStandardDeviation() != null
                    ? request.getStandardDeviation()
                    : DEFAULT_SD_FACTOR * request.getBaselineRate();
            if (sigma <= 0) {
                throw new ExperimentValidationException("Standard deviation must be positive, was " + sigma);
            }
            perVariant = 2 * sigma * sigma * (zAlpha + zBeta) * (zAlpha + zBeta) / (mde * mde);
        }

        long sampleSizePerVariant = (long) Math.ceil(perVariant);
        long total = sampleSizePerVariant * request.getVariants();
        long days = (long) Math.ceil((double) total / request.getDailyTraffic());
        log.debug("Power analysis metricType={}, perVariant={}, total={}, days={}",
                request.getMetricType(), sampleSizePerVariant, total, days);
        return new PowerAnalysisResult(sampleSizePerVariant, total, Duration.ofDays(days), request.getMetricType(), request);
    }

    private static void validate(PowerAnalysisRequest request) {
        if (request.getMetricType() == null) {
            throw new ExperimentValidationException("metricType is required");
        }
        if (request.getConfidenceLevel() <= 0 || request.getConfidenceLevel() >= 1) {
            throw new ExperimentValidationException("confidenceLevel must be within (0, 1)");
        }
        if (request.getPower() <= 0 || request.getPower() >= 1) {
            throw new ExperimentValidationException("power must be within (0, 1)");
        }
        if (request.getMinimumDetectableEffect() == 0 || Double.isNaN(request.getMinimumDetectableEffect())) {
            throw new ExperimentValidationException("minimumDetectableEffect must be non-zero");
        }
        if (request.getVariants() < 2) {
            throw new ExperimentValidationException("At least 2 variants are required");
        }
        if (request.getDailyTraffic() <= 0) {
            throw new ExperimentValidationException("dailyTraffic must be positive");
        }
        if (request.getMetricType() == MetricType.BINARY
                && (request.getBaselineRate() <= 0 || request.getBaselineRate() >= 1)) {
            throw new ExperimentValidationException("baselineRate of a binary metric must be within (0, 1)");
        }
    }
}
