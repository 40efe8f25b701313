package com.experiment.framework.core.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable analysis snapshot. Engine sections are null when the engine did not run;
 * an engine that ran but failed is listed in {@code engineErrors}.
 */
@Value
@Builder
public class AnalysisResult {

    String experimentId;
    AnalysisStatus status;
    /** Why the result is INSUFFICIENT_DATA; null otherwise. */
    String message;
    FrequentistResult frequentist;
    BayesianResult bayesian;
    SequentialResult sequential;
    @Singular(ignoreNullCollections = true)
    Map<String, Integer> sampleSizes;
    /** Time since the experiment started, in milliseconds. */
    long runtimeMs;
    /** Collector name to per-variant summary. */
    @Singular(ignoreNullCollections = true)
    Map<String, Map<String, ?>> mlMetrics;
    @Singular(ignoreNullCollections = true)
    Map<String, String> engineErrors;
    Instant analyzedAt;

    public static AnalysisResult insufficientData(String experimentId, String message, Map<String, Integer> sampleSizes,
                                                  long runtimeMs, Instant analyzedAt) {
        return AnalysisResult.builder()
                .experimentId(experimentId)
                .status(AnalysisStatus.INSUFFICIENT_DATA)
                .message(message)
                .sampleSizes(sampleSizes)
                .runtimeMs(runtimeMs)
                .mlMetrics(Map.of())
                .engineErrors(Map.of())
                .analyzedAt(analyzedAt)
                .build();
    }
}
