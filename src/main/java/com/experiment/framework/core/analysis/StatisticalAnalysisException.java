package com.experiment.framework.core.analysis;

/**
 * Thrown when data is present but a statistic cannot be computed meaningfully
 * (missing control/treatment variant, zero variance with differing means).
 */
public class StatisticalAnalysisException extends RuntimeException {

    public StatisticalAnalysisException(String message) {
        super(message);
    }

    public StatisticalAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
