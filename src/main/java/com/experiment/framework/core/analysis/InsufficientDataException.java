package com.experiment.framework.core.analysis;

/**
 * Thrown by an analysis engine when there is not enough data to compute a statistic
 * (e.g. one arm has no observations). The orchestrator turns it into an INSUFFICIENT_DATA result.
 */
public class InsufficientDataException extends RuntimeException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
