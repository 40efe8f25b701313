package com.experiment.framework.api;

/**
 * Thrown when an experiment definition or power-analysis input is invalid. Nothing is stored.
 * Handler returns HTTP 400.
 */
public class ExperimentValidationException extends RuntimeException {

    public ExperimentValidationException(String message) {
        super(message);
    }

    public ExperimentValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
