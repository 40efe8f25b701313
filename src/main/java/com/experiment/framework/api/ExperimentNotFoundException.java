package com.experiment.framework.api;

/**
 * Thrown when an operation names an experiment id that was never created. Handler returns HTTP 404.
 */
public class ExperimentNotFoundException extends RuntimeException {

    public ExperimentNotFoundException(String message) {
        super(message);
    }

    public ExperimentNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
