package com.experiment.framework.api;

/**
 * Thrown when a lifecycle transition is not allowed, e.g. stopping an experiment that is already stopped
 * or that another caller stopped first. Handler returns HTTP 409.
 */
public class InvalidExperimentStateException extends RuntimeException {

    public InvalidExperimentStateException(String message) {
        super(message);
    }

    public InvalidExperimentStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
