package com.experiment.framework.api;

/**
 * Thrown when an assignment strategy name does not match any registered strategy.
 */
public class UnknownStrategyException extends RuntimeException {

    public UnknownStrategyException(String message) {
        super(message);
    }

    public UnknownStrategyException(String message, Throwable cause) {
        super(message, cause);
    }
}
