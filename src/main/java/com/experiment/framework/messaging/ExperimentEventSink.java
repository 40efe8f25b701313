package com.experiment.framework.messaging;

/**
 * Destination for lifecycle events. Every sink bean is picked up by {@link ExperimentEventPublisher}.
 */
public interface ExperimentEventSink {

    /**
     * Name used for logging and for the sink's circuit breaker.
     */
    String getSinkName();

    void publish(ExperimentEvent event);
}
