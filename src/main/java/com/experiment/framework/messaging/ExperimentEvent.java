package com.experiment.framework.messaging;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Lifecycle event emitted by the engine. The payload is the experiment, assignment, analysis result or alert
 * the event is about.
 */
@Value
@Builder
public class ExperimentEvent {

    String eventId;
    ExperimentEventType type;
    String experimentId;
    Object payload;
    Instant timestamp;
}
