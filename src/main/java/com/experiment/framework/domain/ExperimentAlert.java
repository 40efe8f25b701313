package com.experiment.framework.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Raised by the experiment monitor. Stored per experiment and emitted as an EXPERIMENT_ALERT event.
 */
@Value
@Builder
public class ExperimentAlert {

    String experimentId;
    AlertType type;
    AlertSeverity severity;
    String message;
    Map<String, Object> data;
    Instant timestamp;
}
