package com.experiment.framework.messaging;

public enum ExperimentEventType {
    EXPERIMENT_CREATED,
    USER_ASSIGNED,
    EXPERIMENT_ANALYZED,
    EXPERIMENT_STOPPED,
    EXPERIMENT_ALERT
}
