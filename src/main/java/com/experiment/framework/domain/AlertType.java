package com.experiment.framework.domain;

public enum AlertType {
    SRM_DETECTED,
    SAMPLE_SIZE_REACHED,
    MAX_DURATION_REACHED
}
