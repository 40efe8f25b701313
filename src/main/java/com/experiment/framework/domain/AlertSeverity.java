package com.experiment.framework.domain;

public enum AlertSeverity {
    INFO,
    MEDIUM,
    HIGH
}
