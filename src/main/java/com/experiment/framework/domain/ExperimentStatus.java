package com.experiment.framework.domain;

/**
 * Lifecycle of an experiment. The only transition is ACTIVE to STOPPED, and it happens once.
 */
public enum ExperimentStatus {
    /** Accepting assignments and metrics. */
    ACTIVE,
    /** Terminal. Kept for historical analysis, never deleted. */
    STOPPED
}
