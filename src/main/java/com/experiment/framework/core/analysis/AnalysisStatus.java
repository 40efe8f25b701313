package com.experiment.framework.core.analysis;

public enum AnalysisStatus {
    COMPLETED,
    INSUFFICIENT_DATA
}
