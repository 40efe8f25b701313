package com.experiment.framework.core.analysis;

public enum TestType {
    CHI_SQUARE,
    WELCH_T_TEST,
    MANN_WHITNEY_U
}
