package com.experiment.framework.domain;

/**
 * How a metric's values are modelled by the statistical engines.
 */
public enum MetricType {
    /** 0/1 outcomes (conversion, click, success). */
    BINARY,
    /** Any real-valued outcome (latency, confidence, revenue). */
    CONTINUOUS
}
