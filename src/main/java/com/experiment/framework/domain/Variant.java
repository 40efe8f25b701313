package com.experiment.framework.domain;

import lombok.Builder;
import lombok.Value;

/**
 * One arm of an experiment. The normalized weight is fixed when the experiment is created.
 */
@Value
@Builder
public class Variant {

    String name;
    double weight;
    /** weight / sum(weights); all variants of an experiment sum to 1. */
    double normalizedWeight;
}
