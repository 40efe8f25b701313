package com.experiment.framework.domain;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Sticky mapping of a user to a variant. The context is kept so bandit strategies can learn from later rewards.
 */
@Value
public class Assignment {

    String userId;
    String experimentId;
    String variant;
    Map<String, Object> context;
    Instant assignedAt;
}
