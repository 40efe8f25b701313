package com.experiment.framework.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Inbound signal: a user did something in the product (opened a file, ran a search, ...).
 */
@Value
@Builder
@Jacksonized
public class UserAction {

    String userId;
    String action;
    Map<String, Object> metadata;
    Instant timestamp;
}
