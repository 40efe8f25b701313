package com.experiment.framework.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Inbound signal: a model produced a confidence score for a user's item.
 */
@Value
@Builder
@Jacksonized
public class MlConfidenceUpdate {

    String userId;
    Double confidence;
    String fileId;
}
