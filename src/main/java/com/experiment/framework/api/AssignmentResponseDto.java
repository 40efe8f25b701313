package com.experiment.framework.api;

import lombok.Value;

@Value
public class AssignmentResponseDto {

    String experimentId;
    String userId;
    String variant;
}
