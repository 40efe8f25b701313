package com.experiment.framework.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class AssignmentRequestDto {

    @NotBlank(message = "userId is required")
    private String userId;

    /** segment, confidence, fileSize, userSegment, ... */
    private Map<String, Object> context = new LinkedHashMap<>();
}
