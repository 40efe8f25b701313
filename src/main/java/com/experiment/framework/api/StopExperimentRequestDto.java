package com.experiment.framework.api;

import lombok.Data;

@Data
public class StopExperimentRequestDto {

    /** Defaults to "manual". */
    private String reason;
}
