package com.experiment.framework.core.analysis;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call switches. An engine runs only if enabled in settings and not turned off here.
 */
@Value
@Builder
public class AnalysisOptions {

    @Builder.Default
    boolean includeBayesian = true;
    @Builder.Default
    boolean includeSequential = true;

    public static AnalysisOptions defaults() {
        return AnalysisOptions.builder().build();
    }
}
