package com.experiment.framework.core.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Group-sequential view of the primary metric: planned looks, their boundaries and where the experiment stands now.
 */
@Value
@Builder
public class SequentialResult {

    String method;
    int totalStages;
    @Singular(ignoreNullCollections = true)
    List<Checkpoint> checkpoints;
    @Singular(ignoreNullCollections = true)
    List<Boundary> boundaries;
    int currentStage;
    int currentSampleSize;
    long requiredSampleSize;
    double testStatistic;
    /** Null when the current boundary is not crossed. */
    Decision decision;

    @Value
    public static class Checkpoint {
        int stage;
        long sampleSize;
        double informationFraction;
    }

    @Value
    public static class Boundary {
        int stage;
        double criticalValue;
        /** Two-sided nominal alpha at this look. */
        double nominalAlpha;
        /** Lan-DeMets O'Brien-Fleming alpha spent up to this look. */
        double cumulativeAlphaSpent;
    }

    @Value
    public static class Decision {
        boolean stop;
        String winningVariant;
        int stage;
        double nominalPValue;
        /** min(1, nominal p * stage). */
        double adjustedPValue;
    }
}
