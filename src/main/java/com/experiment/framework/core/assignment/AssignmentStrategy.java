package com.experiment.framework.core.assignment;

import com.experiment.framework.domain.AssignmentStrategyType;
import com.experiment.framework.domain.Experiment;

import java.util.Map;

/**
 * Strategy interface for mapping a user to one of an experiment's variants.
 * Implementations must return the name of a variant declared by the experiment.
 */
public interface AssignmentStrategy {

    /**
     * Pick a variant for the user.
     *
     * @param userId user being assigned
     * @param experiment active experiment with at least two variants
     * @param context caller-supplied attributes (segment, confidence, fileSize, ...); may be empty, never null
     * @return variant name
     */
    String assign(String userId, Experiment experiment, Map<String, Object> context);

    AssignmentStrategyType getType();

    /**
     * Get strategy name for logging.
     */
    default String getStrategyName() {
        return getType().getConfigName();
    }
}
