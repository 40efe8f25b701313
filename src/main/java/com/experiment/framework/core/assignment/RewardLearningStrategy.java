package com.experiment.framework.core.assignment;

import java.util.Map;

/**
 * An assignment strategy that learns from observed rewards (bandits).
 */
public interface RewardLearningStrategy extends AssignmentStrategy {

    /**
     * Feed back the reward observed for a user who was assigned {@code variant}.
     *
     * @param context the context the user was assigned with
     */
    void updateReward(String experimentId, String variant, Map<String, Object> context, double reward);
}
