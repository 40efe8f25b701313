package com.experiment.framework.core.assignment;

import com.experiment.framework.core.FrameworkSettings;
import com.experiment.framework.domain.AssignmentStrategyType;
import com.experiment.framework.domain.Experiment;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for ContextualBanditStrategy.
 */
class ContextualBanditStrategyTest {

    private final Experiment experiment =
            StrategyFixtures.experiment("exp-ctx", AssignmentStrategyType.CONTEXTUAL_BANDIT, 1, 1);

    @Test
    void extractsFeaturesFromContext() {
        double[] features = ContextualBanditStrategy.extractFeatures(
                Map.of("confidence", 0.8, "fileSize", Math.E, "userSegment", "power_user"));

        assertThat(features[0]).isCloseTo(0.8, within(1e-12));
        assertThat(features[1]).isCloseTo(1.0, within(1e-12));
        assertThat(features[2]).isEqualTo(1.0);
    }

    @Test
    void missingOrNonPositiveFileSizeIsNeutral() {
        assertThat(ContextualBanditStrategy.extractFeatures(Map.of())).containsExactly(0.0, 0.0, 0.0);
        assertThat(ContextualBanditStrategy.extractFeatures(Map.of("fileSize", -5))[1]).isZero();
    }

    @Test
    void rewardsMoveWeightsAlongFeatures() {
        ContextualBanditStrategy strategy = new ContextualBanditStrategy(new Well19937c(5), FrameworkSettings.defaults());
        strategy.assign("user-1", experiment, Map.of());

        strategy.updateReward("exp-ctx", "v1", Map.of("confidence", 0.5, "userSegment", "power_user"), 2.0);

        double[] weights = strategy.getWeights("exp-ctx").get("v1");
        assertThat(weights[0]).isCloseTo(0.01 * 2.0 * 0.5, within(1e-12));
        assertThat(weights[2]).isCloseTo(0.02, within(1e-12));
        assertThat(strategy.getWeights("exp-ctx").get("v0")).containsExactly(0.0, 0.0, 0.0);
    }

    @Test
    void learnedArmWinsMostAssignments() {
        ContextualBanditStrategy strategy = new ContextualBanditStrategy(new Well19937c(5), FrameworkSettings.defaults());
        Map<String, Object> context = Map.of("confidence", 0.9, "userSegment", "power_user");
        strategy.assign("user-0", experiment, context);
        strategy.updateReward("exp-ctx", "v1", context, 1.0);

        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < 2000; i++) {
            counts.merge(strategy.assign("user-" + i, experiment, context), 1, Integer::sum);
        }

        assertThat(counts.get("v1")).isGreaterThan(1800);
    }

    @Test
    void weightsAreCopies() {
        ContextualBanditStrategy strategy = new ContextualBanditStrategy(new Well19937c(5), FrameworkSettings.defaults());
        strategy.assign("user-1", experiment, Map.of());

        strategy.getWeights("exp-ctx").get("v0")[0] = 99.0;

        assertThat(strategy.getWeights("exp-ctx").get("v0")[0]).isZero();
    }
}
