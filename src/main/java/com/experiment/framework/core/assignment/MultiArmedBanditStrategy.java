package com.experiment.framework.core.assignment;

import com.experiment.framework.core.FrameworkSettings;
import com.experiment.framework.domain.AssignmentStrategyType;
import com.experiment.framework.domain.Experiment;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Epsilon-greedy bandit. With probability epsilon a uniformly random arm is explored; otherwise the arm with
 * the highest average reward is used, ties going to the first arm in declaration order.
 */
@Slf4j
@Component
public class MultiArmedBanditStrategy implements RewardLearningStrategy {

    private final RandomGenerator random;
    private final double epsilon;

    // experimentId -> variant -> arm, insertion ordered like the experiment's variants
    private final Map<String, Map<String, Arm>> arms = new ConcurrentHashMap<>();

    public MultiArmedBanditStrategy(RandomGenerator random, FrameworkSettings settings) {
        this.random = random;
        this.epsilon = settings.getBanditEpsilon();
    }

    @Override
    public String assign(String userId, Experiment experiment, Map<String, Object> context) {
        Map<String, Arm> experimentArms = armsFor(experiment);
        List<String> variants = experiment.variantNames();

        if (random.nextDouble() < epsilon) {
            String explored = variants.get(random.nextInt(variants.size()));
            log.debug("Bandit explore experimentId={}, variant={}", experiment.getId(), explored);
            return explored;
        }

        String best = variants.get(0);
        double bestAverage = Double.NEGATIVE_INFINITY;
        for (String variant : variants) {
            double average = experimentArms.get(variant).averageReward();
            if (average > bestAverage) {
                bestAverage = average;
                best = variant;
            }
        }
        return best;
    }

    @Override
    public void updateReward(String experimentId, String variant, Map<String, Object> context, double reward) {
        Map<String, Arm> experimentArms = arms.get(experimentId);
        Arm arm = experimentArms != null ? experimentArms.get(variant) : null;
        if (arm == null) {
            log.warn("Reward for unknown bandit arm experimentId={}, variant={}", experimentId, variant);
            return;
        }
        arm.record(reward);
    }

    /**
     * Variant to arm statistics, in declaration order. Empty if the experiment never assigned through this strategy.
     */
    public Map<String, ArmStats> getArmStatistics(String experimentId) {
        Map<String, ArmStats> stats = new LinkedHashMap<>();
        arms.getOrDefault(experimentId, Map.of()).forEach((variant, arm) -> stats.put(variant, arm.stats()));
        return stats;
    }

    private Map<String, Arm> armsFor(Experiment experiment) {
        return arms.computeIfAbsent(experiment.getId(), id -> {
            Map<String, Arm> created = new LinkedHashMap<>();
            experiment.variantNames().forEach(v -> created.put(v, new Arm()));
            return created;
        });
    }

    @Override
    public AssignmentStrategyType getType() {
        return AssignmentStrategyType.MULTI_ARMED_BANDIT;
    }

    private static final class Arm {
        private long pulls;
        private double totalReward;

        synchronized void record(double reward) {
            pulls++;
            totalReward += reward;
        }

        synchronized double averageReward() {
            return pulls == 0 ? 0.0 : totalReward / pulls;
        }

        synchronized ArmStats stats() {
            return new ArmStats(pulls, totalReward, averageReward());
        }
    }

    @Value
    public static class ArmStats {
        long pulls;
        double totalReward;
        double averageReward;
    }
}
