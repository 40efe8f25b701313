package com.experiment.framework.core.assignment;

import com.experiment.framework.core.ContextAttributes;
import com.experiment.framework.core.FrameworkSettings;
import com.experiment.framework.domain.AssignmentStrategyType;
import com.experiment.framework.domain.Experiment;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Linear contextual bandit. Each arm keeps a weight vector over
 * [confidence, ln(fileSize), userSegment == power_user]; the arm with the best dot product wins,
 * with uniform exploration at a fixed rate. Rewards move the winning arm's weights by lr * reward * x.
 */
@Slf4j
@Component
public class ContextualBanditStrategy implements RewardLearningStrategy {

    static final int FEATURE_COUNT = 3;
    static final double EXPLORATION_RATE = 0.1;
    static final String POWER_USER = "power_user";

    private final RandomGenerator random;
    private final double learningRate;

    // experimentId -> variant -> weights; each weights array is guarded by its own monitor
    private final Map<String, Map<String, double[]>> models = new ConcurrentHashMap<>();

    public ContextualBanditStrategy(RandomGenerator random, FrameworkSettings settings) {
        this.random = random;
        this.learningRate = settings.getBanditLearningRate();
    }

    @Override
    public String assign(String userId, Experiment experiment, Map<String, Object> context) {
        Map<String, double[]> model = modelFor(experiment);
        List<String> variants = experiment.variantNames();

        if (random.nextDouble() < EXPLORATION_RATE) {
            return variants.get(random.nextInt(variants.size()));
        }

        double[] features = extractFeatures(context);
        String best = variants.get(0);
        double bestScore = Double.NEGATIVE_INFINITY;
        for (String variant : variants) {
            double score = score(model.get(variant), features);
            if (score > bestScore) {
                bestScore = score;
                best = variant;
            }
        }
        log.debug("Contextual bandit experimentId={}, userId={}, variant={}, score={}", experiment.getId(), userId, best, bestScore);
        return best;
    }

    @Override
    public void updateReward(String experimentId, String variant, Map<String, Object> context, double reward) {
        Map<String, double[]> model = models.get(experimentId);
        double[] weights = model != null ? model.get(variant) : null;
        if (weights == null) {
            log.warn("Reward for unknown contextual arm experimentId={}, variant={}", experimentId, variant);
            return;
        }
        double[] features = extractFeatures(context);
        synchronized (weights) {
            for (int i = 0; i < FEATURE_COUNT; i++) {
                weights[i] += learningRate * reward * features[i];
            }
        }
    }

    /**
     * Copy of the current weight vectors, variant to weights.
     */
    public Map<String, double[]> getWeights(String experimentId) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        models.getOrDefault(experimentId, Map.of()).forEach((variant, weights) -> {
            synchronized (weights) {
                copy.put(variant, weights.clone());
            }
        });
        return copy;
    }

    static double[] extractFeatures(Map<String, Object> context) {
        double fileSize = ContextAttributes.getDouble(context, "fileSize", 1.0);
        return new double[]{
                ContextAttributes.getDouble(context, "confidence", 0.0),
                Math.log(fileSize > 0 ? fileSize : 1.0),
                POWER_USER.equals(ContextAttributes.getString(context, "userSegment", null)) ? 1.0 : 0.0
        };
    }

    private static double score(double[] weights, double[] features) {
        synchronized (weights) {
            double sum = 0.0;
            for (int i = 0; i < FEATURE_COUNT; i++) {
                sum += weights[i] * features[i];
            }
            return sum;
        }
    }

    private Map<String, double[]> modelFor(Experiment experiment) {
        return models.computeIfAbsent(experiment.getId(), id -> {
            Map<String, double[]> created = new LinkedHashMap<>();
            experiment.variantNames().forEach(v -> created.put(v, new double[FEATURE_COUNT]));
            return created;
        });
    }

    @Override
    public AssignmentStrategyType getType() {
        return AssignmentStrategyType.CONTEXTUAL_BANDIT;
    }
}
