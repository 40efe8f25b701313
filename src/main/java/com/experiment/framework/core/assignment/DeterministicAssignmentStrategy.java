package com.experiment.framework.core.assignment;

import com.experiment.framework.domain.AssignmentStrategyType;
import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.Variant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Hash-based assignment: the same user always lands in the same variant of the same experiment,
 * across restarts and processes. Bucket = abs(hashCode(userId + experimentId)) mod 100.
 */
@Slf4j
@Component
public class DeterministicAssignmentStrategy implements AssignmentStrategy {

    static final int BUCKETS = 100;

    @Override
    public String assign(String userId, Experiment experiment, Map<String, Object> context) {
        return variantForBucket(bucketFor(userId + experiment.getId()), experiment.getVariants());
    }

    /**
     * Bucket in [0, 100) for the key. Widened to long so abs(Integer.MIN_VALUE) stays positive.
     */
    static int bucketFor(String key) {
        return (int) (Math.abs((long) key.hashCode()) % BUCKETS);
    }

    static String variantForBucket(int bucket, List<Variant> variants) {
        double cumulative = 0.0;
        for (Variant variant : variants) {
            cumulative += variant.getNormalizedWeight() * BUCKETS;
            if (bucket < cumulative) {
                return variant.getName();
            }
        }
        return variants.get(variants.size() - 1).getName();
    }

    @Override
    public AssignmentStrategyType getType() {
        return AssignmentStrategyType.DETERMINISTIC;
    }
}
