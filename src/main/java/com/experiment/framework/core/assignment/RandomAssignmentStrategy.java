package com.experiment.framework.core.assignment;

import com.experiment.framework.domain.AssignmentStrategyType;
import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.Variant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Uniform draw in [0, 1) walked over cumulative normalized weights.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RandomAssignmentStrategy implements AssignmentStrategy {

    private final RandomGenerator random;

    @Override
    public String assign(String userId, Experiment experiment, Map<String, Object> context) {
        double draw = random.nextDouble();
        List<Variant> variants = experiment.getVariants();
        double cumulative = 0.0;
        for (Variant variant : variants) {
            cumulative += variant.getNormalizedWeight();
            if (draw < cumulative) {
                return variant.getName();
            }
        }
        // rounding left the cumulative sum slightly below 1
        return variants.get(variants.size() - 1).getName();
    }

    @Override
    public AssignmentStrategyType getType() {
        return AssignmentStrategyType.RANDOM;
    }
}
