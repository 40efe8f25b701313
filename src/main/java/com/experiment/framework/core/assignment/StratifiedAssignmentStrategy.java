package com.experiment.framework.core.assignment;

import com.experiment.framework.core.ContextAttributes;
import com.experiment.framework.domain.AssignmentStrategyType;
import com.experiment.framework.domain.Experiment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic hash assignment performed independently within each stratum (context {@code segment}).
 * Keeps per-stratum allocation counts so balance within a subpopulation can be checked.
 */
@Slf4j
@Component
public class StratifiedAssignmentStrategy implements AssignmentStrategy {

    static final String DEFAULT_STRATUM = "default";

    // experimentId -> stratum -> variant -> count
    private final Map<String, Map<String, Map<String, AtomicLong>>> allocations = new ConcurrentHashMap<>();

    @Override
    public String assign(String userId, Experiment experiment, Map<String, Object> context) {
        String stratum = ContextAttributes.getString(context, "segment", DEFAULT_STRATUM);
        int bucket = DeterministicAssignmentStrategy.bucketFor(userId + experiment.getId() + ":" + stratum);
        String variant = DeterministicAssignmentStrategy.variantForBucket(bucket, experiment.getVariants());
        allocations.computeIfAbsent(experiment.getId(), k -> new ConcurrentHashMap<>())
                .computeIfAbsent(stratum, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(variant, k -> new AtomicLong())
                .incrementAndGet();
        log.debug("Stratified assignment experimentId={}, stratum={}, variant={}", experiment.getId(), stratum, variant);
        return variant;
    }

    /**
     * Stratum to variant to number of users allocated so far.
     */
    public Map<String, Map<String, Long>> getAllocations(String experimentId) {
        Map<String, Map<String, Long>> result = new LinkedHashMap<>();
        allocations.getOrDefault(experimentId, Map.of()).forEach((stratum, counts) -> {
            Map<String, Long> perVariant = new LinkedHashMap<>();
            counts.forEach((variant, count) -> perVariant.put(variant, count.get()));
            result.put(stratum, perVariant);
        });
        return result;
    }

    @Override
    public AssignmentStrategyType getType() {
        return AssignmentStrategyType.STRATIFIED;
    }
}
