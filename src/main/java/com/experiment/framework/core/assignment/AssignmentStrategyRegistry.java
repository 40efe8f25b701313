package com.experiment.framework.core.assignment;

import com.experiment.framework.api.UnknownStrategyException;
import com.experiment.framework.domain.AssignmentStrategyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves assignment strategies by type or config name. Fails at construction if any
 * {@link AssignmentStrategyType} has no implementation, or has two.
 */
@Slf4j
@Component
public class AssignmentStrategyRegistry {

    private final Map<AssignmentStrategyType, AssignmentStrategy> strategies;

    public AssignmentStrategyRegistry(List<AssignmentStrategy> strategies) {
        Map<AssignmentStrategyType, AssignmentStrategy> byType = new EnumMap<>(AssignmentStrategyType.class);
        for (AssignmentStrategy strategy : strategies) {
            AssignmentStrategy previous = byType.put(strategy.getType(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate assignment strategy for " + strategy.getType() + ": "
                        + previous.getClass().getSimpleName() + ", " + strategy.getClass().getSimpleName());
            }
        }
        Set<AssignmentStrategyType> missing = EnumSet.allOf(AssignmentStrategyType.class);
        missing.removeAll(byType.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No assignment strategy implementation for " + missing);
        }
        this.strategies = byType;
        log.info("Assignment strategies registered: {}", byType.keySet());
    }

    public AssignmentStrategy get(AssignmentStrategyType type) {
        return strategies.get(type);
    }

    /**
     * @throws UnknownStrategyException if the name matches no strategy
     */
    public AssignmentStrategy get(String name) {
        return strategies.get(AssignmentStrategyType.fromName(name));
    }
}
