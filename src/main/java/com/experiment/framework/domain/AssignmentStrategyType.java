package com.experiment.framework.domain;

import com.experiment.framework.api.UnknownStrategyException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Closed set of assignment strategies. Config files and API requests refer to them by config name.
 */
public enum AssignmentStrategyType {
    RANDOM("random"),
    DETERMINISTIC("deterministic"),
    STRATIFIED("stratified"),
    MULTI_ARMED_BANDIT("multiArmedBandit"),
    CONTEXTUAL_BANDIT("contextual");

    private final String configName;

    AssignmentStrategyType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public boolean isBandit() {
        return this == MULTI_ARMED_BANDIT || this == CONTEXTUAL_BANDIT;
    }

    /**
     * Resolve a strategy by config name ("multiArmedBandit") or enum name ("MULTI_ARMED_BANDIT").
     *
     * @throws UnknownStrategyException if no strategy matches
     */
    public static AssignmentStrategyType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownStrategyException("Assignment strategy name is blank");
        }
        for (AssignmentStrategyType type : values()) {
            if (type.configName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new UnknownStrategyException("Unknown assignment strategy: " + name + ". Available: "
                + Arrays.stream(values()).map(AssignmentStrategyType::getConfigName).collect(Collectors.joining(", ")));
    }
}
