package com.experiment.framework.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Decides whether a user is eligible for an experiment. Every rule must hold; an empty rule set admits everyone.
 * <ul>
 *   <li>{@code userSegment}: context {@code segment} must equal the rule value</li>
 *   <li>{@code minConfidence}: context {@code confidence} must be at least the rule value</li>
 *   <li>any other key: context value must equal the rule value, or be one of them when the rule is a collection</li>
 * </ul>
 */
@Slf4j
@Component
public class TargetingRuleEvaluator {

    static final String USER_SEGMENT = "userSegment";
    static final String MIN_CONFIDENCE = "minConfidence";

    public boolean matches(String userId, Map<String, Object> rules, Map<String, Object> context) {
        if (rules == null || rules.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> rule : rules.entrySet()) {
            if (!matchesRule(rule.getKey(), rule.getValue(), context)) {
                log.debug("Targeting rejected userId={}, rule={}", userId, rule.getKey());
                return false;
            }
        }
        return true;
    }

    private boolean matchesRule(String key, Object expected, Map<String, Object> context) {
        switch (key) {
            case USER_SEGMENT:
                return Objects.equals(stringOrNull(expected), ContextAttributes.getString(context, "segment", null));
            case MIN_CONFIDENCE:
                double confidence = ContextAttributes.getDouble(context, "confidence", Double.NaN);
                return !Double.isNaN(confidence) && expected != null
                        && confidence >= Double.parseDouble(expected.toString());
            default:
                Object actual = context != null ? context.get(key) : null;
                if (expected instanceof Collection) {
                    return actual != null && ((Collection<?>) expected).stream()
                            .anyMatch(candidate -> valueEquals(candidate, actual));
                }
                return valueEquals(expected, actual);
        }
    }

    private static boolean valueEquals(Object expected, Object actual) {
        if (expected instanceof Number && actual instanceof Number) {
            return ((Number) expected).doubleValue() == ((Number) actual).doubleValue();
        }
        return Objects.equals(stringOrNull(expected), stringOrNull(actual));
    }

    private static String stringOrNull(Object value) {
        return value != null ? value.toString() : null;
    }
}
