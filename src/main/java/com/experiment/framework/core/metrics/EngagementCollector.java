package com.experiment.framework.core.metrics;

import com.experiment.framework.core.ContextAttributes;
import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.MetricEvent;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * User actions per variant. Session length of a user is the time between their first and last action.
 */
@Component
@RequiredArgsConstructor
public class EngagementCollector extends AbstractMetricCollector<EngagementCollector.UserActionRecord, EngagementCollector.EngagementStats> {

    public static final String METRIC = "engagement";
    static final String UNKNOWN_ACTION = "unknown";

    private final Clock clock;

    @Override
    public String getMetricName() {
        return METRIC;
    }

    @Override
    public void collect(String variant, MetricEvent event) {
        String action = ContextAttributes.getString(event.getMetadata(), "action", UNKNOWN_ACTION);
        append(event.getExperimentId(), variant, new UserActionRecord(event.getUserId(), action,
                event.getTimestamp() != null ? event.getTimestamp() : clock.instant()));
    }

    @Override
    public Map<String, EngagementStats> calculate(Experiment experiment) {
        return perVariant(experiment, EngagementCollector::summarize);
    }

    private static EngagementStats summarize(List<UserActionRecord> actions) {
        Map<String, List<UserActionRecord>> byUser = actions.stream()
                .collect(Collectors.groupingBy(UserActionRecord::getUserId, LinkedHashMap::new, Collectors.toList()));
        long totalSessionMs = 0;
        for (List<UserActionRecord> userActions : byUser.values()) {
            if (userActions.size() > 1) {
                Instant first = userActions.stream().map(UserActionRecord::getTimestamp).min(Instant::compareTo).orElseThrow();
                Instant last = userActions.stream().map(UserActionRecord::getTimestamp).max(Instant::compareTo).orElseThrow();
                totalSessionMs += Duration.between(first, last).toMillis();
            }
        }
        Map<String, Long> counts = actions.stream()
                .collect(Collectors.groupingBy(UserActionRecord::getAction, LinkedHashMap::new, Collectors.counting()));
        Map<String, Double> distribution = counts.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue() / (double) actions.size(),
                        (a, b) -> a, LinkedHashMap::new));
        int users = byUser.size();
        return new EngagementStats((double) actions.size() / users, users, (double) totalSessionMs / users,
                Collections.unmodifiableMap(distribution));
    }

    @Value
    public static class UserActionRecord {
        String userId;
        String action;
        Instant timestamp;
    }

    @Value
    public static class EngagementStats {
        double avgActionsPerUser;
        int activeUsers;
        double avgSessionLengthMs;
        Map<String, Double> actionDistribution;
    }
}
