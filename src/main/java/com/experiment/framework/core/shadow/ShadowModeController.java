package com.experiment.framework.core.shadow;

import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.MetricEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps a store of metrics per shadow-mode experiment, isolated from the analysis path.
 * Shadow data never affects assignment or analysis and is discarded at teardown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShadowModeController {

    private final Clock clock;

    private final Map<String, ShadowStore> experiments = new ConcurrentHashMap<>();

    public void setup(Experiment experiment) {
        experiments.put(experiment.getId(), new ShadowStore(clock.instant()));
        log.info("Shadow mode enabled experimentId={}", experiment.getId());
    }

    public boolean isShadowing(String experimentId) {
        return experiments.containsKey(experimentId);
    }

    /**
     * Record the event for the variant, stamped with the current time when the event has none.
     * No-op if the experiment is not in shadow mode.
     */
    public void track(String variant, MetricEvent event) {
        ShadowStore store = experiments.get(event.getExperimentId());
        if (store == null) {
            return;
        }
        store.metrics.computeIfAbsent(variant, k -> Collections.synchronizedList(new ArrayList<>()))
                .add(new ShadowMetric(event.getUserId(), event.getMetricName(), event.numericValue(),
                        event.getTimestamp() != null ? event.getTimestamp() : clock.instant(), true));
    }

    /**
     * Variant to shadow metrics, copied; empty if the experiment is not (or no longer) in shadow mode.
     */
    public Optional<Map<String, List<ShadowMetric>>> getShadowMetrics(String experimentId) {
        ShadowStore store = experiments.get(experimentId);
        if (store == null) {
            return Optional.empty();
        }
        Map<String, List<ShadowMetric>> copy = new LinkedHashMap<>();
        store.metrics.forEach((variant, metrics) -> {
            synchronized (metrics) {
                copy.put(variant, List.copyOf(metrics));
            }
        });
        return Optional.of(copy);
    }

    public void teardown(String experimentId) {
        ShadowStore removed = experiments.remove(experimentId);
        if (removed != null) {
            int count = removed.metrics.values().stream().mapToInt(List::size).sum();
            log.info("Shadow mode disabled experimentId={}, since={}, discardedMetrics={}", experimentId, removed.startedAt, count);
        }
    }

    private static final class ShadowStore {
        private final Instant startedAt;
        private final Map<String, List<ShadowMetric>> metrics = new ConcurrentHashMap<>();

        private ShadowStore(Instant startedAt) {
            this.startedAt = startedAt;
        }
    }
}
