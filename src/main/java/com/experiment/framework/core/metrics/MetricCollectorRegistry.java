package com.experiment.framework.core.metrics;

import com.experiment.framework.domain.Experiment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Routes metric events to the collector registered for the metric name.
 */
@Slf4j
@Component
public class MetricCollectorRegistry {

    private final Map<String, MetricCollector<?>> collectors;

    public MetricCollectorRegistry(List<MetricCollector<?>> collectors) {
        this.collectors = collectors.stream()
                .collect(Collectors.toMap(MetricCollector::getMetricName, Function.identity(), (a, b) -> {
                    throw new IllegalStateException("Duplicate collector for metric " + a.getMetricName());
                }, LinkedHashMap::new));
        log.info("Metric collectors registered: {}", this.collectors.keySet());
    }

    public Optional<MetricCollector<?>> forMetric(String metricName) {
        return Optional.ofNullable(collectors.get(metricName));
    }

    /**
     * Collector name to per-variant summary. A failing collector is logged and left out.
     */
    public Map<String, Map<String, ?>> calculateAll(Experiment experiment) {
        Map<String, Map<String, ?>> summaries = new LinkedHashMap<>();
        collectors.forEach((name, collector) -> {
            try {
                Map<String, ?> summary = collector.calculate(experiment);
                if (!summary.isEmpty()) {
                    summaries.put(name, summary);
                }
            } catch (RuntimeException e) {
                log.warn("Collector failed experimentId={}, collector={}", experiment.getId(), name, e);
            }
        });
        return summaries;
    }

    public List<String> getMetricNames() {
        return List.copyOf(collectors.keySet());
    }
}
