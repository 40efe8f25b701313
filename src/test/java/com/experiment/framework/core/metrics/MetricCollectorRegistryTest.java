package com.experiment.framework.core.metrics;

import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.MetricEvent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.experiment.framework.core.metrics.CollectorFixtures.experiment;
import static com.experiment.framework.core.metrics.CollectorFixtures.value;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for MetricCollectorRegistry.
 */
class MetricCollectorRegistryTest {

    @Test
    void routesByMetricNameAndOmitsEmptySummaries() {
        LatencyCollector latency = new LatencyCollector();
        MetricCollectorRegistry registry = new MetricCollectorRegistry(List.of(new ConfidenceCollector(), latency));
        latency.collect("control", value("latency", "u1", 120.0));

        Map<String, Map<String, ?>> summaries = registry.calculateAll(experiment("latency"));

        assertThat(registry.forMetric("latency")).containsSame(latency);
        assertThat(registry.forMetric("conversion")).isEmpty();
        assertThat(registry.getMetricNames()).containsExactly("confidence", "latency");
        assertThat(summaries).containsOnlyKeys("latency");
    }

    @Test
    void failingCollectorIsLeftOut() {
        MetricCollector<String> broken = new MetricCollector<>() {
            @Override
            public String getMetricName() {
                return "broken";
            }

            @Override
            public void collect(String variant, MetricEvent event) {
            }

            @Override
            public Map<String, String> calculate(Experiment experiment) {
                throw new IllegalStateException("boom");
            }
        };
        ConfidenceCollector confidence = new ConfidenceCollector();
        confidence.collect("control", value("confidence", "u1", 0.7));
        MetricCollectorRegistry registry = new MetricCollectorRegistry(List.of(broken, confidence));

        assertThat(registry.calculateAll(experiment("confidence"))).containsOnlyKeys("confidence");
    }

    @Test
    void duplicateMetricNamesAreRejected() {
        assertThatThrownBy(() -> new MetricCollectorRegistry(List.of(new LatencyCollector(), new LatencyCollector())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("latency");
    }
}
