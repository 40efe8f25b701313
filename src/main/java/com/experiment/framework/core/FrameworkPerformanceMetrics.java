package com.experiment.framework.core;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide counters for the experimentation engine. Thread-safe via atomics; read through {@link #snapshot()}.
 */
@Slf4j
@Component
public class FrameworkPerformanceMetrics {

    private final AtomicLong experimentsCreated = new AtomicLong();
    private final AtomicLong assignmentsMade = new AtomicLong();
    private final AtomicLong metricsCollected = new AtomicLong();
    private final AtomicLong analysesPerformed = new AtomicLong();
    private final LongAdder totalAssignmentNanos = new LongAdder();
    private final LongAdder totalAnalysisNanos = new LongAdder();

    public void recordExperimentCreated() {
        experimentsCreated.incrementAndGet();
    }

    /**
     * Record a new (non-cached) assignment and how long the strategy took.
     */
    public void recordAssignment(long elapsedNanos) {
        assignmentsMade.incrementAndGet();
        totalAssignmentNanos.add(elapsedNanos);
    }

    public void recordMetricCollected() {
        metricsCollected.incrementAndGet();
    }

    public void recordAnalysis(long elapsedNanos) {
        analysesPerformed.incrementAndGet();
        totalAnalysisNanos.add(elapsedNanos);
        log.debug("Analysis recorded, elapsed={}ms, total={}", elapsedNanos / 1_000_000.0, analysesPerformed.get());
    }

    public Snapshot snapshot() {
        long assignments = assignmentsMade.get();
        long analyses = analysesPerformed.get();
        return new Snapshot(
                experimentsCreated.get(),
                assignments,
                metricsCollected.get(),
                analyses,
                assignments == 0 ? 0.0 : totalAssignmentNanos.sum() / 1_000_000.0 / assignments,
                analyses == 0 ? 0.0 : totalAnalysisNanos.sum() / 1_000_000.0 / analyses
        );
    }

    /**
     * Immutable counters snapshot.
     */
    @Value
    public static class Snapshot {
        long experimentsCreated;
        long assignmentsMade;
        long metricsCollected;
        long analysesPerformed;
        double averageAssignmentTimeMs;
        double averageAnalysisTimeMs;
    }
}
