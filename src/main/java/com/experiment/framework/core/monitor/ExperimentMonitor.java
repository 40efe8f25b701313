package com.experiment.framework.core.monitor;

import com.experiment.framework.api.InvalidExperimentStateException;
import com.experiment.framework.core.ABTestingFramework;
import com.experiment.framework.core.FrameworkSettings;
import com.experiment.framework.core.analysis.FrequentistResult.SampleRatioCheck;
import com.experiment.framework.domain.AlertSeverity;
import com.experiment.framework.domain.AlertType;
import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.ExperimentAlert;
import com.experiment.framework.messaging.ExperimentEventPublisher;
import com.experiment.framework.messaging.ExperimentEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically checks tracked experiments for sample ratio mismatch, reached sample size and exceeded
 * maximum duration. Exceeding the maximum duration force-stops the experiment.
 * Runs on a single daemon thread started by {@link #start(ABTestingFramework)}.
 */
@Slf4j
@Component
public class ExperimentMonitor {

    private final ExperimentEventPublisher eventPublisher;
    private final FrameworkSettings settings;
    private final Clock clock;
    private final long intervalMs;
    private final boolean enabled;

    private final Map<String, Tracking> tracked = new ConcurrentHashMap<>();
    private final Map<String, List<ExperimentAlert>> alerts = new ConcurrentHashMap<>();

    private volatile ABTestingFramework framework;
    private ScheduledExecutorService scheduler;

    public ExperimentMonitor(ExperimentEventPublisher eventPublisher,
                             FrameworkSettings settings,
                             Clock clock,
                             @Value("${experiment.monitor.interval-ms:60000}") long intervalMs,
                             @Value("${experiment.monitor.enabled:true}") boolean enabled) {
        this.eventPublisher = eventPublisher;
        this.settings = settings;
        this.clock = clock;
        this.intervalMs = intervalMs;
        this.enabled = enabled;
    }

    /**
     * Attach to the framework and, if enabled, start the periodic sweep. Calling it again is a no-op.
     */
    public synchronized void start(ABTestingFramework framework) {
        this.framework = framework;
        if (!enabled || scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "experiment-monitor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::checkExperiments, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Experiment monitor started, intervalMs={}", intervalMs);
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("Experiment monitor stopped");
        }
    }

    public void trackExperiment(String experimentId) {
        tracked.putIfAbsent(experimentId, new Tracking());
    }

    public void stopTracking(String experimentId) {
        tracked.remove(experimentId);
    }

    public boolean isTracking(String experimentId) {
        return tracked.containsKey(experimentId);
    }

    /**
     * Alerts raised for the experiment, oldest first. Kept after the experiment stops.
     */
    public List<ExperimentAlert> getAlerts(String experimentId) {
        List<ExperimentAlert> list = alerts.get(experimentId);
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    /**
     * One sweep over all tracked experiments. A failure on one experiment is logged and the sweep continues.
     */
    public void checkExperiments() {
        ABTestingFramework target = framework;
        if (target == null) {
            return;
        }
        for (String experimentId : List.copyOf(tracked.keySet())) {
            try {
                checkExperiment(target, experimentId);
            } catch (RuntimeException e) {
                log.error("Monitor check failed experimentId={}", experimentId, e);
            }
        }
    }

    private void checkExperiment(ABTestingFramework target, String experimentId) {
        Optional<Experiment> found = target.getExperiment(experimentId);
        if (found.isEmpty() || !found.get().isActive()) {
            stopTracking(experimentId);
            return;
        }
        Experiment experiment = found.get();
        Tracking tracking = tracked.get(experimentId);
        if (tracking == null) {
            return;
        }

        Optional<SampleRatioCheck> srm = target.checkSampleRatio(experimentId);
        if (srm.isPresent() && srm.get().isMismatchDetected()) {
            raise(experimentId, AlertType.SRM_DETECTED, AlertSeverity.HIGH,
                    "Sample ratio mismatch detected (p=" + srm.get().getPValue() + ")",
                    Map.of("pValue", srm.get().getPValue(), "observed", srm.get().getObserved(),
                            "expected", srm.get().getExpected()));
        }

        long totalUsers = srm.map(s -> s.getObserved().values().stream().mapToLong(Integer::longValue).sum()).orElse(0L);
        if (experiment.getRequiredSampleSize() > 0 && totalUsers >= experiment.getRequiredSampleSize()
                && !tracking.sampleSizeAlerted) {
            tracking.sampleSizeAlerted = true;
            raise(experimentId, AlertType.SAMPLE_SIZE_REACHED, AlertSeverity.INFO,
                    "Required sample size reached", Map.of("current", totalUsers, "required", experiment.getRequiredSampleSize()));
        }

        Instant now = clock.instant();
        Duration runtime = Duration.between(experiment.getStartTime(), now);
        if (runtime.compareTo(settings.getMaxExperimentDuration()) >= 0) {
            raise(experimentId, AlertType.MAX_DURATION_REACHED, AlertSeverity.MEDIUM,
                    "Maximum experiment duration reached", Map.of("runtimeMs", runtime.toMillis(),
                            "maxDurationMs", settings.getMaxExperimentDuration().toMillis()));
            try {
                target.stopExperiment(experimentId, "max_duration_reached");
            } catch (InvalidExperimentStateException e) {
                log.debug("Experiment already stopped experimentId={}", experimentId);
            }
            stopTracking(experimentId);
        }
    }

    private void raise(String experimentId, AlertType type, AlertSeverity severity, String message, Map<String, Object> data) {
        ExperimentAlert alert = ExperimentAlert.builder()
                .experimentId(experimentId)
                .type(type)
                .severity(severity)
                .message(message)
                .data(data)
                .timestamp(clock.instant())
                .build();
        alerts.computeIfAbsent(experimentId, k -> Collections.synchronizedList(new ArrayList<>())).add(alert);
        log.warn("Experiment alert experimentId={}, type={}, severity={}: {}", experimentId, type, severity, message);
        eventPublisher.publish(ExperimentEventType.EXPERIMENT_ALERT, experimentId, alert);
    }

    private static final class Tracking {
        private volatile boolean sampleSizeAlerted;
    }
}
