package com.experiment.framework.api;

import com.experiment.framework.core.ABTestingFramework;
import com.experiment.framework.core.analysis.AnalysisOptions;
import com.experiment.framework.core.analysis.AnalysisResult;
import com.experiment.framework.core.shadow.ShadowMetric;
import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.ExperimentAlert;
import com.experiment.framework.domain.ExperimentConfig;
import com.experiment.framework.domain.FrameworkStatus;
import com.experiment.framework.domain.MetricEvent;
import com.experiment.framework.domain.StopOutcome;
import com.experiment.framework.messaging.ExperimentEvent;
import com.experiment.framework.messaging.RecentEventsStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API over the experimentation engine: experiment lifecycle, assignment, metric ingestion and analysis.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/experiments")
@RequiredArgsConstructor
@Tag(name = "Experiments", description = "A/B experiments, assignments and statistical analysis")
public class ExperimentController {

    private final ABTestingFramework framework;
    private final RecentEventsStore recentEventsStore;

    @PostMapping
    @Operation(summary = "Create experiment", description = "Validates the definition, runs power analysis and starts the experiment")
    public ResponseEntity<Experiment> create(@Valid @RequestBody CreateExperimentRequestDto request) {
        Experiment experiment = framework.createExperiment(toConfig(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(experiment);
    }

    @GetMapping
    @Operation(summary = "List experiments", description = "All experiments, active and stopped, oldest first")
    public ResponseEntity<List<Experiment>> list() {
        return ResponseEntity.ok(framework.listExperiments());
    }

    @GetMapping("/status")
    @Operation(summary = "Framework status", description = "Experiment counts, performance counters and enabled engines")
    public ResponseEntity<FrameworkStatus> status() {
        return ResponseEntity.ok(framework.getStatus());
    }

    @GetMapping("/events")
    @Operation(summary = "Recent lifecycle events", description = "In-memory; last 100 events, newest first")
    public ResponseEntity<List<ExperimentEvent>> events(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(recentEventsStore.getRecent(limit));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get experiment")
    public ResponseEntity<Experiment> get(@PathVariable("id") String id) {
        return ResponseEntity.ok(framework.getExperiment(id)
                .orElseThrow(() -> new ExperimentNotFoundException("Experiment not found: " + id)));
    }

    @PostMapping("/{id}/assignments")
    @Operation(summary = "Assign user", description = "Sticky assignment. 204 when the experiment is stopped or the user is not targeted")
    public ResponseEntity<AssignmentResponseDto> assign(@PathVariable("id") String id,
                                                        @Valid @RequestBody AssignmentRequestDto request) {
        requireExperiment(id);
        String variant = framework.assignUserToExperiment(request.getUserId(), id, request.getContext());
        if (variant == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(new AssignmentResponseDto(id, request.getUserId(), variant));
    }

    @PostMapping("/{id}/metrics")
    @Operation(summary = "Track metric", description = "Ignored (recorded=false) when the user is not assigned")
    public ResponseEntity<Map<String, Object>> track(@PathVariable("id") String id,
                                                     @Valid @RequestBody MetricEventRequestDto request) {
        requireExperiment(id);
        if (request.getValue() == null && request.getPrediction() == null) {
            throw new ExperimentValidationException("Either value or prediction is required");
        }
        boolean recorded = framework.trackMetric(MetricEvent.builder()
                .userId(request.getUserId())
                .experimentId(id)
                .metricName(request.getMetricName())
                .value(request.getValue())
                .prediction(request.getPrediction())
                .metadata(request.getMetadata())
                .timestamp(request.getTimestamp())
                .build());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("recorded", recorded));
    }

    @PostMapping("/{id}/analysis")
    @Operation(summary = "Analyze experiment", description = "Frequentist always; Bayesian and sequential when enabled")
    public ResponseEntity<AnalysisResult> analyze(@PathVariable("id") String id,
                                                  @RequestParam(defaultValue = "true") boolean includeBayesian,
                                                  @RequestParam(defaultValue = "true") boolean includeSequential) {
        AnalysisOptions options = AnalysisOptions.builder()
                .includeBayesian(includeBayesian)
                .includeSequential(includeSequential)
                .build();
        return ResponseEntity.ok(framework.analyzeExperiment(id, options));
    }

    @PostMapping("/{id}/stop")
    @Operation(summary = "Stop experiment", description = "Stops once and runs the final analysis; 409 if already stopped")
    public ResponseEntity<StopOutcome> stop(@PathVariable("id") String id,
                                            @RequestBody(required = false) StopExperimentRequestDto request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(framework.stopExperiment(id, reason));
    }

    @GetMapping("/{id}/alerts")
    @Operation(summary = "Monitor alerts", description = "SRM, sample size and max duration alerts raised for the experiment")
    public ResponseEntity<List<ExperimentAlert>> alerts(@PathVariable("id") String id) {
        return ResponseEntity.ok(framework.getAlerts(id));
    }

    @GetMapping("/{id}/shadow-metrics")
    @Operation(summary = "Shadow metrics", description = "Per-variant shadow store; empty when the experiment is not in shadow mode")
    public ResponseEntity<Map<String, List<ShadowMetric>>> shadowMetrics(@PathVariable("id") String id) {
        return ResponseEntity.ok(framework.getShadowMetrics(id).orElse(Map.of()));
    }

    private void requireExperiment(String id) {
        if (framework.getExperiment(id).isEmpty()) {
            throw new ExperimentNotFoundException("Experiment not found: " + id);
        }
    }

    private static ExperimentConfig toConfig(CreateExperimentRequestDto request) {
        ExperimentConfig.ExperimentConfigBuilder builder = ExperimentConfig.builder()
                .id(request.getId())
                .name(request.getName())
                .description(request.getDescription())
                .primaryMetric(request.getPrimaryMetric())
                .assignmentStrategy(request.getAssignmentStrategy())
                .baselineRate(request.getBaselineRate())
                .minimumDetectableEffect(request.getMinimumDetectableEffect())
                .confidenceLevel(request.getConfidenceLevel())
                .power(request.getPower())
                .primaryMetricType(request.getPrimaryMetricType())
                .estimatedStandardDeviation(request.getEstimatedStandardDeviation())
                .dailyTraffic(request.getDailyTraffic())
                .shadowMode(request.isShadowMode())
                .controlVariant(request.getControlVariant())
                .treatmentVariant(request.getTreatmentVariant());
        for (VariantDto variant : request.getVariants()) {
            builder.variant(ExperimentConfig.VariantSpec.of(variant.getName(), variant.getWeight()));
        }
        if (request.getSecondaryMetrics() != null) {
            builder.secondaryMetrics(request.getSecondaryMetrics());
        }
        if (request.getTargetingRules() != null) {
            builder.targetingRules(request.getTargetingRules());
        }
        return builder.build();
    }
}
