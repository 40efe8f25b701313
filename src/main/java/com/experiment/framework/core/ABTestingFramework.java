package com.experiment.framework.core;

import com.experiment.framework.api.ExperimentNotFoundException;
import com.experiment.framework.api.ExperimentValidationException;
import com.experiment.framework.api.InvalidExperimentStateException;
import com.experiment.framework.core.AssignmentRepository.StoreResult;
import com.experiment.framework.core.MetricStore.MetricRecord;
import com.experiment.framework.core.analysis.AnalysisDataset;
import com.experiment.framework.core.analysis.AnalysisOptions;
import com.experiment.framework.core.analysis.AnalysisResult;
import com.experiment.framework.core.analysis.AnalysisStatus;
import com.experiment.framework.core.analysis.BayesianAnalysisEngine;
import com.experiment.framework.core.analysis.BayesianResult;
import com.experiment.framework.core.analysis.FrequentistAnalysisEngine;
import com.experiment.framework.core.analysis.FrequentistResult;
import com.experiment.framework.core.analysis.FrequentistResult.SampleRatioCheck;
import com.experiment.framework.core.analysis.InsufficientDataException;
import com.experiment.framework.core.analysis.PowerAnalysisCalculator;
import com.experiment.framework.core.analysis.PowerAnalysisRequest;
import com.experiment.framework.core.analysis.PowerAnalysisResult;
import com.experiment.framework.core.analysis.SequentialResult;
import com.experiment.framework.core.analysis.SequentialTestingEngine;
import com.experiment.framework.core.analysis.SequentialTestingEngine.BoundaryCheck;
import com.experiment.framework.core.analysis.StatisticalAnalysisException;
import com.experiment.framework.core.assignment.AssignmentStrategy;
import com.experiment.framework.core.assignment.AssignmentStrategyRegistry;
import com.experiment.framework.core.assignment.RewardLearningStrategy;
import com.experiment.framework.core.metrics.MetricCollectorRegistry;
import com.experiment.framework.core.monitor.ExperimentMonitor;
import com.experiment.framework.core.shadow.ShadowMetric;
import com.experiment.framework.core.shadow.ShadowModeController;
import com.experiment.framework.domain.Assignment;
import com.experiment.framework.domain.AssignmentStrategyType;
import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.ExperimentAlert;
import com.experiment.framework.domain.ExperimentConfig;
import com.experiment.framework.domain.ExperimentConfig.VariantSpec;
import com.experiment.framework.domain.ExperimentStatus;
import com.experiment.framework.domain.FrameworkStatus;
import com.experiment.framework.domain.MetricEvent;
import com.experiment.framework.domain.MlConfidenceUpdate;
import com.experiment.framework.domain.StopOutcome;
import com.experiment.framework.domain.UserAction;
import com.experiment.framework.domain.Variant;
import com.experiment.framework.messaging.ExperimentEventPublisher;
import com.experiment.framework.messaging.ExperimentEventType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Experimentation engine entry point: experiment registry, assignment, metric ingestion, analysis and lifecycle.
 * Assignment and tracking never throw; they log and return null / false instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ABTestingFramework {

    public static final String DEFAULT_STRATEGY = "random";
    public static final String DEFAULT_CONTROL = "control";
    public static final String DEFAULT_TREATMENT = "treatment";
    public static final double DEFAULT_BASELINE_RATE = 0.5;
    public static final double DEFAULT_MINIMUM_DETECTABLE_EFFECT = 0.05;

    public static final String STOP_MANUAL = "manual";
    public static final String STOP_SEQUENTIAL_BOUNDARY = "sequential_boundary_reached";
    public static final String STOP_FRAMEWORK_SHUTDOWN = "framework_shutdown";

    static final String CONFIDENCE_METRIC = "confidence";
    static final String ENGAGEMENT_METRIC = "engagement";

    private final ExperimentRepository experimentRepository;
    private final AssignmentRepository assignmentRepository;
    private final MetricStore metricStore;
    private final AssignmentStrategyRegistry strategyRegistry;
    private final MetricCollectorRegistry collectorRegistry;
    private final TargetingRuleEvaluator targetingRuleEvaluator;
    private final FrequentistAnalysisEngine frequentistEngine;
    private final BayesianAnalysisEngine bayesianEngine;
    private final SequentialTestingEngine sequentialEngine;
    private final PowerAnalysisCalculator powerAnalysisCalculator;
    private final ExperimentMonitor monitor;
    private final ShadowModeController shadowModeController;
    private final ExperimentEventPublisher eventPublisher;
    private final FrameworkPerformanceMetrics performanceMetrics;
    private final FrameworkSettings settings;
    private final Clock clock;

    private final Map<String, AnalysisResult> latestResults = new ConcurrentHashMap<>();
    private volatile boolean initialized;

    @PostConstruct
    public void initialize() {
        monitor.start(this);
        initialized = true;
        log.info("Experimentation engine initialized, bayesian={}, sequential={}, correction={}",
                settings.isEnableBayesian(), settings.isEnableSequentialTesting(), settings.getMultipleTestingCorrection());
    }

    /**
     * Stop the monitor and every active experiment (reason {@value #STOP_FRAMEWORK_SHUTDOWN}).
     */
    @PreDestroy
    public void shutdown() {
        monitor.stop();
        for (Experiment experiment : experimentRepository.findActive()) {
            try {
                stopExperiment(experiment.getId(), STOP_FRAMEWORK_SHUTDOWN);
            } catch (InvalidExperimentStateException e) {
                log.debug("Experiment already stopped during shutdown experimentId={}", experiment.getId());
            }
        }
        initialized = false;
        log.info("Experimentation engine shut down");
    }

    /**
     * Validate, run power analysis and register a new ACTIVE experiment. Nothing is stored if validation fails.
     *
     * @throws ExperimentValidationException for an invalid definition or power-analysis input
     * @throws com.experiment.framework.api.UnknownStrategyException for an unknown strategy name
     */
    public Experiment createExperiment(ExperimentConfig config) {
        validate(config);
        AssignmentStrategyType strategy = AssignmentStrategyType.fromName(
                config.getAssignmentStrategy() != null ? config.getAssignmentStrategy() : DEFAULT_STRATEGY);

        double totalWeight = config.getVariants().stream().mapToDouble(VariantSpec::getWeight).sum();
        List<Variant> variants = new ArrayList<>();
        for (VariantSpec spec : config.getVariants()) {
            variants.add(Variant.builder()
                    .name(spec.getName())
                    .weight(spec.getWeight())
                    .normalizedWeight(spec.getWeight() / totalWeight)
                    .build());
        }
        List<String> variantNames = variants.stream().map(Variant::getName).collect(Collectors.toList());
        String control = resolveArm(config.getControlVariant(), DEFAULT_CONTROL, variantNames, null);
        String treatment = resolveArm(config.getTreatmentVariant(), DEFAULT_TREATMENT, variantNames, control);
        if (control.equals(treatment)) {
            throw new ExperimentValidationException("Control and treatment must be different variants");
        }

        PowerAnalysisResult power = powerAnalysisCalculator.calculate(PowerAnalysisRequest.builder()
                .baselineRate(orDefault(config.getBaselineRate(), DEFAULT_BASELINE_RATE))
                .minimumDetectableEffect(orDefault(config.getMinimumDetectableEffect(), DEFAULT_MINIMUM_DETECTABLE_EFFECT))
                .confidenceLevel(orDefault(config.getConfidenceLevel(), settings.getConfidenceLevel()))
                .power(orDefault(config.getPower(), settings.getPower()))
                .variants(variants.size())
                .metricType(config.getPrimaryMetricType() != null
                        ? config.getPrimaryMetricType()
                        : PowerAnalysisCalculator.inferMetricType(config.getPrimaryMetric()))
                .standardDeviation(config.getEstimatedStandardDeviation())
                .dailyTraffic(config.getDailyTraffic() != null ? config.getDailyTraffic() : settings.getDefaultDailyTraffic())
                .build());
        long requiredSampleSize = Math.max(power.getTotalSampleSize(), (long) settings.getMinSampleSize() * variants.size());

        Instant now = clock.instant();
        Experiment experiment = Experiment.builder()
                .id(config.getId() != null && !config.getId().isBlank() ? config.getId() : "exp_" + UUID.randomUUID())
                .name(config.getName())
                .description(config.getDescription())
                .status(ExperimentStatus.ACTIVE)
                .variants(List.copyOf(variants))
                .primaryMetric(config.getPrimaryMetric())
                .secondaryMetrics(List.copyOf(config.getSecondaryMetrics()))
                .assignmentStrategy(strategy)
                .targetingRules(Collections.unmodifiableMap(new LinkedHashMap<>(config.getTargetingRules())))
                .requiredSampleSize(requiredSampleSize)
                .minRunTime(power.getMinRunTime())
                .powerAnalysis(power)
                .shadowMode(config.isShadowMode())
                .controlVariant(control)
                .treatmentVariant(treatment)
                .createdAt(now)
                .startTime(now)
                .build();

        experimentRepository.save(experiment);
        if (experiment.isShadowMode()) {
            shadowModeController.setup(experiment);
        }
        monitor.trackExperiment(experiment.getId());
        performanceMetrics.recordExperimentCreated();
        eventPublisher.publish(ExperimentEventType.EXPERIMENT_CREATED, experiment.getId(), experiment);
        log.info("Experiment created experimentId={}, name={}, strategy={}, variants={}, requiredSampleSize={}",
                experiment.getId(), experiment.getName(), strategy.getConfigName(), variantNames, requiredSampleSize);
        return experiment;
    }

    /**
     * Sticky assignment of a user to a variant.
     *
     * @return variant name, or null if the experiment is unknown or stopped, the user is not targeted,
     * or the strategy failed
     */
    public String assignUserToExperiment(String userId, String experimentId, Map<String, Object> context) {
        try {
            if (userId == null || userId.isBlank()) {
                log.warn("Assignment rejected: blank userId, experimentId={}", experimentId);
                return null;
            }
            Optional<Experiment> found = experimentRepository.findById(experimentId);
            if (found.isEmpty() || !found.get().isActive()) {
                log.debug("Assignment skipped, experiment missing or not active experimentId={}", experimentId);
                return null;
            }
            Experiment experiment = found.get();
            Map<String, Object> ctx = context != null ? context : Map.of();
            if (!targetingRuleEvaluator.matches(userId, experiment.getTargetingRules(), ctx)) {
                return null;
            }

            AssignmentStrategy strategy = strategyRegistry.get(experiment.getAssignmentStrategy());
            long start = System.nanoTime();
            StoreResult stored = assignmentRepository.assignIfAbsent(userId, experimentId, () -> {
                String variant = strategy.assign(userId, experiment, ctx);
                if (experiment.findVariant(variant).isEmpty()) {
                    throw new IllegalStateException("Strategy " + strategy.getStrategyName() + " returned unknown variant " + variant);
                }
                return new Assignment(userId, experimentId, variant,
                        Collections.unmodifiableMap(new HashMap<>(ctx)), clock.instant());
            });
            if (stored.getAssignment() == null) {
                return null;
            }
            if (stored.isCreated()) {
                performanceMetrics.recordAssignment(System.nanoTime() - start);
                eventPublisher.publish(ExperimentEventType.USER_ASSIGNED, experimentId, stored.getAssignment());
                log.debug("User assigned experimentId={}, userId={}, variant={}, strategy={}",
                        experimentId, userId, stored.getAssignment().getVariant(), strategy.getStrategyName());
            }
            return stored.getAssignment().getVariant();
        } catch (RuntimeException e) {
            log.error("Assignment failed experimentId={}, userId={}", experimentId, userId, e);
            return null;
        }
    }

    /**
     * Ingest one metric event for an assigned user.
     *
     * @return true if the event was recorded; false if the user is unassigned, the experiment is not active,
     * or the event was invalid
     */
    public boolean trackMetric(MetricEvent event) {
        try {
            if (event == null || event.getUserId() == null || event.getExperimentId() == null || event.getMetricName() == null) {
                log.warn("Metric event rejected: userId, experimentId and metricName are required, event={}", event);
                return false;
            }
            Optional<Assignment> assignment = assignmentRepository.find(event.getUserId(), event.getExperimentId());
            if (assignment.isEmpty()) {
                log.debug("Metric ignored, user not assigned experimentId={}, userId={}", event.getExperimentId(), event.getUserId());
                return false;
            }
            Optional<Experiment> found = experimentRepository.findById(event.getExperimentId());
            if (found.isEmpty() || !found.get().isActive()) {
                log.debug("Metric ignored, experiment not active experimentId={}", event.getExperimentId());
                return false;
            }
            Experiment experiment = found.get();
            String variant = assignment.get().getVariant();
            MetricEvent normalized = event.getTimestamp() != null ? event : event.toBuilder().timestamp(clock.instant()).build();
            double value = normalized.numericValue();

            metricStore.append(experiment.getId(), variant, normalized.getMetricName(),
                    new MetricRecord(normalized.getUserId(), value, normalized.getMetadata(), normalized.getTimestamp()));
            collectorRegistry.forMetric(normalized.getMetricName()).ifPresent(c -> c.collect(variant, normalized));
            performanceMetrics.recordMetricCollected();

            if (experiment.isShadowMode()) {
                shadowModeController.track(variant, normalized);
            }

            if (experiment.getPrimaryMetric().equals(normalized.getMetricName())) {
                onPrimaryMetric(experiment, variant, assignment.get(), value);
            }
            return true;
        } catch (RuntimeException e) {
            log.error("Metric tracking failed experimentId={}, userId={}, metric={}",
                    event != null ? event.getExperimentId() : null,
                    event != null ? event.getUserId() : null,
                    event != null ? event.getMetricName() : null, e);
            return false;
        }
    }

    /**
     * Bandit reward and sequential boundary check. The event is already stored, so failures here are only logged.
     */
    private void onPrimaryMetric(Experiment experiment, String variant, Assignment assignment, double value) {
        try {
            if (experiment.getAssignmentStrategy().isBandit()) {
                AssignmentStrategy strategy = strategyRegistry.get(experiment.getAssignmentStrategy());
                if (strategy instanceof RewardLearningStrategy) {
                    ((RewardLearningStrategy) strategy).updateReward(experiment.getId(), variant, assignment.getContext(), value);
                }
            }
            if (settings.isEnableSequentialTesting()) {
                checkSequentialBoundary(experiment);
            }
        } catch (RuntimeException e) {
            log.warn("Post-ingestion step failed experimentId={}, variant={}", experiment.getId(), variant, e);
        }
    }

    private void checkSequentialBoundary(Experiment experiment) {
        BoundaryCheck check = sequentialEngine.checkBoundaries(dataset(experiment));
        if (!check.isShouldStop()) {
            return;
        }
        SequentialResult.Decision decision = check.getResult().getDecision();
        log.info("Sequential boundary crossed experimentId={}, stage={}, winner={}, z={}",
                experiment.getId(), decision.getStage(), decision.getWinningVariant(), check.getResult().getTestStatistic());
        try {
            stopExperiment(experiment.getId(), STOP_SEQUENTIAL_BOUNDARY);
        } catch (InvalidExperimentStateException e) {
            log.debug("Experiment already stopped experimentId={}", experiment.getId());
        }
    }

    /**
     * Run the enabled engines over one snapshot of the experiment's metrics.
     *
     * @throws ExperimentNotFoundException for an unknown id
     * @throws StatisticalAnalysisException when the data cannot be analysed (e.g. degenerate primary metric)
     */
    public AnalysisResult analyzeExperiment(String experimentId, AnalysisOptions options) {
        Experiment experiment = requireExperiment(experimentId);
        AnalysisOptions opts = options != null ? options : AnalysisOptions.defaults();
        long start = System.nanoTime();
        Instant now = clock.instant();
        long runtimeMs = Duration.between(experiment.getStartTime(),
                experiment.getEndTime() != null ? experiment.getEndTime() : now).toMillis();

        if (!metricStore.hasMetrics(experimentId)) {
            log.info("Analysis skipped, no metrics experimentId={}", experimentId);
            return AnalysisResult.insufficientData(experimentId, "No metrics collected", Map.of(), runtimeMs, now);
        }

        AnalysisDataset data = dataset(experiment);
        FrequentistResult frequentist;
        try {
            frequentist = frequentistEngine.analyze(data);
        } catch (InsufficientDataException e) {
            log.info("Analysis has insufficient data experimentId={}: {}", experimentId, e.getMessage());
            return AnalysisResult.insufficientData(experimentId, e.getMessage(), data.getSampleSizes(), runtimeMs, now);
        }

        Map<String, String> engineErrors = new LinkedHashMap<>();
        BayesianResult bayesian = null;
        if (settings.isEnableBayesian() && opts.isIncludeBayesian()) {
            try {
                bayesian = bayesianEngine.analyze(data);
            } catch (InsufficientDataException | StatisticalAnalysisException e) {
                engineErrors.put("bayesian", e.getMessage());
            }
        }
        SequentialResult sequential = null;
        if (settings.isEnableSequentialTesting() && opts.isIncludeSequential()) {
            try {
                sequential = sequentialEngine.analyze(data);
            } catch (InsufficientDataException | StatisticalAnalysisException e) {
                engineErrors.put("sequential", e.getMessage());
            }
        }

        AnalysisResult result = AnalysisResult.builder()
                .experimentId(experimentId)
                .status(AnalysisStatus.COMPLETED)
                .frequentist(frequentist)
                .bayesian(bayesian)
                .sequential(sequential)
                .sampleSizes(data.getSampleSizes())
                .runtimeMs(runtimeMs)
                .mlMetrics(collectorRegistry.calculateAll(experiment))
                .engineErrors(engineErrors)
                .analyzedAt(now)
                .build();
        latestResults.put(experimentId, result);
        performanceMetrics.recordAnalysis(System.nanoTime() - start);
        eventPublisher.publish(ExperimentEventType.EXPERIMENT_ANALYZED, experimentId, result);
        log.info("Experiment analyzed experimentId={}, primaryMetric={}, p={}, srm={}",
                experimentId, experiment.getPrimaryMetric(), frequentist.getPrimaryMetric().getPValue(),
                frequentist.getSampleRatioCheck().isMismatchDetected());
        return result;
    }

    public StopOutcome stopExperiment(String experimentId) {
        return stopExperiment(experimentId, STOP_MANUAL);
    }

    /**
     * Stop an active experiment and run its final analysis.
     *
     * @param reason stop reason; {@value #STOP_MANUAL} when null or blank
     * @throws ExperimentNotFoundException for an unknown id
     * @throws InvalidExperimentStateException if the experiment is already stopped
     */
    public StopOutcome stopExperiment(String experimentId, String reason) {
        requireExperiment(experimentId);
        String stopReason = reason != null && !reason.isBlank() ? reason : STOP_MANUAL;
        Experiment stopped = experimentRepository.markStopped(experimentId, stopReason, clock.instant());
        monitor.stopTracking(experimentId);
        shadowModeController.teardown(experimentId);

        AnalysisResult results = null;
        try {
            results = analyzeExperiment(experimentId, AnalysisOptions.defaults());
        } catch (RuntimeException e) {
            log.error("Final analysis failed experimentId={}", experimentId, e);
        }
        eventPublisher.publish(ExperimentEventType.EXPERIMENT_STOPPED, experimentId, stopped);
        log.info("Experiment stopped experimentId={}, reason={}", experimentId, stopReason);
        return new StopOutcome(stopped, results);
    }

    /**
     * Track a model confidence score for every active experiment that declares the {@code confidence} metric.
     *
     * @return number of experiments the score was recorded for
     */
    public int handleConfidenceUpdate(MlConfidenceUpdate update) {
        if (update == null || update.getUserId() == null || update.getConfidence() == null) {
            log.warn("Confidence update rejected: userId and confidence are required");
            return 0;
        }
        Map<String, Object> metadata = new HashMap<>();
        if (update.getFileId() != null) {
            metadata.put("fileId", update.getFileId());
        }
        int recorded = 0;
        for (Experiment experiment : experimentRepository.findActive()) {
            if (experiment.declaresMetric(CONFIDENCE_METRIC) && trackMetric(MetricEvent.builder()
                    .userId(update.getUserId())
                    .experimentId(experiment.getId())
                    .metricName(CONFIDENCE_METRIC)
                    .value(update.getConfidence())
                    .metadata(metadata)
                    .build())) {
                recorded++;
            }
        }
        return recorded;
    }

    /**
     * Track a user action as one engagement event for every active experiment that declares the
     * {@code engagement} metric.
     *
     * @return number of experiments the action was recorded for
     */
    public int handleUserAction(UserAction action) {
        if (action == null || action.getUserId() == null || action.getAction() == null) {
            log.warn("User action rejected: userId and action are required");
            return 0;
        }
        Map<String, Object> metadata = new HashMap<>();
        if (action.getMetadata() != null) {
            metadata.putAll(action.getMetadata());
        }
        metadata.put("action", action.getAction());
        int recorded = 0;
        for (Experiment experiment : experimentRepository.findActive()) {
            if (experiment.declaresMetric(ENGAGEMENT_METRIC) && trackMetric(MetricEvent.builder()
                    .userId(action.getUserId())
                    .experimentId(experiment.getId())
                    .metricName(ENGAGEMENT_METRIC)
                    .value(1.0)
                    .metadata(metadata)
                    .timestamp(action.getTimestamp())
                    .build())) {
                recorded++;
            }
        }
        return recorded;
    }

    public Optional<Experiment> getExperiment(String experimentId) {
        return experimentRepository.findById(experimentId);
    }

    public List<Experiment> listExperiments() {
        return experimentRepository.findAll();
    }

    public Optional<Assignment> getAssignment(String userId, String experimentId) {
        return assignmentRepository.find(userId, experimentId);
    }

    public Optional<AnalysisResult> getLatestResult(String experimentId) {
        return Optional.ofNullable(latestResults.get(experimentId));
    }

    /**
     * @throws ExperimentNotFoundException for an unknown id
     */
    public Optional<Map<String, List<ShadowMetric>>> getShadowMetrics(String experimentId) {
        requireExperiment(experimentId);
        return shadowModeController.getShadowMetrics(experimentId);
    }

    /**
     * @throws ExperimentNotFoundException for an unknown id
     */
    public List<ExperimentAlert> getAlerts(String experimentId) {
        requireExperiment(experimentId);
        return monitor.getAlerts(experimentId);
    }

    /**
     * SRM check over the experiment's current metrics; empty if the experiment is unknown or has no metrics.
     */
    public Optional<SampleRatioCheck> checkSampleRatio(String experimentId) {
        Optional<Experiment> experiment = experimentRepository.findById(experimentId);
        if (experiment.isEmpty() || !metricStore.hasMetrics(experimentId)) {
            return Optional.empty();
        }
        return Optional.of(frequentistEngine.checkSampleRatioMismatch(dataset(experiment.get())));
    }

    public FrameworkStatus getStatus() {
        List<Experiment> all = experimentRepository.findAll();
        int active = (int) all.stream().filter(Experiment::isActive).count();
        Map<String, Object> engines = new LinkedHashMap<>();
        engines.put("frequentist", Map.of(
                "tests", List.of("chi_square", "welch_t_test", "mann_whitney_u"),
                "multipleTestingCorrection", settings.getMultipleTestingCorrection().name().toLowerCase(),
                "confidenceLevel", settings.getConfidenceLevel()));
        engines.put("bayesian", settings.isEnableBayesian()
                ? Map.of("simulations", settings.getEffectiveBayesianSimulations(),
                "decisionThreshold", settings.getBayesianDecisionThreshold())
                : "disabled");
        engines.put("sequential", settings.isEnableSequentialTesting()
                ? Map.of("method", SequentialTestingEngine.METHOD, "stages", 5, "alpha", 0.05)
                : "disabled");
        return FrameworkStatus.builder()
                .initialized(initialized)
                .totalExperiments(all.size())
                .activeExperiments(active)
                .stoppedExperiments(all.size() - active)
                .performance(performanceMetrics.snapshot())
                .engines(engines)
                .build();
    }

    private Experiment requireExperiment(String experimentId) {
        return experimentRepository.findById(experimentId)
                .orElseThrow(() -> new ExperimentNotFoundException("Experiment not found: " + experimentId));
    }

    private AnalysisDataset dataset(Experiment experiment) {
        return AnalysisDataset.from(experiment, metricStore.snapshot(experiment.getId()));
    }

    private static void validate(ExperimentConfig config) {
        if (config == null) {
            throw new ExperimentValidationException("Experiment config is required");
        }
        if (config.getName() == null || config.getName().isBlank()) {
            throw new ExperimentValidationException("Experiment name is required");
        }
        if (config.getVariants() == null || config.getVariants().size() < 2) {
            throw new ExperimentValidationException("At least 2 variants are required");
        }
        Set<String> names = new HashSet<>();
        for (VariantSpec variant : config.getVariants()) {
            if (variant == null || variant.getName() == null || variant.getName().isBlank()) {
                throw new ExperimentValidationException("Variant name is required");
            }
            if (!(variant.getWeight() > 0) || Double.isInfinite(variant.getWeight())) {
                throw new ExperimentValidationException("Variant " + variant.getName() + " must have a positive weight");
            }
            if (!names.add(variant.getName())) {
                throw new ExperimentValidationException("Duplicate variant name: " + variant.getName());
            }
        }
        if (config.getPrimaryMetric() == null || config.getPrimaryMetric().isBlank()) {
            throw new ExperimentValidationException("Primary metric is required");
        }
        Object minConfidence = config.getTargetingRules().get(TargetingRuleEvaluator.MIN_CONFIDENCE);
        if (minConfidence != null && !(minConfidence instanceof Number)) {
            try {
                Double.parseDouble(minConfidence.toString());
            } catch (NumberFormatException e) {
                throw new ExperimentValidationException("minConfidence must be numeric, was " + minConfidence);
            }
        }
    }

    /**
     * Explicit name if given (must exist); else the conventional name if declared; else the first variant
     * other than {@code taken}.
     */
    private static String resolveArm(String explicit, String conventional, List<String> variantNames, String taken) {
        if (explicit != null && !explicit.isBlank()) {
            if (!variantNames.contains(explicit)) {
                throw new ExperimentValidationException("Unknown variant: " + explicit);
            }
            return explicit;
        }
        if (variantNames.contains(conventional) && !conventional.equals(taken)) {
            return conventional;
        }
        return variantNames.stream().filter(v -> !v.equals(taken)).findFirst().orElseThrow();
    }

    private static double orDefault(Double value, double defaultValue) {
        return value != null ? value : defaultValue;
    }
}
