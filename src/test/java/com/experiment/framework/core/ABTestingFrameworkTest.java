package com.experiment.framework.core;

import com.experiment.framework.api.ExperimentNotFoundException;
import com.experiment.framework.api.ExperimentValidationException;
import com.experiment.framework.api.InvalidExperimentStateException;
import com.experiment.framework.api.UnknownStrategyException;
import com.experiment.framework.core.analysis.AnalysisOptions;
import com.experiment.framework.core.analysis.AnalysisResult;
import com.experiment.framework.core.analysis.AnalysisStatus;
import com.experiment.framework.core.analysis.FrequentistResult.MetricTestResult;
import com.experiment.framework.core.analysis.TestType;
import com.experiment.framework.core.assignment.MultiArmedBanditStrategy.ArmStats;
import com.experiment.framework.core.metrics.ConfidenceCollector.ConfidenceStats;
import com.experiment.framework.core.shadow.ShadowMetric;
import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.ExperimentConfig;
import com.experiment.framework.domain.ExperimentConfig.VariantSpec;
import com.experiment.framework.domain.ExperimentStatus;
import com.experiment.framework.domain.FrameworkStatus;
import com.experiment.framework.domain.MetricEvent;
import com.experiment.framework.domain.MlConfidenceUpdate;
import com.experiment.framework.domain.StopOutcome;
import com.experiment.framework.domain.UserAction;
import com.experiment.framework.messaging.ExperimentEvent;
import com.experiment.framework.messaging.ExperimentEventType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for ABTestingFramework wired in plain Java (seeded randomness, manual clock, no scheduler).
 */
class ABTestingFrameworkTest {

    @Test
    void createExperimentNormalizesWeights() {
        ABTestingFramework framework = FrameworkFixture.create().framework;

        Experiment experiment = framework.createExperiment(ExperimentConfig.builder()
                .name("Weights")
                .variant(VariantSpec.of("control", 1))
                .variant(VariantSpec.of("treatment", 3))
                .primaryMetric("conversion")
                .build());

        assertThat(experiment.getId()).startsWith("exp_");
        assertThat(experiment.getStatus()).isEqualTo(ExperimentStatus.ACTIVE);
        assertThat(experiment.getVariants().get(0).getNormalizedWeight()).isCloseTo(0.25, within(1e-12));
        assertThat(experiment.getVariants().get(1).getNormalizedWeight()).isCloseTo(0.75, within(1e-12));
        assertThat(experiment.getVariants().get(1).getWeight()).isEqualTo(3.0);
        assertThat(experiment.getControlVariant()).isEqualTo("control");
        assertThat(experiment.getTreatmentVariant()).isEqualTo("treatment");
    }

    @Test
    void createExperimentRunsPowerAnalysisForBinaryMetric() {
        ABTestingFramework framework = FrameworkFixture.create().framework;

        Experiment experiment = framework.createExperiment(config("exp-power", "random").build());

        assertThat(experiment.getPowerAnalysis().getSampleSizePerVariant()).isEqualTo(1565);
        assertThat(experiment.getRequiredSampleSize()).isEqualTo(3130);
        assertThat(experiment.getMinRunTime()).isEqualTo(Duration.ofDays(4));
    }

    @Test
    void requiredSampleSizeIsFlooredByMinimumPerVariant() {
        ABTestingFramework framework = FrameworkFixture.create().framework;

        Experiment experiment = framework.createExperiment(config("exp-floor", "random")
                .baselineRate(0.1)
                .minimumDetectableEffect(0.4)
                .build());

        assertThat(experiment.getPowerAnalysis().getTotalSampleSize()).isEqualTo(40);
        assertThat(experiment.getRequiredSampleSize()).isEqualTo(200);
    }

    @Test
    void createExperimentRejectsInvalidDefinitionsAndStoresNothing() {
        ABTestingFramework framework = FrameworkFixture.create().framework;

        assertThatThrownBy(() -> framework.createExperiment(ExperimentConfig.builder()
                .name("One variant")
                .variant(VariantSpec.of("control", 1))
                .primaryMetric("conversion")
                .build()))
                .isInstanceOf(ExperimentValidationException.class);
        assertThatThrownBy(() -> framework.createExperiment(ExperimentConfig.builder()
                .name("Zero weight")
                .variant(VariantSpec.of("control", 1))
                .variant(VariantSpec.of("treatment", 0))
                .primaryMetric("conversion")
                .build()))
                .isInstanceOf(ExperimentValidationException.class)
                .hasMessageContaining("positive weight");
        assertThatThrownBy(() -> framework.createExperiment(ExperimentConfig.builder()
                .name("Duplicate")
                .variant(VariantSpec.of("control", 1))
                .variant(VariantSpec.of("control", 1))
                .primaryMetric("conversion")
                .build()))
                .isInstanceOf(ExperimentValidationException.class)
                .hasMessageContaining("Duplicate variant");
        assertThatThrownBy(() -> framework.createExperiment(config("exp-x", "random").name(" ").build()))
                .isInstanceOf(ExperimentValidationException.class);
        assertThatThrownBy(() -> framework.createExperiment(config("exp-x", "random").primaryMetric(null).build()))
                .isInstanceOf(ExperimentValidationException.class);
        assertThatThrownBy(() -> framework.createExperiment(config("exp-x", "random")
                .targetingRule("minConfidence", "high")
                .build()))
                .isInstanceOf(ExperimentValidationException.class)
                .hasMessageContaining("minConfidence");

        assertThat(framework.listExperiments()).isEmpty();
    }

    @Test
    void createExperimentRejectsUnknownStrategy() {
        ABTestingFramework framework = FrameworkFixture.create().framework;

        assertThatThrownBy(() -> framework.createExperiment(config("exp-x", "roundRobin").build()))
                .isInstanceOf(UnknownStrategyException.class);
        assertThat(framework.listExperiments()).isEmpty();
    }

    @Test
    void createExperimentRejectsDuplicateId() {
        ABTestingFramework framework = FrameworkFixture.create().framework;
        framework.createExperiment(config("exp-dup", "random").build());

        assertThatThrownBy(() -> framework.createExperiment(config("exp-dup", "random").build()))
                .isInstanceOf(ExperimentValidationException.class);
        assertThat(framework.listExperiments()).hasSize(1);
    }

    @Test
    void controlAndTreatmentResolveFromExplicitNamesOrDeclarationOrder() {
        ABTestingFramework framework = FrameworkFixture.create().framework;

        Experiment byOrder = framework.createExperiment(ExperimentConfig.builder()
                .id("exp-abc")
                .name("Three arms")
                .variant(VariantSpec.of("a", 1))
                .variant(VariantSpec.of("b", 1))
                .variant(VariantSpec.of("c", 1))
                .primaryMetric("conversion")
                .build());
        Experiment explicit = framework.createExperiment(ExperimentConfig.builder()
                .id("exp-explicit")
                .name("Explicit control")
                .variant(VariantSpec.of("a", 1))
                .variant(VariantSpec.of("b", 1))
                .variant(VariantSpec.of("c", 1))
                .primaryMetric("conversion")
                .controlVariant("b")
                .build());

        assertThat(byOrder.getControlVariant()).isEqualTo("a");
        assertThat(byOrder.getTreatmentVariant()).isEqualTo("b");
        assertThat(explicit.getControlVariant()).isEqualTo("b");
        assertThat(explicit.getTreatmentVariant()).isEqualTo("a");
        assertThatThrownBy(() -> framework.createExperiment(config("exp-bad-arm", "random")
                .treatmentVariant("missing")
                .build()))
                .isInstanceOf(ExperimentValidationException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void createExperimentPublishesCreatedEvent() {
        FrameworkFixture fixture = FrameworkFixture.create();

        fixture.framework.createExperiment(config("exp-events", "random").build());

        List<ExperimentEvent> events = fixture.recentEvents.getRecent(10);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).getType()).isEqualTo(ExperimentEventType.EXPERIMENT_CREATED);
        assertThat(events.get(0).getExperimentId()).isEqualTo("exp-events");
        assertThat(fixture.monitor.isTracking("exp-events")).isTrue();
    }

    @Test
    void randomAssignmentIsSticky() {
        FrameworkFixture fixture = FrameworkFixture.create();
        ABTestingFramework framework = fixture.framework;
        framework.createExperiment(config("exp-sticky", "random").build());

        String first = framework.assignUserToExperiment("user-1", "exp-sticky", Map.of());
        for (int i = 0; i < 20; i++) {
            assertThat(framework.assignUserToExperiment("user-1", "exp-sticky", Map.of())).isEqualTo(first);
        }

        assertThat(first).isIn("control", "treatment");
        assertThat(framework.getAssignment("user-1", "exp-sticky").orElseThrow().getVariant()).isEqualTo(first);
        assertThat(fixture.performanceMetrics.snapshot().getAssignmentsMade()).isEqualTo(1);
    }

    @Test
    void assignReturnsNullForUnknownExperimentOrBlankUser() {
        ABTestingFramework framework = FrameworkFixture.create().framework;
        framework.createExperiment(config("exp-1", "random").build());

        assertThat(framework.assignUserToExperiment("user-1", "does-not-exist", Map.of())).isNull();
        assertThat(framework.assignUserToExperiment(" ", "exp-1", Map.of())).isNull();
        assertThat(framework.assignUserToExperiment(null, "exp-1", null)).isNull();
    }

    @Test
    void assignAppliesTargetingRules() {
        ABTestingFramework framework = FrameworkFixture.create().framework;
        framework.createExperiment(config("exp-targeted", "deterministic")
                .targetingRule("userSegment", "power_user")
                .targetingRule("minConfidence", 0.7)
                .build());

        assertThat(framework.assignUserToExperiment("u1", "exp-targeted",
                Map.of("segment", "power_user", "confidence", 0.8))).isNotNull();
        assertThat(framework.assignUserToExperiment("u2", "exp-targeted",
                Map.of("segment", "casual", "confidence", 0.8))).isNull();
        assertThat(framework.assignUserToExperiment("u3", "exp-targeted",
                Map.of("segment", "power_user", "confidence", 0.5))).isNull();
        assertThat(framework.assignUserToExperiment("u4", "exp-targeted", Map.of())).isNull();
        assertThat(framework.getAssignment("u2", "exp-targeted")).isEmpty();
    }

    @Test
    void trackMetricIgnoresUnassignedUser() {
        ABTestingFramework framework = FrameworkFixture.create().framework;
        framework.createExperiment(config("exp-1", "random").build());

        boolean recorded = framework.trackMetric(event("exp-1", "stranger", "conversion", 1.0));

        assertThat(recorded).isFalse();
        AnalysisResult result = framework.analyzeExperiment("exp-1", AnalysisOptions.defaults());
        assertThat(result.getStatus()).isEqualTo(AnalysisStatus.INSUFFICIENT_DATA);
        assertThat(result.getFrequentist()).isNull();
        assertThat(result.getMessage()).isEqualTo("No metrics collected");
    }

    @Test
    void trackMetricRejectsEventWithoutValue() {
        ABTestingFramework framework = FrameworkFixture.create().framework;
        framework.createExperiment(config("exp-1", "random").build());
        framework.assignUserToExperiment("user-1", "exp-1", Map.of());

        boolean recorded = framework.trackMetric(MetricEvent.builder()
                .userId("user-1")
                .experimentId("exp-1")
                .metricName("conversion")
                .build());

        assertThat(recorded).isFalse();
    }

    @Test
    void analyzeWithOneSidedDataReportsInsufficientData() {
        ABTestingFramework framework = FrameworkFixture.create().framework;
        framework.createExperiment(config("exp-one-sided", "deterministic").build());
        String controlUser = null;
        for (int i = 0; controlUser == null; i++) {
            if ("control".equals(framework.assignUserToExperiment("user-" + i, "exp-one-sided", Map.of()))) {
                controlUser = "user-" + i;
            }
        }
        framework.trackMetric(event("exp-one-sided", controlUser, "conversion", 1.0));

        AnalysisResult result = framework.analyzeExperiment("exp-one-sided", AnalysisOptions.defaults());

        assertThat(result.getStatus()).isEqualTo(AnalysisStatus.INSUFFICIENT_DATA);
        assertThat(result.getFrequentist()).isNull();
        assertThat(result.getSampleSizes()).containsEntry("control", 1).containsEntry("treatment", 0);
    }

    @Test
    void analyzeUnknownExperimentThrowsNotFound() {
        ABTestingFramework framework = FrameworkFixture.create().framework;

        assertThatThrownBy(() -> framework.analyzeExperiment("nope", AnalysisOptions.defaults()))
                .isInstanceOf(ExperimentNotFoundException.class);
    }

    @Test
    void deterministicConversionExperimentDetectsLift() {
        FrameworkFixture fixture = FrameworkFixture.create(FrameworkSettings.builder()
                .enableSequentialTesting(false)
                .build());
        ABTestingFramework framework = fixture.framework;
        framework.createExperiment(config("exp-conversion", "deterministic").build());

        Map<String, Integer> firstThousand = new HashMap<>();
        for (int i = 0; i < 1000; i++) {
            firstThousand.merge(framework.assignUserToExperiment("user-" + i, "exp-conversion", Map.of()), 1, Integer::sum);
        }
        assertThat(firstThousand.get("control")).isBetween(450, 550);
        assertThat(firstThousand.get("treatment")).isBetween(450, 550);

        List<String> control = new ArrayList<>();
        List<String> treatment = new ArrayList<>();
        for (int i = 0; (control.size() < 500 || treatment.size() < 500) && i < 5000; i++) {
            String userId = "user-" + i;
            String variant = framework.assignUserToExperiment(userId, "exp-conversion", Map.of());
            List<String> arm = "control".equals(variant) ? control : treatment;
            if (arm.size() < 500) {
                arm.add(userId);
            }
        }
        for (int i = 0; i < 500; i++) {
            assertThat(framework.trackMetric(event("exp-conversion", control.get(i), "conversion", i < 100 ? 1.0 : 0.0))).isTrue();
            assertThat(framework.trackMetric(event("exp-conversion", treatment.get(i), "conversion", i < 140 ? 1.0 : 0.0))).isTrue();
        }

        AnalysisResult result = framework.analyzeExperiment("exp-conversion", AnalysisOptions.defaults());

        assertThat(result.getStatus()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(result.getSampleSizes()).containsEntry("control", 500).containsEntry("treatment", 500);
        MetricTestResult primary = result.getFrequentist().getPrimaryMetric();
        assertThat(primary.getTestType()).isEqualTo(TestType.CHI_SQUARE);
        assertThat(primary.getControlMean()).isCloseTo(0.20, within(1e-12));
        assertThat(primary.getTreatmentMean()).isCloseTo(0.28, within(1e-12));
        assertThat(primary.getStatistic()).isCloseTo(8.77, within(0.01));
        assertThat(primary.getPValue()).isBetween(0.001, 0.01);
        assertThat(primary.isSignificant()).isTrue();
        assertThat(primary.getEffectSize()).isPositive();
        assertThat(primary.getConfidenceInterval().contains(0.08)).isTrue();
        assertThat(result.getFrequentist().getSampleRatioCheck().isMismatchDetected()).isFalse();
        assertThat(result.getBayesian().getPrimaryMetric().getProbabilityOfBeingBest().get("treatment")).isGreaterThan(0.95);
        assertThat(result.getBayesian().getPrimaryMetric().getLeadingVariant()).isEqualTo("treatment");
        assertThat(result.getSequential()).isNull();
        assertThat(framework.getLatestResult("exp-conversion")).contains(result);
    }

    @Test
    void stopExperimentRunsFinalAnalysisAndRejectsSecondStop() {
        FrameworkFixture fixture = FrameworkFixture.create();
        ABTestingFramework framework = fixture.framework;
        framework.createExperiment(config("exp-stop", "random").build());
        framework.assignUserToExperiment("user-1", "exp-stop", Map.of());

        StopOutcome outcome = framework.stopExperiment("exp-stop");

        assertThat(outcome.getExperiment().getStatus()).isEqualTo(ExperimentStatus.STOPPED);
        assertThat(outcome.getExperiment().getStopReason()).isEqualTo(ABTestingFramework.STOP_MANUAL);
        assertThat(outcome.getExperiment().getEndTime()).isEqualTo(FrameworkFixture.START);
        assertThat(outcome.getResults().getStatus()).isEqualTo(AnalysisStatus.INSUFFICIENT_DATA);
        assertThat(fixture.monitor.isTracking("exp-stop")).isFalse();
        assertThat(fixture.recentEvents.getRecent(1).get(0).getType()).isEqualTo(ExperimentEventType.EXPERIMENT_STOPPED);

        assertThatThrownBy(() -> framework.stopExperiment("exp-stop"))
                .isInstanceOf(InvalidExperimentStateException.class);
        assertThat(framework.assignUserToExperiment("user-2", "exp-stop", Map.of())).isNull();
        assertThat(framework.trackMetric(event("exp-stop", "user-1", "conversion", 1.0))).isFalse();
    }

    @Test
    void stopUnknownExperimentThrowsNotFound() {
        ABTestingFramework framework = FrameworkFixture.create().framework;

        assertThatThrownBy(() -> framework.stopExperiment("nope", "manual"))
                .isInstanceOf(ExperimentNotFoundException.class);
    }

    @Test
    void sequentialBoundaryStopsExperimentEarly() {
        ABTestingFramework framework = FrameworkFixture.create(FrameworkSettings.builder()
                .minSampleSize(1)
                .build()).framework;
        framework.createExperiment(config("exp-sequential", "deterministic")
                .baselineRate(0.1)
                .minimumDetectableEffect(0.4)
                .build());

        int users = 0;
        for (int i = 0; i < 200; i++) {
            String variant = framework.assignUserToExperiment("user-" + i, "exp-sequential", Map.of());
            if (variant == null) {
                break;
            }
            framework.trackMetric(event("exp-sequential", "user-" + i, "conversion", "treatment".equals(variant) ? 1.0 : 0.0));
            users++;
        }

        Experiment experiment = framework.getExperiment("exp-sequential").orElseThrow();
        assertThat(experiment.getStatus()).isEqualTo(ExperimentStatus.STOPPED);
        assertThat(experiment.getStopReason()).isEqualTo(ABTestingFramework.STOP_SEQUENTIAL_BOUNDARY);
        assertThat(users).isLessThan(40);
    }

    @Test
    void banditLearnsFromPrimaryMetric() {
        FrameworkFixture fixture = FrameworkFixture.create();
        ABTestingFramework framework = fixture.framework;
        framework.createExperiment(config("exp-bandit", "multiArmedBandit").build());

        for (int i = 0; i < 50; i++) {
            String variant = framework.assignUserToExperiment("user-" + i, "exp-bandit", Map.of());
            framework.trackMetric(event("exp-bandit", "user-" + i, "conversion", "treatment".equals(variant) ? 1.0 : 0.0));
        }

        Map<String, ArmStats> arms = fixture.banditStrategy.getArmStatistics("exp-bandit");
        assertThat(arms.values().stream().mapToLong(ArmStats::getPulls).sum()).isEqualTo(50);
        assertThat(arms.get("control").getTotalReward()).isZero();
    }

    @Test
    void contextualBanditUpdatesWeightsFromAssignmentContext() {
        FrameworkFixture fixture = FrameworkFixture.create();
        ABTestingFramework framework = fixture.framework;
        framework.createExperiment(config("exp-contextual", "contextual").build());

        String variant = framework.assignUserToExperiment("user-1", "exp-contextual",
                Map.of("confidence", 0.9, "userSegment", "power_user"));
        framework.trackMetric(event("exp-contextual", "user-1", "conversion", 1.0));

        double[] weights = fixture.contextualStrategy.getWeights("exp-contextual").get(variant);
        assertThat(weights[0]).isCloseTo(0.01 * 0.9, within(1e-12));
        assertThat(weights[1]).isZero();
        assertThat(weights[2]).isCloseTo(0.01, within(1e-12));
    }

    @Test
    void stratifiedAssignmentTracksAllocationsPerSegment() {
        FrameworkFixture fixture = FrameworkFixture.create();
        ABTestingFramework framework = fixture.framework;
        framework.createExperiment(config("exp-strata", "stratified").build());

        for (int i = 0; i < 40; i++) {
            framework.assignUserToExperiment("user-" + i, "exp-strata", Map.of("segment", i % 2 == 0 ? "mobile" : "desktop"));
        }

        Map<String, Map<String, Long>> allocations = fixture.stratifiedStrategy.getAllocations("exp-strata");
        assertThat(allocations).containsOnlyKeys("mobile", "desktop");
        assertThat(allocations.get("mobile").values().stream().mapToLong(Long::longValue).sum()).isEqualTo(20);
    }

    @Test
    void shadowModeRecordsSeparatelyAndDiscardsOnStop() {
        ABTestingFramework framework = FrameworkFixture.create().framework;
        framework.createExperiment(config("exp-shadow", "deterministic").shadowMode(true).build());
        String variant = framework.assignUserToExperiment("user-1", "exp-shadow", Map.of());

        framework.trackMetric(event("exp-shadow", "user-1", "conversion", 1.0));

        Map<String, List<ShadowMetric>> shadow = framework.getShadowMetrics("exp-shadow").orElseThrow();
        assertThat(shadow.get(variant)).hasSize(1);
        assertThat(shadow.get(variant).get(0).isShadow()).isTrue();
        assertThat(shadow.get(variant).get(0).getValue()).isEqualTo(1.0);

        framework.stopExperiment("exp-shadow");
        assertThat(framework.getShadowMetrics("exp-shadow")).isEmpty();
    }

    @Test
    void confidenceUpdateIsTrackedForExperimentsDeclaringConfidence() {
        ABTestingFramework framework = FrameworkFixture.create().framework;
        framework.createExperiment(config("exp-model", "deterministic")
                .primaryMetric("confidence")
                .estimatedStandardDeviation(0.2)
                .minimumDetectableEffect(0.1)
                .build());
        framework.createExperiment(config("exp-other", "deterministic").build());
        for (int i = 0; i < 40; i++) {
            framework.assignUserToExperiment("user-" + i, "exp-model", Map.of());
            framework.assignUserToExperiment("user-" + i, "exp-other", Map.of());
        }

        int recorded = 0;
        for (int i = 0; i < 40; i++) {
            recorded += framework.handleConfidenceUpdate(MlConfidenceUpdate.builder()
                    .userId("user-" + i)
                    .confidence(0.5 + i * 0.01)
                    .fileId("file-" + i)
                    .build());
        }

        assertThat(recorded).isEqualTo(40);
        assertThat(framework.handleConfidenceUpdate(MlConfidenceUpdate.builder().userId("stranger").confidence(0.9).build()))
                .isZero();
        AnalysisResult result = framework.analyzeExperiment("exp-model", AnalysisOptions.defaults());
        assertThat(result.getStatus()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(result.getMlMetrics()).containsKey("confidence");
        assertThat(framework.checkSampleRatio("exp-other")).isEmpty();
    }

    @Test
    void constantPrimaryArmsAreStillReportedAsRecorded() {
        ABTestingFramework framework = FrameworkFixture.create().framework;
        framework.createExperiment(config("exp-latency", "deterministic")
                .primaryMetric("latency")
                .estimatedStandardDeviation(20.0)
                .minimumDetectableEffect(5.0)
                .baselineRate(100.0)
                .build());

        for (int round = 0; round < 3; round++) {
            for (int i = 0; i < 10; i++) {
                String userId = "user-" + i;
                String variant = framework.assignUserToExperiment(userId, "exp-latency", Map.of());
                double latency = "control".equals(variant) ? 5.0 : 3.0;
                assertThat(framework.trackMetric(event("exp-latency", userId, "latency", latency))).isTrue();
            }
        }

        assertThat(framework.getExperiment("exp-latency").orElseThrow().isActive()).isTrue();
        assertThat(framework.checkSampleRatio("exp-latency").orElseThrow().getObserved().values()
                .stream().mapToInt(Integer::intValue).sum()).isEqualTo(10);
        assertThat(framework.getStatus().getPerformance().getMetricsCollected()).isEqualTo(30);
    }

    @Test
    void cachedAnalysisResultCannotBeModified() {
        ABTestingFramework framework = FrameworkFixture.create(FrameworkSettings.builder()
                .enableSequentialTesting(false)
                .build()).framework;
        framework.createExperiment(config("exp-model", "deterministic")
                .primaryMetric("confidence")
                .estimatedStandardDeviation(0.2)
                .minimumDetectableEffect(0.1)
                .build());
        for (int i = 0; i < 40; i++) {
            framework.assignUserToExperiment("user-" + i, "exp-model", Map.of());
            framework.handleConfidenceUpdate(MlConfidenceUpdate.builder()
                    .userId("user-" + i)
                    .confidence(0.4 + (i % 5) * 0.1)
                    .build());
        }
        framework.analyzeExperiment("exp-model", AnalysisOptions.defaults());

        AnalysisResult cached = framework.getLatestResult("exp-model").orElseThrow();

        assertThatThrownBy(() -> cached.getEngineErrors().put("bayesian", "overwritten"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> cached.getSampleSizes().put("control", 0))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> cached.getMlMetrics().remove("confidence"))
                .isInstanceOf(UnsupportedOperationException.class);
        ConfidenceStats control = (ConfidenceStats) cached.getMlMetrics().get("confidence").get("control");
        assertThatThrownBy(() -> control.getDistribution().set(0, 999))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> cached.getFrequentist().getSampleRatioCheck().getObserved().put("control", 0))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> cached.getBayesian().getPrimaryMetric().getProbabilityOfBeingBest().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(framework.getLatestResult("exp-model").orElseThrow().getEngineErrors()).isEmpty();
    }

    @Test
    void userActionIsTrackedAsEngagement() {
        FrameworkFixture fixture = FrameworkFixture.create();
        ABTestingFramework framework = fixture.framework;
        framework.createExperiment(config("exp-engagement", "random").secondaryMetric("engagement").build());
        framework.assignUserToExperiment("user-1", "exp-engagement", Map.of());

        int recorded = framework.handleUserAction(UserAction.builder()
                .userId("user-1")
                .action("open_file")
                .timestamp(FrameworkFixture.START)
                .build());

        assertThat(recorded).isEqualTo(1);
        assertThat(framework.handleUserAction(UserAction.builder().userId("user-1").build())).isZero();
        assertThat(fixture.performanceMetrics.snapshot().getMetricsCollected()).isEqualTo(1);
    }

    @Test
    void statusReportsCountsAndEngines() {
        ABTestingFramework framework = FrameworkFixture.create(FrameworkSettings.builder()
                .enableBayesian(false)
                .build()).framework;
        framework.createExperiment(config("exp-a", "random").build());
        framework.createExperiment(config("exp-b", "random").build());
        framework.stopExperiment("exp-b");

        FrameworkStatus status = framework.getStatus();

        assertThat(status.isInitialized()).isTrue();
        assertThat(status.getTotalExperiments()).isEqualTo(2);
        assertThat(status.getActiveExperiments()).isEqualTo(1);
        assertThat(status.getStoppedExperiments()).isEqualTo(1);
        assertThat(status.getPerformance().getExperimentsCreated()).isEqualTo(2);
        assertThat(status.getEngines()).containsEntry("bayesian", "disabled");
        assertThat(status.getEngines().get("sequential")).isInstanceOf(Map.class);
    }

    @Test
    void shutdownStopsActiveExperiments() {
        ABTestingFramework framework = FrameworkFixture.create().framework;
        framework.createExperiment(config("exp-a", "random").build());
        framework.createExperiment(config("exp-b", "random").build());

        framework.shutdown();

        assertThat(framework.listExperiments())
                .allSatisfy(e -> {
                    assertThat(e.getStatus()).isEqualTo(ExperimentStatus.STOPPED);
                    assertThat(e.getStopReason()).isEqualTo(ABTestingFramework.STOP_FRAMEWORK_SHUTDOWN);
                });
        assertThat(framework.getStatus().isInitialized()).isFalse();
    }

    @Test
    void concurrentAssignmentsStoreOneVariantPerUser() throws Exception {
        FrameworkFixture fixture = FrameworkFixture.create();
        ABTestingFramework framework = fixture.framework;
        framework.createExperiment(config("exp-concurrent", "random").build());
        Map<String, Set<String>> seen = new ConcurrentHashMap<>();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        String userId = "user-" + i;
                        String variant = framework.assignUserToExperiment(userId, "exp-concurrent", Map.of());
                        seen.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(variant);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(seen).hasSize(200);
        assertThat(seen.values()).allSatisfy(variants -> assertThat(variants).hasSize(1));
        assertThat(fixture.performanceMetrics.snapshot().getAssignmentsMade()).isEqualTo(200);
    }

    @Test
    void concurrentStopSucceedsExactlyOnce() throws Exception {
        ABTestingFramework framework = FrameworkFixture.create().framework;
        framework.createExperiment(config("exp-race", "random").build());
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger stopped = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        framework.stopExperiment("exp-race");
                        stopped.incrementAndGet();
                    } catch (InvalidExperimentStateException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(stopped.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(7);
    }

    @Test
    void listExperimentsIsOrderedByCreation() {
        FrameworkFixture fixture = FrameworkFixture.create();
        fixture.framework.createExperiment(config("exp-b", "random").build());
        fixture.clock.advance(Duration.ofMinutes(1));
        fixture.framework.createExperiment(config("exp-a", "random").build());

        assertThat(fixture.framework.listExperiments().stream().map(Experiment::getId).collect(Collectors.toList()))
                .containsExactly("exp-b", "exp-a");
    }

    private static ExperimentConfig.ExperimentConfigBuilder config(String id, String strategy) {
        return ExperimentConfig.builder()
                .id(id)
                .name("Experiment " + id)
                .variant(VariantSpec.of("control", 1))
                .variant(VariantSpec.of("treatment", 1))
                .primaryMetric("conversion")
                .assignmentStrategy(strategy);
    }

    private static MetricEvent event(String experimentId, String userId, String metric, double value) {
        return MetricEvent.builder()
                .userId(userId)
                .experimentId(experimentId)
                .metricName(metric)
                .value(value)
                .build();
    }
}
