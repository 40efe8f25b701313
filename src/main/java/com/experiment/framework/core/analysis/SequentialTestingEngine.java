package com.experiment.framework.core.analysis;

import com.experiment.framework.core.analysis.SequentialResult.Boundary;
import com.experiment.framework.core.analysis.SequentialResult.Checkpoint;
import com.experiment.framework.core.analysis.SequentialResult.Decision;
import com.experiment.framework.domain.Experiment;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * O'Brien-Fleming group-sequential testing with K = 5 equally spaced looks and two-sided alpha = 0.05.
 * The boundary at look k is z(1 - alpha/2) * sqrt(K / k); crossing it at the current look stops the experiment.
 */
@Slf4j
@Component
public class SequentialTestingEngine {

    public static final String METHOD = "obrien-fleming";
    static final int STAGES = 5;
    static final double ALPHA = 0.05;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0, 1);
    private static final double Z_CRITICAL = STANDARD_NORMAL.inverseCumulativeProbability(1 - ALPHA / 2);

    /**
     * @throws InsufficientDataException if control or treatment has no primary-metric data
     * @throws StatisticalAnalysisException if control or treatment variant is missing
     */
    public SequentialResult analyze(AnalysisDataset data) {
        Experiment experiment = data.getExperiment();
        long required = Math.max(1L, experiment.getRequiredSampleSize());
        int currentSampleSize = data.getTotalSampleSize();
        int stage = currentStage(currentSampleSize, required);
        double z = testStatistic(data);

        return SequentialResult.builder()
                .method(METHOD)
                .totalStages(STAGES)
                .checkpoints(checkpoints(required))
                .boundaries(boundaries())
                .currentStage(stage)
                .currentSampleSize(currentSampleSize)
                .requiredSampleSize(required)
                .testStatistic(z)
                .decision(evaluate(z, stage, experiment.getControlVariant(), experiment.getTreatmentVariant()).orElse(null))
                .build();
    }

    /**
     * Boundary check used during metric ingestion. Missing or degenerate data means no stop.
     */
    public BoundaryCheck checkBoundaries(AnalysisDataset data) {
        try {
            SequentialResult result = analyze(data);
            return new BoundaryCheck(result.getDecision() != null, result);
        } catch (InsufficientDataException e) {
            return new BoundaryCheck(false, null);
        } catch (StatisticalAnalysisException e) {
            log.debug("Boundary check skipped experimentId={}: {}", data.getExperiment().getId(), e.getMessage());
            return new BoundaryCheck(false, null);
        }
    }

    /**
     * Decision rule at a given look: stop when |z| reaches the look's critical value.
     *
     * @param stage 1-based look, clamped to [1, 5]
     */
    public Optional<Decision> evaluate(double statistic, int stage, String controlVariant, String treatmentVariant) {
        int k = Math.max(1, Math.min(STAGES, stage));
        if (Math.abs(statistic) < criticalValue(k)) {
            return Optional.empty();
        }
        double nominal = 2 * (1 - STANDARD_NORMAL.cumulativeProbability(Math.abs(statistic)));
        return Optional.of(new Decision(true, statistic > 0 ? treatmentVariant : controlVariant, k, nominal,
                Math.min(1.0, nominal * k)));
    }

    public static double criticalValue(int stage) {
        return Z_CRITICAL * Math.sqrt((double) STAGES / stage);
    }

    static int currentStage(long sampleSize, long requiredSampleSize) {
        double fraction = (double) sampleSize / requiredSampleSize;
        return (int) Math.max(1, Math.min(STAGES, Math.ceil(fraction * STAGES)));
    }

    /**
     * Lan-DeMets O'Brien-Fleming spending function: 2 - 2 * Phi(z(1 - alpha/2) / sqrt(t)).
     */
    static double alphaSpent(double informationFraction) {
        return 2 - 2 * STANDARD_NORMAL.cumulativeProbability(Z_CRITICAL / Math.sqrt(informationFraction));
    }

    private static List<Checkpoint> checkpoints(long required) {
        List<Checkpoint> checkpoints = new ArrayList<>();
        for (int k = 1; k <= STAGES; k++) {
            double fraction = (double) k / STAGES;
            checkpoints.add(new Checkpoint(k, (long) Math.ceil(required * fraction), fraction));
        }
        return checkpoints;
    }

    private static List<Boundary> boundaries() {
        List<Boundary> boundaries = new ArrayList<>();
        for (int k = 1; k <= STAGES; k++) {
            double critical = criticalValue(k);
            double nominal = 2 * (1 - STANDARD_NORMAL.cumulativeProbability(critical));
            boundaries.add(new Boundary(k, critical, nominal, alphaSpent((double) k / STAGES)));
        }
        return boundaries;
    }

    /**
     * Pooled two-proportion z for binary metrics, unpooled mean-difference z otherwise. Positive favours treatment.
     */
    double testStatistic(AnalysisDataset data) {
        Experiment experiment = data.getExperiment();
        String metric = experiment.getPrimaryMetric();
        if (!data.hasVariant(experiment.getControlVariant()) || !data.hasVariant(experiment.getTreatmentVariant())) {
            throw new StatisticalAnalysisException("Experiment " + experiment.getId() + " has no control/treatment pair");
        }
        double[] control = data.values(experiment.getControlVariant(), metric);
        double[] treatment = data.values(experiment.getTreatmentVariant(), metric);
        if (control.length == 0 || treatment.length == 0) {
            throw new InsufficientDataException("No primary metric data in control or treatment");
        }
        int n1 = control.length;
        int n2 = treatment.length;

        if (data.isBinary(metric)) {
            double p1 = StatUtils.mean(control);
            double p2 = StatUtils.mean(treatment);
            double pooled = (StatUtils.sum(control) + StatUtils.sum(treatment)) / (n1 + n2);
            double se = Math.sqrt(pooled * (1 - pooled) * (1.0 / n1 + 1.0 / n2));
            return se == 0.0 ? 0.0 : (p2 - p1) / se;
        }

        if (n1 < 2 || n2 < 2) {
            throw new InsufficientDataException("Need at least 2 observations per variant");
        }
        double m1 = StatUtils.mean(control);
        double m2 = StatUtils.mean(treatment);
        double se = Math.sqrt(StatUtils.variance(control, m1) / n1 + StatUtils.variance(treatment, m2) / n2);
        if (se == 0.0) {
            if (m1 == m2) {
                return 0.0;
            }
            throw new StatisticalAnalysisException("Primary metric has zero variance but different means");
        }
        return (m2 - m1) / se;
    }

    @Value
    public static class BoundaryCheck {
        boolean shouldStop;
        /** Null when there was not enough data to evaluate. */
        SequentialResult result;
    }
}
