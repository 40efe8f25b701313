package com.experiment.framework.core.analysis;

import com.experiment.framework.core.FrameworkSettings;
import com.experiment.framework.core.analysis.FrequentistResult.MetricTestResult;
import com.experiment.framework.core.analysis.FrequentistResult.SampleRatioCheck;
import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.Variant;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Null-hypothesis tests of control vs treatment.
 * Binary metrics use a 2x2 chi-square, large samples (both arms at least 30) Welch's t-test,
 * small samples the Mann-Whitney U test with a tie-corrected normal approximation.
 * P-values come from Commons Math distributions, not hand-rolled approximations.
 */
@Slf4j
@Component
public class FrequentistAnalysisEngine {

    static final int LARGE_SAMPLE = 30;
    static final double SRM_THRESHOLD = 0.001;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0, 1);

    private final FrameworkSettings settings;

    public FrequentistAnalysisEngine(FrameworkSettings settings) {
        this.settings = settings;
    }

    /**
     * Test the primary metric (failures propagate) and every secondary metric (failures are recorded),
     * then apply the configured multiple testing correction when more than one metric was tested.
     *
     * @throws InsufficientDataException if an arm has no data for the primary metric
     * @throws StatisticalAnalysisException if control or treatment is missing or the primary test is degenerate
     */
    public FrequentistResult analyze(AnalysisDataset data) {
        Experiment experiment = data.getExperiment();
        MetricTestResult primary = testMetric(data, experiment.getPrimaryMetric());

        Map<String, MetricTestResult> secondary = new LinkedHashMap<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String metric : experiment.getSecondaryMetrics()) {
            if (metric.equals(experiment.getPrimaryMetric())) {
                continue;
            }
            try {
                secondary.put(metric, testMetric(data, metric));
            } catch (InsufficientDataException | StatisticalAnalysisException e) {
                log.debug("Secondary metric skipped experimentId={}, metric={}, reason={}", experiment.getId(), metric, e.getMessage());
                failed.put(metric, e.getMessage());
            }
        }

        MultipleTestingCorrection correction = null;
        if (!secondary.isEmpty()) {
            correction = settings.getMultipleTestingCorrection();
            List<String> names = new ArrayList<>();
            names.add(primary.getMetric());
            names.addAll(secondary.keySet());
            double[] raw = new double[names.size()];
            raw[0] = primary.getPValue();
            for (int i = 1; i < names.size(); i++) {
                raw[i] = secondary.get(names.get(i)).getPValue();
            }
            double[] adjusted = correction.adjust(raw);
            primary = withAdjustedPValue(primary, adjusted[0]);
            for (int i = 1; i < names.size(); i++) {
                secondary.put(names.get(i), withAdjustedPValue(secondary.get(names.get(i)), adjusted[i]));
            }
        }

        return FrequentistResult.builder()
                .primaryMetric(primary)
                .secondaryMetrics(secondary)
                .failedMetrics(failed)
                .sampleRatioCheck(checkSampleRatioMismatch(data))
                .correction(correction)
                .build();
    }

    /**
     * Compare control and treatment on a single metric, choosing the test from the data.
     */
    public MetricTestResult testMetric(AnalysisDataset data, String metric) {
        Experiment experiment = data.getExperiment();
        String controlName = experiment.getControlVariant();
        String treatmentName = experiment.getTreatmentVariant();
        if (!data.hasVariant(controlName) || !data.hasVariant(treatmentName)) {
            throw new StatisticalAnalysisException("Experiment " + experiment.getId() + " has no '" + controlName
                    + "' / '" + treatmentName + "' variant pair");
        }
        double[] control = data.values(controlName, metric);
        double[] treatment = data.values(treatmentName, metric);
        if (control.length == 0 || treatment.length == 0) {
            throw new InsufficientDataException("No data for metric '" + metric + "' in "
                    + (control.length == 0 ? controlName : treatmentName));
        }

        if (data.isBinary(metric)) {
            return chiSquareTest(metric, control, treatment);
        }
        if (control.length < 2 || treatment.length < 2) {
            throw new InsufficientDataException("Metric '" + metric + "' needs at least 2 observations per variant");
        }
        if (control.length >= LARGE_SAMPLE && treatment.length >= LARGE_SAMPLE) {
            return welchTTest(metric, control, treatment);
        }
        return mannWhitneyTest(metric, control, treatment);
    }

    MetricTestResult chiSquareTest(String metric, double[] control, double[] treatment) {
        int n1 = control.length;
        int n2 = treatment.length;
        double s1 = StatUtils.sum(control);
        double s2 = StatUtils.sum(treatment);
        double p1 = s1 / n1;
        double p2 = s2 / n2;
        double n = n1 + n2;
        double successes = s1 + s2;
        double failures = n - successes;

        double chiSquare = 0.0;
        if (successes > 0 && failures > 0) {
            double[][] observed = {{s1, n1 - s1}, {s2, n2 - s2}};
            double[] rowTotals = {n1, n2};
            double[] columnTotals = {successes, failures};
            for (int i = 0; i < 2; i++) {
                for (int j = 0; j < 2; j++) {
                    double expected = rowTotals[i] * columnTotals[j] / n;
                    double diff = observed[i][j] - expected;
                    chiSquare += diff * diff / expected;
                }
            }
        }
        double pValue = clamp(1.0 - new ChiSquaredDistribution(null, 1).cumulativeProbability(chiSquare));
        double phi = Math.signum(p2 - p1) * Math.sqrt(chiSquare / n);
        double se = Math.sqrt(p1 * (1 - p1) / n1 + p2 * (1 - p2) / n2);

        return baseResult(metric, TestType.CHI_SQUARE, chiSquare, pValue, n1, n2, p1, p2)
                .degreesOfFreedom(1.0)
                .effectSize(phi)
                .effectSizeType("phi")
                .confidenceInterval(normalInterval(p2 - p1, se))
                .build();
    }

    MetricTestResult welchTTest(String metric, double[] control, double[] treatment) {
        int n1 = control.length;
        int n2 = treatment.length;
        double m1 = StatUtils.mean(control);
        double m2 = StatUtils.mean(treatment);
        double v1 = StatUtils.variance(control, m1);
        double v2 = StatUtils.variance(treatment, m2);
        double diff = m2 - m1;
        double se = Math.sqrt(v1 / n1 + v2 / n2);

        double t;
        double df;
        double pValue;
        if (se == 0.0) {
            if (diff != 0.0) {
                throw new StatisticalAnalysisException("Metric '" + metric + "' has zero variance but different means");
            }
            t = 0.0;
            df = n1 + n2 - 2;
            pValue = 1.0;
        } else {
            t = diff / se;
            double a = v1 / n1;
            double b = v2 / n2;
            df = (a + b) * (a + b) / (a * a / (n1 - 1) + b * b / (n2 - 1));
            pValue = clamp(2.0 * (1.0 - new TDistribution(null, df).cumulativeProbability(Math.abs(t))));
        }
        double pooledSd = Math.sqrt(((n1 - 1) * v1 + (n2 - 1) * v2) / (n1 + n2 - 2));
        double cohensD = pooledSd == 0.0 ? 0.0 : diff / pooledSd;

        return baseResult(metric, TestType.WELCH_T_TEST, t, pValue, n1, n2, m1, m2)
                .degreesOfFreedom(df)
                .effectSize(cohensD)
                .effectSizeType("cohens_d")
                .confidenceInterval(tInterval(diff, se, df))
                .build();
    }

    MetricTestResult mannWhitneyTest(String metric, double[] control, double[] treatment) {
        int n1 = control.length;
        int n2 = treatment.length;
        double[] combined = new double[n1 + n2];
        System.arraycopy(control, 0, combined, 0, n1);
        System.arraycopy(treatment, 0, combined, n1, n2);
        double[] ranks = new NaturalRanking(NaNStrategy.FAILED, TiesStrategy.AVERAGE).rank(combined);

        double controlRankSum = 0.0;
        for (int i = 0; i < n1; i++) {
            controlRankSum += ranks[i];
        }
        double uControl = controlRankSum - n1 * (n1 + 1) / 2.0;
        double uTreatment = (double) n1 * n2 - uControl;
        double u = Math.min(uControl, uTreatment);

        double total = n1 + n2;
        double tieCorrection = 0.0;
        for (long ties : tieGroupSizes(combined)) {
            tieCorrection += (double) ties * ties * ties - ties;
        }
        double variance = n1 * (double) n2 / 12.0 * ((total + 1) - tieCorrection / (total * (total - 1)));
        double z = 0.0;
        double pValue = 1.0;
        if (variance > 0) {
            z = (uTreatment - n1 * (double) n2 / 2.0) / Math.sqrt(variance);
            pValue = clamp(2.0 * (1.0 - STANDARD_NORMAL.cumulativeProbability(Math.abs(z))));
        }
        double rankBiserial = 2.0 * uTreatment / (n1 * (double) n2) - 1.0;

        double m1 = StatUtils.mean(control);
        double m2 = StatUtils.mean(treatment);
        double se = Math.sqrt(StatUtils.variance(control, m1) / n1 + StatUtils.variance(treatment, m2) / n2);

        return baseResult(metric, TestType.MANN_WHITNEY_U, u, pValue, n1, n2, m1, m2)
                .zScore(z)
                .effectSize(rankBiserial)
                .effectSizeType("rank_biserial")
                .confidenceInterval(normalInterval(m2 - m1, se))
                .build();
    }

    /**
     * Sample ratio mismatch check over distinct users per variant.
     */
    public SampleRatioCheck checkSampleRatioMismatch(AnalysisDataset data) {
        Experiment experiment = data.getExperiment();
        Map<String, Integer> observed = data.getSampleSizes();
        int total = data.getTotalSampleSize();
        Map<String, Double> expected = new LinkedHashMap<>();
        double chiSquare = 0.0;
        for (Variant variant : experiment.getVariants()) {
            double e = total * variant.getNormalizedWeight();
            expected.put(variant.getName(), e);
            if (e > 0) {
                double diff = observed.getOrDefault(variant.getName(), 0) - e;
                chiSquare += diff * diff / e;
            }
        }
        int df = experiment.getVariants().size() - 1;
        double pValue = total == 0 ? 1.0
                : clamp(1.0 - new ChiSquaredDistribution(null, df).cumulativeProbability(chiSquare));
        return new SampleRatioCheck(pValue < SRM_THRESHOLD, chiSquare, pValue, df,
                Collections.unmodifiableMap(new LinkedHashMap<>(observed)), Collections.unmodifiableMap(expected));
    }

    private MetricTestResult.MetricTestResultBuilder baseResult(String metric, TestType type, double statistic, double pValue,
                                                                int n1, int n2, double controlMean, double treatmentMean) {
        double diff = treatmentMean - controlMean;
        return MetricTestResult.builder()
                .metric(metric)
                .testType(type)
                .statistic(statistic)
                .pValue(pValue)
                .adjustedPValue(pValue)
                .controlSampleSize(n1)
                .treatmentSampleSize(n2)
                .controlMean(controlMean)
                .treatmentMean(treatmentMean)
                .difference(diff)
                .relativeDifference(controlMean == 0.0 ? null : diff / controlMean)
                .significant(pValue < settings.getAlpha());
    }

    private MetricTestResult withAdjustedPValue(MetricTestResult result, double adjusted) {
        return result.toBuilder()
                .adjustedPValue(adjusted)
                .significant(adjusted < settings.getAlpha())
                .build();
    }

    private ConfidenceInterval normalInterval(double estimate, double se) {
        double z = STANDARD_NORMAL.inverseCumulativeProbability(1.0 - settings.getAlpha() / 2.0);
        return new ConfidenceInterval(estimate - z * se, estimate + z * se, settings.getConfidenceLevel());
    }

    private ConfidenceInterval tInterval(double estimate, double se, double df) {
        double t = new TDistribution(null, df).inverseCumulativeProbability(1.0 - settings.getAlpha() / 2.0);
        return new ConfidenceInterval(estimate - t * se, estimate + t * se, settings.getConfidenceLevel());
    }

    private static List<Long> tieGroupSizes(double[] values) {
        Map<Double, Long> counts = new HashMap<>();
        Arrays.stream(values).forEach(v -> counts.merge(v, 1L, Long::sum));
        List<Long> groups = new ArrayList<>();
        counts.values().stream().filter(c -> c > 1).forEach(groups::add);
        return groups;
    }

    private static double clamp(double p) {
        return Math.max(0.0, Math.min(1.0, p));
    }
}
