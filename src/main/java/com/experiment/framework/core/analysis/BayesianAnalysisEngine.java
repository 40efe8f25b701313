package com.experiment.framework.core.analysis;

import com.experiment.framework.core.FrameworkSettings;
import com.experiment.framework.core.analysis.BayesianResult.MetricPosterior;
import com.experiment.framework.core.analysis.BayesianResult.Posterior;
import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.MetricType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bayesian comparison of all variants. Binary metrics use a Beta(1, 1) prior, continuous metrics a
 * Normal(0, 1/0.001) prior with precision-weighted updating. Probability of being best and expected loss
 * come from Monte Carlo draws of the posteriors.
 */
@Slf4j
@Component
public class BayesianAnalysisEngine {

    static final double PRIOR_ALPHA = 1.0;
    static final double PRIOR_BETA = 1.0;
    static final double PRIOR_MU = 0.0;
    static final double PRIOR_TAU = 0.001;
    static final double CREDIBLE_LEVEL = 0.95;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0, 1);

    private final FrameworkSettings settings;
    private final RandomGenerator random;

    public BayesianAnalysisEngine(FrameworkSettings settings, RandomGenerator random) {
        this.settings = settings;
        this.random = random;
    }

    /**
     * @throws InsufficientDataException if the primary metric has no usable data
     */
    public BayesianResult analyze(AnalysisDataset data) {
        Experiment experiment = data.getExperiment();
        MetricPosterior primary = analyzeMetric(data, experiment.getPrimaryMetric());
        Map<String, MetricPosterior> secondary = new LinkedHashMap<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String metric : experiment.getSecondaryMetrics()) {
            if (metric.equals(experiment.getPrimaryMetric())) {
                continue;
            }
            try {
                secondary.put(metric, analyzeMetric(data, metric));
            } catch (InsufficientDataException | StatisticalAnalysisException e) {
                failed.put(metric, e.getMessage());
            }
        }
        return BayesianResult.builder()
                .primaryMetric(primary)
                .secondaryMetrics(secondary)
                .failedMetrics(failed)
                .build();
    }

    public MetricPosterior analyzeMetric(AnalysisDataset data, String metric) {
        List<String> variants = data.variants();
        boolean binary = data.isBinary(metric);
        if (!binary && variants.stream().allMatch(v -> data.values(v, metric).length == 0)) {
            throw new InsufficientDataException("No data for metric '" + metric + "'");
        }

        Map<String, Posterior> posteriors = new LinkedHashMap<>();
        Map<String, RealDistribution> samplers = new LinkedHashMap<>();
        Map<String, ConfidenceInterval> credible = new LinkedHashMap<>();
        for (String variant : variants) {
            double[] values = data.values(variant, metric);
            if (binary) {
                double successes = StatUtils.sum(values);
                double alpha = PRIOR_ALPHA + successes;
                double beta = PRIOR_BETA + values.length - successes;
                BetaDistribution posterior = new BetaDistribution(random, alpha, beta);
                posteriors.put(variant, Posterior.builder()
                        .alpha(alpha)
                        .beta(beta)
                        .mean(posterior.getNumericalMean())
                        .variance(posterior.getNumericalVariance())
                        .sampleSize(values.length)
                        .build());
                samplers.put(variant, posterior);
                credible.put(variant, new ConfidenceInterval(
                        posterior.inverseCumulativeProbability((1 - CREDIBLE_LEVEL) / 2),
                        posterior.inverseCumulativeProbability(1 - (1 - CREDIBLE_LEVEL) / 2),
                        CREDIBLE_LEVEL));
            } else {
                Posterior posterior = normalPosterior(metric, variant, values);
                double sd = Math.sqrt(posterior.getVariance());
                samplers.put(variant, new NormalDistribution(random, posterior.getMu(), sd));
                double z = STANDARD_NORMAL.inverseCumulativeProbability(1 - (1 - CREDIBLE_LEVEL) / 2);
                posteriors.put(variant, posterior);
                credible.put(variant, new ConfidenceInterval(posterior.getMu() - z * sd, posterior.getMu() + z * sd, CREDIBLE_LEVEL));
            }
        }

        int simulations = settings.getEffectiveBayesianSimulations();
        Map<String, Double> probabilityBest = new LinkedHashMap<>();
        Map<String, Double> expectedLoss = new LinkedHashMap<>();
        simulate(samplers, simulations, probabilityBest, expectedLoss);

        String leading = null;
        for (Map.Entry<String, Double> entry : probabilityBest.entrySet()) {
            if (entry.getValue() > settings.getBayesianDecisionThreshold()) {
                leading = entry.getKey();
            }
        }
        log.debug("Bayesian analysis metric={}, probabilityBest={}, leading={}", metric, probabilityBest, leading);

        return MetricPosterior.builder()
                .metric(metric)
                .metricType(binary ? MetricType.BINARY : MetricType.CONTINUOUS)
                .posteriors(posteriors)
                .probabilityOfBeingBest(probabilityBest)
                .expectedLoss(expectedLoss)
                .credibleIntervals(credible)
                .leadingVariant(leading)
                .simulations(simulations)
                .build();
    }

    private Posterior normalPosterior(String metric, String variant, double[] values) {
        if (values.length < 2) {
            throw new InsufficientDataException("Metric '" + metric + "' needs at least 2 observations in " + variant);
        }
        double mean = StatUtils.mean(values);
        double variance = StatUtils.variance(values, mean);
        if (variance == 0.0) {
            throw new StatisticalAnalysisException("Metric '" + metric + "' has zero variance in " + variant);
        }
        double dataTau = values.length / variance;
        double tau = PRIOR_TAU + dataTau;
        double mu = (PRIOR_TAU * PRIOR_MU + dataTau * mean) / tau;
        return Posterior.builder()
                .mu(mu)
                .tau(tau)
                .mean(mu)
                .variance(1.0 / tau)
                .sampleSize(values.length)
                .build();
    }

    private static void simulate(Map<String, RealDistribution> samplers, int simulations,
                                 Map<String, Double> probabilityBest, Map<String, Double> expectedLoss) {
        String[] names = samplers.keySet().toArray(new String[0]);
        RealDistribution[] distributions = samplers.values().toArray(new RealDistribution[0]);
        long[] wins = new long[names.length];
        double[] loss = new double[names.length];
        double[] draw = new double[names.length];

        for (int s = 0; s < simulations; s++) {
            int best = 0;
            for (int i = 0; i < names.length; i++) {
                draw[i] = distributions[i].sample();
                if (draw[i] > draw[best]) {
                    best = i;
                }
            }
            wins[best]++;
            for (int i = 0; i < names.length; i++) {
                loss[i] += draw[best] - draw[i];
            }
        }
        for (int i = 0; i < names.length; i++) {
            probabilityBest.put(names[i], wins[i] / (double) simulations);
            expectedLoss.put(names[i], loss[i] / simulations);
        }
    }
}
