package com.experiment.framework.config;

import com.experiment.framework.core.FrameworkSettings;
import com.experiment.framework.core.analysis.MultipleTestingCorrection;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.SynchronizedRandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Engine settings from {@code experiment.framework.*} and the shared random source.
 */
@Slf4j
@Configuration
public class FrameworkConfig {

    @Value("${experiment.framework.confidence-level:0.95}")
    private double confidenceLevel;

    @Value("${experiment.framework.power:0.8}")
    private double power;

    @Value("${experiment.framework.min-sample-size:100}")
    private int minSampleSize;

    @Value("${experiment.framework.max-experiment-duration:30d}")
    private Duration maxExperimentDuration;

    @Value("${experiment.framework.multiple-testing-correction:bonferroni}")
    private String multipleTestingCorrection;

    @Value("${experiment.framework.enable-bayesian:true}")
    private boolean enableBayesian;

    @Value("${experiment.framework.enable-sequential-testing:true}")
    private boolean enableSequentialTesting;

    @Value("${experiment.framework.bayesian.simulations:10000}")
    private int bayesianSimulations;

    @Value("${experiment.framework.bayesian.decision-threshold:0.95}")
    private double bayesianDecisionThreshold;

    @Value("${experiment.framework.bandit.epsilon:0.1}")
    private double banditEpsilon;

    @Value("${experiment.framework.bandit.learning-rate:0.01}")
    private double banditLearningRate;

    @Value("${experiment.framework.default-daily-traffic:1000}")
    private int defaultDailyTraffic;

    /** Unset means a time-seeded generator. */
    @Value("${experiment.framework.random-seed:#{null}}")
    private Long randomSeed;

    @Bean
    public FrameworkSettings frameworkSettings() {
        if (bayesianSimulations < FrameworkSettings.MIN_BAYESIAN_SIMULATIONS) {
            log.warn("experiment.framework.bayesian.simulations={} is below the minimum, using {}",
                    bayesianSimulations, FrameworkSettings.MIN_BAYESIAN_SIMULATIONS);
        }
        return FrameworkSettings.builder()
                .confidenceLevel(confidenceLevel)
                .power(power)
                .minSampleSize(minSampleSize)
                .maxExperimentDuration(maxExperimentDuration)
                .multipleTestingCorrection(MultipleTestingCorrection.fromName(multipleTestingCorrection))
                .enableBayesian(enableBayesian)
                .enableSequentialTesting(enableSequentialTesting)
                .bayesianSimulations(bayesianSimulations)
                .bayesianDecisionThreshold(bayesianDecisionThreshold)
                .banditEpsilon(banditEpsilon)
                .banditLearningRate(banditLearningRate)
                .defaultDailyTraffic(defaultDailyTraffic)
                .build();
    }

    /** Well19937c shared by strategies and Monte Carlo; wrapped because it is not thread-safe. */
    @Bean
    @ConditionalOnMissingBean(RandomGenerator.class)
    public RandomGenerator experimentRandomGenerator() {
        Well19937c generator = randomSeed != null ? new Well19937c(randomSeed) : new Well19937c();
        return new SynchronizedRandomGenerator(generator);
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock experimentClock() {
        return Clock.systemUTC();
    }
}
