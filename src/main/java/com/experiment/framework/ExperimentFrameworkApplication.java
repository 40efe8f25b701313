package com.experiment.framework;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the experimentation engine. Enables:
 * <ul>
 *   <li>A/B experiments with random, hash, stratified and bandit assignment</li>
 *   <li>Frequentist, Bayesian and sequential analysis, power analysis</li>
 *   <li>Kafka signal ingestion and lifecycle events</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class ExperimentFrameworkApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExperimentFrameworkApplication.class, args);
    }
}
