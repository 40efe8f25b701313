package com.experiment.framework.core;

import com.experiment.framework.api.ExperimentNotFoundException;
import com.experiment.framework.api.ExperimentValidationException;
import com.experiment.framework.api.InvalidExperimentStateException;
import com.experiment.framework.domain.Experiment;
import com.experiment.framework.domain.ExperimentStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory experiment registry. Experiments are never removed; status changes replace the snapshot atomically.
 */
@Component
public class ExperimentRepository {

    private final ConcurrentHashMap<String, Experiment> experiments = new ConcurrentHashMap<>();

    /**
     * @throws ExperimentValidationException if an experiment with the same id already exists
     */
    public Experiment save(Experiment experiment) {
        Experiment existing = experiments.putIfAbsent(experiment.getId(), experiment);
        if (existing != null) {
            throw new ExperimentValidationException("Experiment already exists: " + experiment.getId());
        }
        return experiment;
    }

    public Optional<Experiment> findById(String experimentId) {
        if (experimentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(experiments.get(experimentId));
    }

    /** All experiments, oldest first. */
    public List<Experiment> findAll() {
        List<Experiment> all = new ArrayList<>(experiments.values());
        all.sort(Comparator.comparing(Experiment::getCreatedAt).thenComparing(Experiment::getId));
        return all;
    }

    public List<Experiment> findActive() {
        return findAll().stream().filter(Experiment::isActive).collect(Collectors.toList());
    }

    /**
     * Compare-and-set ACTIVE to STOPPED. Exactly one caller wins; every other caller gets
     * {@link InvalidExperimentStateException}.
     */
    public Experiment markStopped(String experimentId, String reason, Instant endTime) {
        Experiment[] stopped = new Experiment[1];
        experiments.compute(experimentId, (id, current) -> {
            if (current == null) {
                throw new ExperimentNotFoundException("Experiment not found: " + experimentId);
            }
            if (current.getStatus() != ExperimentStatus.ACTIVE) {
                throw new InvalidExperimentStateException("Experiment " + experimentId + " is not active (status="
                        + current.getStatus() + ", reason=" + current.getStopReason() + ")");
            }
            stopped[0] = current.toBuilder()
                    .status(ExperimentStatus.STOPPED)
                    .endTime(endTime)
                    .stopReason(reason)
                    .build();
            return stopped[0];
        });
        return stopped[0];
    }
}
