package com.experiment.framework.core;

import com.experiment.framework.domain.Assignment;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Sticky (userId, experimentId) to variant assignments. One atomic check-then-set per pair.
 */
@Component
public class AssignmentRepository {

    private final ConcurrentHashMap<AssignmentKey, Assignment> assignments = new ConcurrentHashMap<>();

    public Optional<Assignment> find(String userId, String experimentId) {
        if (userId == null || experimentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(assignments.get(new AssignmentKey(userId, experimentId)));
    }

    /**
     * Returns the stored assignment for the pair, creating it with {@code factory} if absent.
     * The factory runs at most once per pair and may return null, in which case nothing is stored.
     */
    public StoreResult assignIfAbsent(String userId, String experimentId, Supplier<Assignment> factory) {
        AtomicBoolean created = new AtomicBoolean(false);
        Assignment assignment = assignments.computeIfAbsent(new AssignmentKey(userId, experimentId), key -> {
            Assignment fresh = factory.get();
            created.set(fresh != null);
            return fresh;
        });
        return new StoreResult(assignment, created.get());
    }

    @Value
    public static class AssignmentKey {
        String userId;
        String experimentId;
    }

    @Value
    public static class StoreResult {
        Assignment assignment;
        /** False when the assignment already existed. */
        boolean created;
    }
}
