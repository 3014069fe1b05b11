package com.example.migration.service;

import com.example.migration.model.CheckpointStatus;
import com.example.migration.model.MigrationCheckpoint;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-step checkpoints of one runner, mirrored to the checkpoint collection.
 *
 * <p>Every mutation is written through before the in-memory copy is replaced, so the stored state
 * is never behind the last committed batch. There is no locking: only one runner may work on a
 * given step at a time.
 */
@Slf4j
public class CheckpointStore {

    private final MigrationDatabase database;
    private final Map<String, MigrationCheckpoint> checkpoints = new HashMap<>();

    public CheckpointStore(MigrationDatabase database) {
        this.database = Objects.requireNonNull(database, "database");
    }

    public void load() {
        List<MigrationCheckpoint> stored = database.findAllCheckpoints();
        checkpoints.clear();
        stored.forEach(checkpoint -> checkpoints.put(checkpoint.getId(), checkpoint));
        log.info("Loaded {} migration checkpoints", checkpoints.size());
    }

    public Optional<MigrationCheckpoint> get(String step) {
        return Optional.ofNullable(checkpoints.get(step)).map(MigrationCheckpoint::copy);
    }

    /**
     * Starts a new life for the step's checkpoint: running, no cursor, no counts.
     */
    public MigrationCheckpoint start(String step) {
        return start(step, false);
    }

    public MigrationCheckpoint start(String step, boolean dryRun) {
        MigrationCheckpoint existing = checkpoints.get(step);
        if (existing != null) {
            checkTransition(step, existing.getStatus(), CheckpointStatus.RUNNING);
        }
        return persist(MigrationCheckpoint.running(step, dryRun));
    }

    /**
     * Applies {@code changes} to a copy of the current checkpoint, or to a fresh pending one, and
     * writes the whole record.
     *
     * @throws IllegalStateException if the change is an invalid status transition or revises a
     *     recorded total count
     */
    public MigrationCheckpoint update(String step, Consumer<MigrationCheckpoint> changes) {
        MigrationCheckpoint existing = checkpoints.get(step);
        MigrationCheckpoint updated = existing != null ? existing.copy() : MigrationCheckpoint.pending(step);
        changes.accept(updated);
        updated.setId(step);

        CheckpointStatus from = existing != null ? existing.getStatus() : CheckpointStatus.PENDING;
        checkTransition(step, from, updated.getStatus());
        if (existing != null && existing.getTotalCount() != null
                && !existing.getTotalCount().equals(updated.getTotalCount())) {
            throw new IllegalStateException("Total count of step %s is already recorded as %d"
                    .formatted(step, existing.getTotalCount()));
        }
        return persist(updated);
    }

    private MigrationCheckpoint persist(MigrationCheckpoint checkpoint) {
        database.saveCheckpoint(checkpoint);
        checkpoints.put(checkpoint.getId(), checkpoint);
        log.debug("Saved checkpoint {}", checkpoint);
        return checkpoint.copy();
    }

    private static void checkTransition(String step, CheckpointStatus from, CheckpointStatus to) {
        if (to == null || from == null || !from.canTransitionTo(to)) {
            throw new IllegalStateException("Invalid checkpoint transition for step %s: %s -> %s"
                    .formatted(step, from, to));
        }
    }
}
