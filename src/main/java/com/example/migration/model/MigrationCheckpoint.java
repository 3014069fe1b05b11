package com.example.migration.model;

import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Persisted progress of one migration step, keyed by step name.
 *
 * <p>{@code lastProcessedId} holds the raw {@code _id} of the last source document read, so it keeps
 * its BSON type (usually an {@code ObjectId}) across a save and reload. {@code totalCount} stays
 * {@code null} until the step has counted its source. A checkpoint written by a dry run is flagged
 * {@code dryRun}; its progress says nothing about the target, so a real run never resumes from it.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@Document(collection = "_migrations")
public class MigrationCheckpoint {

    @Id
    private String id;
    private Object lastProcessedId;
    private long processedCount;
    private Long totalCount;
    private CheckpointStatus status;
    private String error;
    private Instant startedAt;
    private Instant completedAt;
    private boolean dryRun;

    public static MigrationCheckpoint pending(String step) {
        MigrationCheckpoint checkpoint = new MigrationCheckpoint();
        checkpoint.setId(step);
        checkpoint.setStatus(CheckpointStatus.PENDING);
        checkpoint.setStartedAt(Instant.now());
        return checkpoint;
    }

    public static MigrationCheckpoint running(String step) {
        return running(step, false);
    }

    public static MigrationCheckpoint running(String step, boolean dryRun) {
        MigrationCheckpoint checkpoint = pending(step);
        checkpoint.setStatus(CheckpointStatus.RUNNING);
        checkpoint.setDryRun(dryRun);
        return checkpoint;
    }

    public MigrationCheckpoint copy() {
        MigrationCheckpoint copy = new MigrationCheckpoint();
        copy.setId(id);
        copy.setLastProcessedId(lastProcessedId);
        copy.setProcessedCount(processedCount);
        copy.setTotalCount(totalCount);
        copy.setStatus(status);
        copy.setError(error);
        copy.setStartedAt(startedAt);
        copy.setCompletedAt(completedAt);
        copy.setDryRun(dryRun);
        return copy;
    }

    public boolean isCompleted() {
        return status == CheckpointStatus.COMPLETED;
    }

    public boolean isResumableBy(boolean dryRunRequested) {
        return !dryRun || dryRunRequested;
    }
}
