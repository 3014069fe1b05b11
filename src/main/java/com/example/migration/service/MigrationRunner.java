package com.example.migration.service;

import com.example.migration.model.BatchResult;
import com.example.migration.model.CheckpointStatus;
import com.example.migration.model.MigrationCheckpoint;
import com.example.migration.model.MigrationResult;
import com.example.migration.model.StepOptions;
import com.example.migration.model.VerificationResult;
import com.mongodb.client.MongoCollection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

/**
 * Drains source collections batch by batch, checkpointing after every batch so an interrupted step
 * can be resumed.
 *
 * <p>A runner owns its checkpoint store and serves a single migration invocation. Typical use:
 *
 * <pre>{@code
 * try (MigrationRunner runner = new MigrationRunner(connectionManager)) {
 *     runner.connect();
 *     runner.loadCheckpoints();
 *     runner.runStep("messagesStep", processor, StepOptions.forSource("contactmessages"));
 * }
 * }</pre>
 */
@Slf4j
public class MigrationRunner implements AutoCloseable {

    private static final String STEP_SUFFIX = "Step";

    private final ConnectionManager connectionManager;
    private CheckpointStore checkpointStore;

    public MigrationRunner(ConnectionManager connectionManager) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
    }

    public void connect() {
        connectionManager.connect();
        checkpointStore = new CheckpointStore(connectionManager.database());
    }

    public void disconnect() {
        connectionManager.disconnect();
        checkpointStore = null;
    }

    @Override
    public void close() {
        disconnect();
    }

    public void loadCheckpoints() {
        checkpoints().load();
    }

    public Optional<MigrationCheckpoint> getCheckpoint(String step) {
        return checkpoints().get(step);
    }

    public MongoCollection<Document> collection(String name) {
        return connectionManager.database().collection(name);
    }

    public MigrationResult runStep(String stepName, BatchProcessor processor, StepOptions options) {
        Objects.requireNonNull(stepName, "stepName");
        Objects.requireNonNull(processor, "processor");
        Objects.requireNonNull(options, "options");
        CheckpointStore store = checkpoints();
        MigrationDatabase database = connectionManager.database();

        log.info("Starting step={} source={} batchSize={} dryRun={} resume={}",
                stepName, options.sourceCollection(), options.batchSize(), options.dryRun(), options.resume());
        Instant start = Instant.now();

        Optional<MigrationCheckpoint> existing = store.get(stepName);
        Optional<MigrationCheckpoint> resumable = existing
                .filter(previous -> options.resume() && previous.isResumableBy(options.dryRun()));
        if (resumable.isPresent() && resumable.get().isCompleted()) {
            log.info("Step {} already completed, skipping", stepName);
            return MigrationResult.alreadyCompleted(resumable.get());
        }

        MigrationCheckpoint checkpoint;
        if (resumable.isEmpty()) {
            if (options.resume() && existing.isPresent()) {
                log.info("Checkpoint of step={} was recorded by a dry run, starting over", stepName);
            } else {
                existing.filter(previous -> previous.getProcessedCount() > 0)
                        .ifPresent(previous -> log.info(
                                "Restarting step={} from the beginning, discarding processed={}",
                                stepName, previous.getProcessedCount()));
            }
            checkpoint = store.start(stepName, options.dryRun());
        } else {
            checkpoint = store.update(stepName, cp -> {
                cp.setStatus(CheckpointStatus.RUNNING);
                cp.setError(null);
                cp.setCompletedAt(null);
                cp.setDryRun(cp.isDryRun() || options.dryRun());
            });
            log.info("Resuming step={} after id={} processed={}",
                    stepName, checkpoint.getLastProcessedId(), checkpoint.getProcessedCount());
        }

        ResultAccumulator accumulator = new ResultAccumulator(stepName, options.dryRun());
        int inFlight = 0;
        try {
            long totalCount;
            if (checkpoint.getTotalCount() != null) {
                totalCount = checkpoint.getTotalCount();
            } else {
                totalCount = database.countDocuments(options.sourceCollection());
                store.update(stepName, cp -> cp.setTotalCount(totalCount));
            }
            log.info("Total documents in {}: {}", options.sourceCollection(), totalCount);

            BatchCursor cursor = new BatchCursor(database, options.sourceCollection(),
                    checkpoint.getLastProcessedId(), options.batchSize());
            long processedCount = checkpoint.getProcessedCount();

            List<Document> batch;
            while (!(batch = cursor.nextBatch()).isEmpty()) {
                inFlight = batch.size();
                log.debug("Processing batch of {} documents for step={}", batch.size(), stepName);

                List<BatchResult> results = processor.process(Collections.unmodifiableList(batch), options.dryRun());
                accumulator.recordBatch(batch.size(), results);

                processedCount += batch.size();
                long processed = processedCount;
                Object lastId = cursor.lastId();
                store.update(stepName, cp -> {
                    cp.setLastProcessedId(lastId);
                    cp.setProcessedCount(processed);
                    cp.setTotalCount(totalCount);
                });
                inFlight = 0;
            }

            String shortfall = processedCount < totalCount
                    ? "Source %s exhausted after %d of %d documents".formatted(
                            options.sourceCollection(), processedCount, totalCount)
                    : null;
            if (shortfall != null) {
                log.warn("Step {} read fewer documents than counted: {}", stepName, shortfall);
            }
            store.update(stepName, cp -> {
                cp.setStatus(CheckpointStatus.COMPLETED);
                cp.setCompletedAt(Instant.now());
                cp.setError(shortfall);
            });

            MigrationResult result = accumulator.toResult(totalCount, Duration.between(start, Instant.now()).toMillis());
            if (shortfall != null) {
                result = result.failedWith(shortfall);
            }
            log.info("Step {} completed in {} ms: source={} inserted={} duplicates={} skipped={} errors={} status={}",
                    stepName, result.durationMillis(), result.sourceCount(), result.insertedCount(),
                    result.skippedDuplicates(), result.skipped(), result.errors(), result.status());
            return result;
        } catch (RuntimeException ex) {
            accumulator.recordFailedBatch(inFlight);
            log.error("Step {} failed after errors={}: {}", stepName, accumulator.errors(), ex.getMessage(), ex);
            markFailed(store, stepName, ex);
            throw ex;
        }
    }

    /**
     * Counts target documents tagged with the source derived from the step name: a trailing
     * {@code Step} is removed and the rest lower-cased.
     */
    public VerificationResult verifyStep(String stepName, String targetCollection, Long expectedCount) {
        return verifyStep(stepName, targetCollection, deriveSourceTag(stepName), expectedCount);
    }

    public VerificationResult verifyStep(String stepName, String targetCollection, String sourceTag,
            Long expectedCount) {
        Objects.requireNonNull(sourceTag, "sourceTag");
        long actual = connectionManager.database().countBySource(targetCollection, sourceTag);
        List<String> mismatches = new ArrayList<>();
        if (expectedCount != null && actual != expectedCount) {
            mismatches.add("Count mismatch: expected %d, got %d".formatted(expectedCount, actual));
        }
        VerificationResult result = VerificationResult.of(actual, mismatches);
        if (!result.valid()) {
            log.warn("Verification of step={} against {} source={} found mismatches: {}",
                    stepName, targetCollection, sourceTag, mismatches);
        }
        return result;
    }

    public void dropCollections(List<String> collections) {
        MigrationDatabase database = connectionManager.database();
        for (String collection : collections) {
            try {
                database.dropCollection(collection);
                log.info("Dropped collection {}", collection);
            } catch (RuntimeException ex) {
                log.warn("Failed to drop collection {}: {}", collection, ex.getMessage());
            }
        }
    }

    static String deriveSourceTag(String stepName) {
        String base = stepName.endsWith(STEP_SUFFIX)
                ? stepName.substring(0, stepName.length() - STEP_SUFFIX.length())
                : stepName;
        return base.toLowerCase(Locale.ROOT);
    }

    private void markFailed(CheckpointStore store, String stepName, RuntimeException cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        try {
            store.update(stepName, cp -> {
                cp.setStatus(CheckpointStatus.FAILED);
                cp.setError(message);
                cp.setCompletedAt(Instant.now());
            });
        } catch (RuntimeException saveFailure) {
            log.error("Could not record failure of step {}: {}", stepName, saveFailure.getMessage());
            cause.addSuppressed(saveFailure);
        }
    }

    private CheckpointStore checkpoints() {
        if (checkpointStore == null) {
            throw new IllegalStateException("Runner is not connected; call connect() first");
        }
        return checkpointStore;
    }
}
