package com.example.migration.model;

import java.util.Objects;

public record StepOptions(String sourceCollection, int batchSize, boolean dryRun, boolean resume) {

    public static final int DEFAULT_BATCH_SIZE = 500;

    public StepOptions {
        Objects.requireNonNull(sourceCollection, "sourceCollection");
        if (sourceCollection.isBlank()) {
            throw new IllegalArgumentException("sourceCollection must not be blank");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got %d".formatted(batchSize));
        }
    }

    public static StepOptions forSource(String sourceCollection) {
        return new StepOptions(sourceCollection, DEFAULT_BATCH_SIZE, false, false);
    }

    public StepOptions withBatchSize(int size) {
        return new StepOptions(sourceCollection, size, dryRun, resume);
    }

    public StepOptions withDryRun(boolean value) {
        return new StepOptions(sourceCollection, batchSize, value, resume);
    }

    public StepOptions withResume(boolean value) {
        return new StepOptions(sourceCollection, batchSize, dryRun, value);
    }
}
