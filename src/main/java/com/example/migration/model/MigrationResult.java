package com.example.migration.model;

import java.util.List;

public record MigrationResult(
        String step,
        long sourceCount,
        long insertedCount,
        long skippedDuplicates,
        long skipped,
        long errors,
        long durationMillis,
        ResultStatus status,
        String error) {

    public static ResultStatus statusFor(long errors) {
        return errors > 0 ? ResultStatus.FAILED : ResultStatus.SUCCESS;
    }

    public static MigrationResult alreadyCompleted(MigrationCheckpoint checkpoint) {
        long total = checkpoint.getTotalCount() != null ? checkpoint.getTotalCount() : 0;
        return new MigrationResult(
                checkpoint.getId(),
                total,
                checkpoint.getProcessedCount(),
                0,
                0,
                0,
                0,
                checkpoint.getError() != null ? ResultStatus.FAILED : ResultStatus.SUCCESS,
                checkpoint.getError());
    }

    public static MigrationResult combine(String step, List<MigrationResult> parts) {
        long source = 0;
        long inserted = 0;
        long duplicates = 0;
        long skipped = 0;
        long errors = 0;
        long duration = 0;
        boolean failed = false;
        for (MigrationResult part : parts) {
            source += part.sourceCount();
            inserted += part.insertedCount();
            duplicates += part.skippedDuplicates();
            skipped += part.skipped();
            errors += part.errors();
            duration += part.durationMillis();
            failed |= part.isFailed();
        }
        ResultStatus status = failed ? ResultStatus.FAILED : statusFor(errors);
        return new MigrationResult(step, source, inserted, duplicates, skipped, errors, duration, status, null);
    }

    public MigrationResult failedWith(String message) {
        return new MigrationResult(step, sourceCount, insertedCount, skippedDuplicates, skipped, errors,
                durationMillis, ResultStatus.FAILED, message);
    }

    public boolean isFailed() {
        return status == ResultStatus.FAILED;
    }
}
