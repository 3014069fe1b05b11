package com.example.migration.model;

import java.util.List;

public record MigrationSummary(
        List<MigrationResult> results,
        long totalSource,
        long totalInserted,
        long totalSkippedDuplicates,
        long totalErrors,
        long totalDurationMillis,
        boolean hasErrors) {

    public static MigrationSummary from(List<MigrationResult> results, boolean hasErrors) {
        MigrationResult totals = MigrationResult.combine("total", results);
        return new MigrationSummary(
                List.copyOf(results),
                totals.sourceCount(),
                totals.insertedCount(),
                totals.skippedDuplicates(),
                totals.errors(),
                totals.durationMillis(),
                hasErrors);
    }
}
