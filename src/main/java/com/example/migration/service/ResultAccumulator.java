package com.example.migration.service;

import com.example.migration.model.BatchResult;
import com.example.migration.model.MigrationResult;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

@Slf4j
final class ResultAccumulator {

    private final String step;
    private final boolean dryRun;

    private long inserted;
    private long duplicates;
    private long skipped;
    private long errors;

    ResultAccumulator(String step, boolean dryRun) {
        this.step = step;
        this.dryRun = dryRun;
    }

    void recordBatch(int batchSize, List<BatchResult> results) {
        if (dryRun) {
            return;
        }
        int reported = results == null ? 0 : results.size();
        if (reported > batchSize) {
            log.warn("Processor for step={} returned {} results for a batch of {}; ignoring the surplus",
                    step, reported, batchSize);
        }
        for (int i = 0; i < batchSize; i++) {
            BatchResult result = i < reported ? results.get(i) : BatchResult.SKIPPED;
            record(result == null ? BatchResult.SKIPPED : result);
        }
    }

    void recordFailedBatch(int batchSize) {
        if (!dryRun) {
            errors += batchSize;
        }
    }

    long errors() {
        return errors;
    }

    MigrationResult toResult(long sourceCount, long durationMillis) {
        return new MigrationResult(step, sourceCount, inserted, duplicates, skipped, errors, durationMillis,
                MigrationResult.statusFor(errors), null);
    }

    private void record(BatchResult result) {
        switch (result) {
            case INSERTED -> inserted++;
            case DUPLICATE -> duplicates++;
            case ERROR -> errors++;
            case SKIPPED -> skipped++;
        }
    }
}
