package com.example.migration.service;

import com.example.migration.model.MigrationResult;
import com.example.migration.model.MigrationSummary;
import com.example.migration.model.ResultStatus;
import com.example.migration.model.RunSettings;
import com.example.migration.step.MigrationPlan;
import com.example.migration.step.MigrationStep;
import com.example.migration.support.MigrationReportWriter;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the configured steps of one migration invocation in order.
 *
 * <p>A failed step stops the run unless it is a dry run; a step that throws always stops it. Legacy
 * collections are only dropped when asked for, outside dry-run, and when every step succeeded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MigrationOrchestrator {

    private final MigrationRunnerFactory runnerFactory;
    private final MigrationPlan plan;
    private final MigrationReportWriter reportWriter;

    public MigrationSummary migrate(RunSettings settings) {
        List<MigrationStep> selected = plan.select(settings.step());
        if (settings.dryRun()) {
            log.info("Running in DRY-RUN mode, no data will be modified");
        }

        List<MigrationResult> results = new ArrayList<>(selected.size());
        boolean hasErrors = false;

        try (MigrationRunner runner = runnerFactory.create()) {
            runner.connect();
            runner.loadCheckpoints();

            for (MigrationStep step : selected) {
                try {
                    MigrationResult result = step.run(runner, settings);
                    results.add(result);
                    if (result.isFailed()) {
                        hasErrors = true;
                        if (!settings.dryRun()) {
                            log.error("Step {} failed with errors={}, stopping migration", step.name(), result.errors());
                            break;
                        }
                    }
                } catch (RuntimeException ex) {
                    log.error("Step {} aborted: {}", step.name(), ex.getMessage(), ex);
                    results.add(aborted(step.name(), ex));
                    hasErrors = true;
                    break;
                }
            }

            MigrationSummary summary = MigrationSummary.from(results, hasErrors);
            logSummary(summary);

            if (settings.dropOld() && !settings.dryRun() && !hasErrors) {
                List<String> legacy = selected.stream()
                        .flatMap(step -> step.legacyCollections().stream())
                        .distinct()
                        .toList();
                log.info("Dropping {} legacy collections: {}", legacy.size(), legacy);
                runner.dropCollections(legacy);
            }
            if (settings.report() != null) {
                reportWriter.write(summary, settings.report());
            }
            return summary;
        }
    }

    private static MigrationResult aborted(String step, RuntimeException ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getName();
        return new MigrationResult(step, 0, 0, 0, 0, 0, 0, ResultStatus.FAILED, message);
    }

    private static void logSummary(MigrationSummary summary) {
        for (MigrationResult result : summary.results()) {
            log.info("step={} source={} inserted={} duplicates={} skipped={} errors={} durationMs={} status={}",
                    result.step(), result.sourceCount(), result.insertedCount(), result.skippedDuplicates(),
                    result.skipped(), result.errors(), result.durationMillis(), result.status());
        }
        log.info("Migration totals: source={} inserted={} duplicates={} errors={} durationMs={}",
                summary.totalSource(), summary.totalInserted(), summary.totalSkippedDuplicates(),
                summary.totalErrors(), summary.totalDurationMillis());
        if (summary.hasErrors()) {
            log.warn("Migration completed with errors, check the log above");
        } else {
            log.info("Migration completed successfully");
        }
    }
}
