package com.example.migration.support;

import com.example.migration.model.MigrationResult;
import com.example.migration.model.MigrationSummary;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class MigrationReportWriter {

    private static final String[] HEADERS = {
        "step", "sourceCount", "insertedCount", "skippedDuplicates", "skipped", "errors", "durationMillis",
        "status", "error"
    };
    private static final String TOTAL_ROW = "TOTAL";

    public void write(MigrationSummary summary, Path report) {
        try {
            Path parent = report.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(report)) {
                write(summary, out);
            }
            log.info("Wrote migration report for {} steps to {}", summary.results().size(), report);
        } catch (IOException ex) {
            throw new MigrationException("Failed to write migration report %s".formatted(report), ex);
        }
    }

    public void write(MigrationSummary summary, OutputStream outputStream) {
        CsvWriterSettings settings = new CsvWriterSettings();
        settings.setNullValue("");

        CsvWriter csvWriter = new CsvWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), settings);
        csvWriter.writeHeaders(HEADERS);
        for (MigrationResult result : summary.results()) {
            csvWriter.writeRow(
                    result.step(),
                    result.sourceCount(),
                    result.insertedCount(),
                    result.skippedDuplicates(),
                    result.skipped(),
                    result.errors(),
                    result.durationMillis(),
                    result.status(),
                    result.error());
        }
        csvWriter.writeRow(
                TOTAL_ROW,
                summary.totalSource(),
                summary.totalInserted(),
                summary.totalSkippedDuplicates(),
                null,
                summary.totalErrors(),
                summary.totalDurationMillis(),
                summary.hasErrors() ? "FAILED" : "SUCCESS",
                null);
        csvWriter.flush();
    }
}
