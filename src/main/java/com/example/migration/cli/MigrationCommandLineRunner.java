package com.example.migration.cli;

import com.example.migration.model.MigrationSummary;
import com.example.migration.model.RunSettings;
import com.example.migration.service.MigrationOrchestrator;
import com.example.migration.service.MongoConnectionManager;
import com.example.migration.support.MigrationException;
import com.mongodb.ConnectionString;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point. Options: {@code --dry-run}, {@code --resume}, {@code --batch=N},
 * {@code --drop-old}, {@code --step=NAME}, {@code --report=PATH}.
 */
@Slf4j
@Component
public class MigrationCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final DateTimeFormatter BACKUP_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final MigrationOrchestrator orchestrator;
    private final String databaseName;
    private final int defaultBatchSize;

    private int exitCode;

    public MigrationCommandLineRunner(MigrationOrchestrator orchestrator,
            @Value("${app.migration.uri:mongodb://localhost:27017/migration}") String uri,
            @Value("${app.migration.database:}") String databaseName,
            @Value("${app.migration.batch-size:500}") int defaultBatchSize) {
        this.orchestrator = orchestrator;
        this.databaseName = MongoConnectionManager.resolveDatabaseName(new ConnectionString(uri), databaseName);
        this.defaultBatchSize = defaultBatchSize;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunSettings settings = parse(args);
        printBackupReminder();
        MigrationSummary summary = orchestrator.migrate(settings);
        exitCode = summary.hasErrors() ? 1 : 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    RunSettings parse(ApplicationArguments args) {
        String batch = singleValue(args, "batch");
        int batchSize = defaultBatchSize;
        if (batch != null) {
            try {
                batchSize = Integer.parseInt(batch.trim());
            } catch (NumberFormatException ex) {
                throw new MigrationException("Invalid --batch value %s".formatted(batch), ex);
            }
        }
        if (batchSize <= 0) {
            throw new MigrationException("--batch must be positive, got %d".formatted(batchSize));
        }
        String report = singleValue(args, "report");
        return new RunSettings(
                batchSize,
                flag(args, "dry-run"),
                flag(args, "resume"),
                flag(args, "drop-old"),
                singleValue(args, "step"),
                report == null || report.isBlank() ? null : Path.of(report.trim()));
    }

    private void printBackupReminder() {
        String suffix = LocalDateTime.now().format(BACKUP_SUFFIX);
        log.warn("IMPORTANT: back up the database before migrating, e.g. mongodump --db {} --out backup_{}",
                databaseName, suffix);
    }

    private static boolean flag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        List<String> values = args.getOptionValues(name);
        return values.isEmpty() || Boolean.parseBoolean(values.get(values.size() - 1));
    }

    private static String singleValue(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return null;
        }
        List<String> values = args.getOptionValues(name);
        return values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
