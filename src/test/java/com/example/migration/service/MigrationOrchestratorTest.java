package com.example.migration.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.migration.model.BatchResult;
import com.example.migration.model.CheckpointStatus;
import com.example.migration.model.MigrationResult;
import com.example.migration.model.MigrationSummary;
import com.example.migration.model.ResultStatus;
import com.example.migration.model.RunSettings;
import com.example.migration.step.MigrationPlan;
import com.example.migration.step.MigrationStep;
import com.example.migration.step.SourceMigrationStep;
import com.example.migration.support.MigrationException;
import com.example.migration.support.MigrationReportWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("MigrationOrchestrator")
class MigrationOrchestratorTest {

    private InMemoryMigrationDatabase database;
    private InMemoryConnectionManager connection;
    private final List<String> executed = new ArrayList<>();

    @BeforeEach
    void setUp() {
        database = new InMemoryMigrationDatabase()
                .seed("users", 30)
                .seed("contactmessages", 20)
                .seed("plants", 10);
        connection = new InMemoryConnectionManager(database);
    }

    private MigrationStep copying(String name, String source) {
        return new SourceMigrationStep(name, source, runner -> {
            executed.add(name);
            return new RecordingProcessor(database, source + "_v2", source);
        });
    }

    private MigrationStep erroring(String name, String source) {
        return new SourceMigrationStep(name, source, runner -> {
            executed.add(name);
            return new RecordingProcessor(database, source + "_v2", source)
                    .reporting(batch -> batch.stream().map(doc -> BatchResult.ERROR).toList());
        });
    }

    private MigrationStep throwing(String name, String source) {
        return new SourceMigrationStep(name, source, runner -> {
            executed.add(name);
            return new RecordingProcessor(database, source + "_v2", source).failOnBatch(1);
        });
    }

    private static MigrationStep reportingFailure(String name, List<String> executed) {
        return new MigrationStep() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<String> legacyCollections() {
                return List.of();
            }

            @Override
            public MigrationResult run(MigrationRunner runner, RunSettings settings) {
                executed.add(name);
                return new MigrationResult(name, 0, 0, 0, 0, 1, 0, ResultStatus.FAILED, null);
            }
        };
    }

    private MigrationOrchestrator orchestrator(MigrationStep... steps) {
        return new MigrationOrchestrator(() -> new MigrationRunner(connection), new MigrationPlan(List.of(steps)),
                new MigrationReportWriter());
    }

    private static RunSettings settings(boolean dryRun, boolean dropOld, String step, Path report) {
        return new RunSettings(8, dryRun, false, dropOld, step, report);
    }

    private static RunSettings resumed(boolean dropOld) {
        return new RunSettings(8, false, true, dropOld, null, null);
    }

    @Nested
    @DisplayName("migrate")
    class Migrate {

        @Test
        @DisplayName("should run every step in order and total the results")
        void shouldRunAllSteps() {
            MigrationSummary summary = orchestrator(
                    copying("usersStep", "users"),
                    copying("messagesStep", "contactmessages"),
                    copying("plantsStep", "plants")).migrate(settings(false, false, null, null));

            assertThat(executed).containsExactly("usersStep", "messagesStep", "plantsStep");
            assertThat(summary.results()).hasSize(3);
            assertThat(summary.totalSource()).isEqualTo(60);
            assertThat(summary.totalInserted()).isEqualTo(60);
            assertThat(summary.hasErrors()).isFalse();
            assertThat(connection.connects()).isEqualTo(1);
            assertThat(connection.isConnected()).isFalse();
        }

        @Test
        @DisplayName("should only run the requested step")
        void shouldRunRequestedStep() {
            orchestrator(copying("usersStep", "users"), copying("messagesStep", "contactmessages"))
                    .migrate(settings(false, false, "messagesStep", null));

            assertThat(executed).containsExactly("messagesStep");
        }

        @Test
        @DisplayName("should reject an unknown step before connecting")
        void shouldRejectUnknownStep() {
            MigrationOrchestrator orchestrator = orchestrator(copying("usersStep", "users"));

            assertThatThrownBy(() -> orchestrator.migrate(settings(false, false, "nopeStep", null)))
                    .isInstanceOf(MigrationException.class);
            assertThat(connection.connects()).isZero();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should stop after a step that reports errors")
        void shouldStopAfterFailedStep() {
            MigrationSummary summary = orchestrator(
                    copying("usersStep", "users"),
                    erroring("messagesStep", "contactmessages"),
                    copying("plantsStep", "plants")).migrate(settings(false, false, null, null));

            assertThat(executed).containsExactly("usersStep", "messagesStep");
            assertThat(summary.hasErrors()).isTrue();
            assertThat(summary.totalErrors()).isEqualTo(20);
            assertThat(database.storedCheckpoint("messagesStep").getStatus()).isEqualTo(CheckpointStatus.COMPLETED);
        }

        @Test
        @DisplayName("should keep going after a failed step in dry-run mode")
        void shouldContinueInDryRun() {
            MigrationSummary summary = orchestrator(
                    reportingFailure("usersStep", executed),
                    copying("plantsStep", "plants")).migrate(settings(true, false, null, null));

            assertThat(executed).containsExactly("usersStep", "plantsStep");
            assertThat(summary.hasErrors()).isTrue();
            assertThat(database.documents("plants_v2")).isEmpty();
        }

        @Test
        @DisplayName("should stop and record a step that throws")
        void shouldStopOnException() {
            MigrationSummary summary = orchestrator(
                    throwing("usersStep", "users"),
                    copying("plantsStep", "plants")).migrate(settings(false, false, null, null));

            assertThat(executed).containsExactly("usersStep");
            assertThat(summary.hasErrors()).isTrue();
            assertThat(summary.results()).singleElement().satisfies(result -> {
                assertThat(result.status()).isEqualTo(ResultStatus.FAILED);
                assertThat(result.error()).isEqualTo("bulk write failed on batch 1");
            });
            assertThat(database.storedCheckpoint("usersStep").getStatus()).isEqualTo(CheckpointStatus.FAILED);
            assertThat(connection.isConnected()).isFalse();
        }
    }

    @Nested
    @DisplayName("drop old collections")
    class DropOld {

        @Test
        @DisplayName("should drop the legacy collections of the steps that ran")
        void shouldDropAfterCleanRun() {
            orchestrator(copying("usersStep", "users"), copying("plantsStep", "plants"))
                    .migrate(settings(false, true, null, null));

            assertThat(database.dropped()).containsExactly("users", "plants");
            assertThat(database.exists("contactmessages")).isTrue();
        }

        @Test
        @DisplayName("should keep the legacy collections when a step failed")
        void shouldKeepAfterFailure() {
            orchestrator(copying("usersStep", "users"), erroring("plantsStep", "plants"))
                    .migrate(settings(false, true, null, null));

            assertThat(database.dropped()).isEmpty();
        }

        @Test
        @DisplayName("should migrate for real before dropping when resuming after a dry run")
        void shouldMigrateBeforeDroppingAfterDryRun() {
            MigrationOrchestrator orchestrator = orchestrator(copying("usersStep", "users"));
            orchestrator.migrate(settings(true, false, null, null));

            MigrationSummary summary = orchestrator.migrate(resumed(true));

            assertThat(summary.hasErrors()).isFalse();
            assertThat(summary.totalInserted()).isEqualTo(30);
            assertThat(database.documents("users_v2")).hasSize(30);
            assertThat(database.dropped()).containsExactly("users");
        }

        @Test
        @DisplayName("should keep the legacy collections when a source read fell short")
        void shouldKeepAfterShortRead() {
            database.limitReadable("users", 20);

            MigrationSummary summary = orchestrator(copying("usersStep", "users"))
                    .migrate(settings(false, true, null, null));

            assertThat(summary.hasErrors()).isTrue();
            assertThat(database.dropped()).isEmpty();
            assertThat(database.exists("users")).isTrue();
        }

        @Test
        @DisplayName("should keep the legacy collections in dry-run mode")
        void shouldKeepInDryRun() {
            orchestrator(copying("usersStep", "users")).migrate(settings(true, true, null, null));

            assertThat(database.dropped()).isEmpty();
        }
    }

    @Test
    @DisplayName("should write the CSV report when asked to")
    void shouldWriteReport(@TempDir Path dir) throws Exception {
        Path report = dir.resolve("reports/summary.csv");

        orchestrator(copying("usersStep", "users")).migrate(settings(false, false, null, report));

        List<String> lines = Files.readAllLines(report);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(1)).startsWith("usersStep,30,30,");
        assertThat(lines.get(2)).startsWith("TOTAL,30,30,");
    }
}
