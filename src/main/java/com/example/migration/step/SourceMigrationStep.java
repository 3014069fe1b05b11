package com.example.migration.step;

import com.example.migration.model.MigrationResult;
import com.example.migration.model.RunSettings;
import com.example.migration.service.BatchProcessor;
import com.example.migration.service.MigrationRunner;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * A step reading a single source collection. Lookup collections are only read by the processor and
 * count as legacy data of the step.
 */
public class SourceMigrationStep implements MigrationStep {

    private final String name;
    private final String sourceCollection;
    private final Function<MigrationRunner, BatchProcessor> processorFactory;
    private final List<String> lookupCollections;

    public SourceMigrationStep(String name, String sourceCollection,
            Function<MigrationRunner, BatchProcessor> processorFactory) {
        this(name, sourceCollection, processorFactory, List.of());
    }

    public SourceMigrationStep(String name, String sourceCollection,
            Function<MigrationRunner, BatchProcessor> processorFactory, List<String> lookupCollections) {
        this.name = Objects.requireNonNull(name, "name");
        this.sourceCollection = Objects.requireNonNull(sourceCollection, "sourceCollection");
        this.processorFactory = Objects.requireNonNull(processorFactory, "processorFactory");
        this.lookupCollections = List.copyOf(lookupCollections);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> legacyCollections() {
        return Stream.concat(Stream.of(sourceCollection), lookupCollections.stream())
                .distinct()
                .toList();
    }

    @Override
    public MigrationResult run(MigrationRunner runner, RunSettings settings) {
        BatchProcessor processor = processorFactory.apply(runner);
        return runner.runStep(name, processor, settings.optionsFor(sourceCollection));
    }
}
