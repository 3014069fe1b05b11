package com.example.migration.step;

import com.example.migration.model.MigrationResult;
import com.example.migration.model.RunSettings;
import com.example.migration.service.MigrationRunner;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * A step spanning several source collections. Parts run one after another, each with its own
 * checkpoint, and their results are summed.
 */
@Slf4j
public class CompositeMigrationStep implements MigrationStep {

    private final String name;
    private final List<MigrationStep> parts;
    private final List<String> lookupCollections;

    public CompositeMigrationStep(String name, List<MigrationStep> parts) {
        this(name, parts, List.of());
    }

    public CompositeMigrationStep(String name, List<MigrationStep> parts, List<String> lookupCollections) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Composite step %s needs at least one part".formatted(name));
        }
        this.name = name;
        this.parts = List.copyOf(parts);
        this.lookupCollections = List.copyOf(lookupCollections);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> legacyCollections() {
        return Stream.concat(parts.stream().flatMap(part -> part.legacyCollections().stream()),
                        lookupCollections.stream())
                .distinct()
                .toList();
    }

    @Override
    public MigrationResult run(MigrationRunner runner, RunSettings settings) {
        List<MigrationResult> results = new ArrayList<>(parts.size());
        for (MigrationStep part : parts) {
            results.add(part.run(runner, settings));
        }
        MigrationResult combined = MigrationResult.combine(name, results);
        log.info("Composite step {} finished {} parts: source={} inserted={} errors={}",
                name, parts.size(), combined.sourceCount(), combined.insertedCount(), combined.errors());
        return combined;
    }

    List<MigrationStep> parts() {
        return parts;
    }
}
