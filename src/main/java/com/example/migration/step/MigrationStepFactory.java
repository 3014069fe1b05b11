package com.example.migration.step;

import com.example.migration.config.MigrationStepProperties.StepDefinition;
import com.example.migration.support.MigrationException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class MigrationStepFactory {

    static final String DEFAULT_MAPPER = "copy";

    private final Map<String, DocumentMapper> mappers;

    public MigrationStepFactory(Map<String, DocumentMapper> mappers) {
        this.mappers = Map.copyOf(mappers);
    }

    public List<MigrationStep> createSteps(List<StepDefinition> definitions) {
        List<MigrationStep> steps = new ArrayList<>(definitions.size());
        Set<String> names = new HashSet<>();
        for (StepDefinition definition : definitions) {
            MigrationStep step = createStep(definition);
            if (!names.add(step.name())) {
                throw new MigrationException("Duplicate migration step name %s".formatted(step.name()));
            }
            steps.add(step);
        }
        log.info("Configured {} migration steps: {}", steps.size(), names);
        return steps;
    }

    MigrationStep createStep(StepDefinition definition) {
        String name = requireText(definition.name(), "name", definition);
        String target = requireText(definition.target(), "target", definition);
        List<String> sources = definition.sources() == null ? List.of() : definition.sources();
        if (sources.isEmpty()) {
            throw new MigrationException("Migration step %s has no source collections".formatted(name));
        }
        DocumentMapper mapper = resolveMapper(name, definition.mapper());
        List<String> lookups = lookups(name, definition);

        if (sources.size() == 1) {
            String source = requireText(sources.get(0), "sources", definition);
            String tag = hasText(definition.sourceTag()) ? definition.sourceTag().trim() : source;
            return singleSource(name, source, target, tag, mapper, lookups);
        }

        List<MigrationStep> parts = new ArrayList<>(sources.size());
        for (String source : sources) {
            String collection = requireText(source, "sources", definition);
            parts.add(singleSource(name + "_" + collection, collection, target, collection, mapper, List.of()));
        }
        return new CompositeMigrationStep(name, parts, lookups);
    }

    private static MigrationStep singleSource(String stepName, String source, String target, String tag,
            DocumentMapper mapper, List<String> lookups) {
        return new SourceMigrationStep(stepName, source,
                runner -> new UpsertingDocumentProcessor(runner.collection(target), tag, mapper), lookups);
    }

    private static List<String> lookups(String step, StepDefinition definition) {
        if (definition.lookups() == null) {
            return List.of();
        }
        List<String> lookups = new ArrayList<>(definition.lookups().size());
        for (String lookup : definition.lookups()) {
            String collection = requireText(lookup, "lookups", definition);
            boolean alsoSource = definition.sources().stream()
                    .anyMatch(source -> hasText(source) && collection.equals(source.trim()));
            if (alsoSource) {
                throw new MigrationException("Collection %s of migration step %s cannot be both a source and a lookup"
                        .formatted(collection, step));
            }
            lookups.add(collection);
        }
        return lookups;
    }

    private DocumentMapper resolveMapper(String step, String mapperName) {
        String key = hasText(mapperName) ? mapperName.trim() : DEFAULT_MAPPER;
        DocumentMapper mapper = mappers.get(key);
        if (mapper == null) {
            throw new MigrationException("Unknown document mapper %s for migration step %s".formatted(key, step));
        }
        return mapper;
    }

    private static String requireText(String value, String field, StepDefinition definition) {
        if (!hasText(value)) {
            throw new MigrationException("Migration step definition is missing %s: %s".formatted(field, definition));
        }
        return value.trim();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
