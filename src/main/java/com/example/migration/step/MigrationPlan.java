package com.example.migration.step;

import com.example.migration.support.MigrationException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The configured steps in the order they run.
 */
public record MigrationPlan(List<MigrationStep> steps) {

    public MigrationPlan {
        steps = List.copyOf(steps);
    }

    /**
     * Returns every step, or only the named one.
     *
     * @throws MigrationException when no step has that name
     */
    public List<MigrationStep> select(String stepName) {
        if (stepName == null || stepName.isBlank()) {
            return steps;
        }
        return steps.stream()
                .filter(step -> step.name().equals(stepName.trim()))
                .findFirst()
                .map(List::of)
                .orElseThrow(() -> new MigrationException("Unknown migration step %s; available steps: %s"
                        .formatted(stepName, stepNames())));
    }

    public List<String> stepNames() {
        return steps.stream().map(MigrationStep::name).collect(Collectors.toList());
    }
}
