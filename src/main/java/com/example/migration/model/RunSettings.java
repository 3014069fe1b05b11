package com.example.migration.model;

import java.nio.file.Path;

/**
 * Options of one migration invocation as given on the command line.
 *
 * @param step only run the step with this name; {@code null} runs every configured step
 * @param report where to write the CSV summary; {@code null} writes none
 */
public record RunSettings(int batchSize, boolean dryRun, boolean resume, boolean dropOld, String step, Path report) {

    public StepOptions optionsFor(String sourceCollection) {
        return new StepOptions(sourceCollection, batchSize, dryRun, resume);
    }
}
