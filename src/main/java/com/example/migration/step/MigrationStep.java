package com.example.migration.step;

import com.example.migration.model.MigrationResult;
import com.example.migration.model.RunSettings;
import com.example.migration.service.MigrationRunner;
import java.util.List;

public interface MigrationStep {

    String name();

    /**
     * Collections this step reads from; dropped after a clean run with {@code --drop-old}.
     */
    List<String> legacyCollections();

    MigrationResult run(MigrationRunner runner, RunSettings settings);
}
