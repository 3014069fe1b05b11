package com.example.migration.service;

@FunctionalInterface
public interface MigrationRunnerFactory {

    /**
     * Creates a new, not yet connected runner for one migration invocation.
     */
    MigrationRunner create();
}
