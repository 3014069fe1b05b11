package com.example.migration.model;

/**
 * Outcome of one source document, reported by a batch processor in input order.
 */
public enum BatchResult {
    INSERTED,
    DUPLICATE,
    ERROR,
    SKIPPED
}
