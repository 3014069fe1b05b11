package com.example.migration.service;

import com.example.migration.model.BatchResult;
import java.util.List;
import org.bson.Document;

/**
 * Transforms and writes one batch of source documents.
 *
 * <p>Returns one result per input document, in input order. Per-document failures are reported as
 * {@link BatchResult#ERROR}; throwing fails the whole batch and the step. In dry-run mode nothing
 * may be written. Writes must be idempotent, since a batch is replayed when the process dies
 * between processing it and saving its checkpoint.
 */
@FunctionalInterface
public interface BatchProcessor {
    List<BatchResult> process(List<Document> batch, boolean dryRun);
}
