package com.example.migration.service;

import com.example.migration.model.BatchResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import org.bson.Document;

/**
 * Copies each document into a target collection of an {@link InMemoryMigrationDatabase}, keyed by
 * the source id, and records the batches it saw.
 */
public class RecordingProcessor implements BatchProcessor {

    private final InMemoryMigrationDatabase database;
    private final String target;
    private final String sourceTag;
    private final List<List<Object>> batchIds = new ArrayList<>();

    private int failOnBatch = -1;
    private Function<List<Document>, List<BatchResult>> outcomes =
            batch -> new ArrayList<>(Collections.nCopies(batch.size(), BatchResult.INSERTED));

    public RecordingProcessor(InMemoryMigrationDatabase database, String target, String sourceTag) {
        this.database = database;
        this.target = target;
        this.sourceTag = sourceTag;
    }

    public RecordingProcessor failOnBatch(int invocation) {
        this.failOnBatch = invocation;
        return this;
    }

    public RecordingProcessor reporting(Function<List<Document>, List<BatchResult>> outcomes) {
        this.outcomes = outcomes;
        return this;
    }

    @Override
    public List<BatchResult> process(List<Document> batch, boolean dryRun) {
        batchIds.add(batch.stream().map(doc -> doc.get("_id")).toList());
        if (batchIds.size() == failOnBatch) {
            throw new IllegalStateException("bulk write failed on batch " + failOnBatch);
        }
        if (!dryRun) {
            for (Document doc : batch) {
                database.insert(target, new Document("_id", doc.get("_id")).append("source", sourceTag));
            }
        }
        return outcomes.apply(batch);
    }

    public int invocations() {
        return batchIds.size();
    }

    public List<Integer> batchSizes() {
        return batchIds.stream().map(List::size).toList();
    }

    public Object firstIdOfBatch(int index) {
        return batchIds.get(index).get(0);
    }

    public void reset() {
        batchIds.clear();
        failOnBatch = -1;
    }
}
