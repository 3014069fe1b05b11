package com.example.migration.step;

import com.example.migration.model.BatchResult;
import com.example.migration.service.BatchProcessor;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.bulk.BulkWriteResult;
import com.mongodb.bulk.BulkWriteUpsert;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.BulkWriteOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOneModel;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.WriteModel;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

/**
 * Writes mapped documents into a target collection keyed by {@code (source, sourceId)}, so replaying
 * a batch after a crash updates the documents it already wrote instead of duplicating them.
 */
@Slf4j
public class UpsertingDocumentProcessor implements BatchProcessor {

    static final int DUPLICATE_KEY_ERROR_CODE = 11000;
    static final String SOURCE_FIELD = "source";
    static final String SOURCE_ID_FIELD = "sourceId";
    static final String MIGRATED_AT_FIELD = "migratedAt";

    private final MongoCollection<Document> target;
    private final String sourceTag;
    private final DocumentMapper mapper;
    private final BulkWriteOptions writeOptions;

    public UpsertingDocumentProcessor(MongoCollection<Document> target, String sourceTag, DocumentMapper mapper) {
        this.target = target;
        this.sourceTag = sourceTag;
        this.mapper = mapper;
        this.writeOptions = new BulkWriteOptions().ordered(false);
    }

    @Override
    public List<BatchResult> process(List<Document> batch, boolean dryRun) {
        BatchResult[] results = new BatchResult[batch.size()];
        List<WriteModel<Document>> writes = new ArrayList<>(batch.size());
        List<Integer> positions = new ArrayList<>(batch.size());

        for (int i = 0; i < batch.size(); i++) {
            Document legacy = batch.get(i);
            Document mapped;
            try {
                mapped = mapper.map(legacy);
            } catch (RuntimeException ex) {
                log.warn("Failed to map {} document {}: {}", sourceTag, legacy.get("_id"), ex.getMessage());
                results[i] = BatchResult.ERROR;
                continue;
            }
            if (mapped == null) {
                results[i] = BatchResult.SKIPPED;
                continue;
            }
            results[i] = BatchResult.INSERTED;
            writes.add(toWriteModel(legacy.get("_id"), mapped));
            positions.add(i);
        }

        if (!dryRun && !writes.isEmpty()) {
            applyWrites(writes, positions, results);
        }
        return Arrays.asList(results);
    }

    private WriteModel<Document> toWriteModel(Object sourceId, Document mapped) {
        Document replacement = new Document(mapped);
        replacement.put(SOURCE_FIELD, sourceTag);
        replacement.put(SOURCE_ID_FIELD, sourceId);
        replacement.put(MIGRATED_AT_FIELD, Date.from(Instant.now()));
        return new ReplaceOneModel<>(
                Filters.and(Filters.eq(SOURCE_FIELD, sourceTag), Filters.eq(SOURCE_ID_FIELD, sourceId)),
                replacement,
                new ReplaceOptions().upsert(true));
    }

    private void applyWrites(List<WriteModel<Document>> writes, List<Integer> positions, BatchResult[] results) {
        try {
            BulkWriteResult result = target.bulkWrite(writes, writeOptions);
            markOutcomes(result, positions, results, Set.of());
        } catch (MongoBulkWriteException ex) {
            if (ex.getWriteConcernError() != null) {
                throw ex;
            }
            Set<Integer> failed = new HashSet<>();
            for (BulkWriteError error : ex.getWriteErrors()) {
                failed.add(error.getIndex());
                int position = positions.get(error.getIndex());
                if (error.getCode() == DUPLICATE_KEY_ERROR_CODE) {
                    results[position] = BatchResult.DUPLICATE;
                } else {
                    log.warn("Failed to write {} document at batch position {}: code={} message={}",
                            sourceTag, position, error.getCode(), error.getMessage());
                    results[position] = BatchResult.ERROR;
                }
            }
            if (ex.getWriteResult() != null) {
                markOutcomes(ex.getWriteResult(), positions, results, failed);
            }
        }
    }

    private static void markOutcomes(BulkWriteResult result, List<Integer> positions, BatchResult[] results,
            Set<Integer> failed) {
        if (!result.wasAcknowledged()) {
            return;
        }
        Set<Integer> upserted = result.getUpserts().stream()
                .map(BulkWriteUpsert::getIndex)
                .collect(Collectors.toSet());
        for (int write = 0; write < positions.size(); write++) {
            if (failed.contains(write)) {
                continue;
            }
            results[positions.get(write)] = upserted.contains(write) ? BatchResult.INSERTED : BatchResult.DUPLICATE;
        }
    }
}
