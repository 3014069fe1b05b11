package com.example.migration.service;

import com.example.migration.support.MigrationException;
import java.util.List;
import org.bson.Document;

/**
 * Pages through a source collection in ascending {@code _id} order, starting strictly after a
 * stored cursor.
 */
class BatchCursor {

    private final MigrationDatabase database;
    private final String collection;
    private final int batchSize;

    private Object lastId;

    BatchCursor(MigrationDatabase database, String collection, Object startAfter, int batchSize) {
        this.database = database;
        this.collection = collection;
        this.lastId = startAfter;
        this.batchSize = batchSize;
    }

    /**
     * Fetches the next page; an empty list means the collection is exhausted.
     */
    List<Document> nextBatch() {
        List<Document> batch = database.findBatchAfter(collection, lastId, batchSize);
        if (!batch.isEmpty()) {
            Object id = batch.get(batch.size() - 1).get("_id");
            if (id == null) {
                throw new MigrationException("Document without _id in source collection %s".formatted(collection));
            }
            lastId = id;
        }
        return batch;
    }

    Object lastId() {
        return lastId;
    }
}
