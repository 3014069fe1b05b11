package com.example.migration.service;

import com.example.migration.model.MigrationCheckpoint;
import com.mongodb.client.MongoCollection;
import java.util.List;
import org.bson.Document;

/**
 * The database operations a {@link MigrationRunner} needs. Everything else is left to batch
 * processors, which write target collections directly.
 */
public interface MigrationDatabase {

    List<MigrationCheckpoint> findAllCheckpoints();

    /**
     * Replaces the stored checkpoint with the same id, inserting it if absent.
     */
    void saveCheckpoint(MigrationCheckpoint checkpoint);

    long countDocuments(String collection);

    /**
     * Returns up to {@code limit} documents whose {@code _id} is strictly greater than
     * {@code afterId}, in ascending {@code _id} order. A {@code null} {@code afterId} starts from the
     * first document.
     */
    List<Document> findBatchAfter(String collection, Object afterId, int limit);

    long countBySource(String collection, String sourceTag);

    void dropCollection(String collection);

    MongoCollection<Document> collection(String name);
}
