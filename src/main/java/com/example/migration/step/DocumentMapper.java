package com.example.migration.step;

import org.bson.Document;

/**
 * Maps a legacy document to its target shape. Returning {@code null} skips the document; throwing
 * marks it as failed without failing the batch.
 */
@FunctionalInterface
public interface DocumentMapper {

    DocumentMapper COPY = legacy -> {
        Document copy = new Document(legacy);
        copy.remove("_id");
        return copy;
    };

    Document map(Document legacy);
}
