package com.example.migration.service;

import com.example.migration.model.MigrationCheckpoint;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.springframework.data.mongodb.core.MongoTemplate;

@Slf4j
class MongoMigrationDatabase implements MigrationDatabase {

    private static final String ID_FIELD = "_id";
    private static final String SOURCE_FIELD = "source";

    private final MongoTemplate mongoTemplate;
    private final String checkpointCollection;

    MongoMigrationDatabase(MongoTemplate mongoTemplate, String checkpointCollection) {
        this.mongoTemplate = mongoTemplate;
        this.checkpointCollection = checkpointCollection;
    }

    @Override
    public List<MigrationCheckpoint> findAllCheckpoints() {
        return mongoTemplate.findAll(MigrationCheckpoint.class, checkpointCollection);
    }

    @Override
    public void saveCheckpoint(MigrationCheckpoint checkpoint) {
        mongoTemplate.save(checkpoint, checkpointCollection);
    }

    @Override
    public long countDocuments(String collection) {
        return collection(collection).countDocuments();
    }

    @Override
    public List<Document> findBatchAfter(String collection, Object afterId, int limit) {
        Bson filter = afterId == null ? new Document() : Filters.gt(ID_FIELD, afterId);
        return collection(collection).find(filter)
                .sort(Sorts.ascending(ID_FIELD))
                .limit(limit)
                .into(new ArrayList<>(limit));
    }

    @Override
    public long countBySource(String collection, String sourceTag) {
        return collection(collection).countDocuments(Filters.eq(SOURCE_FIELD, sourceTag));
    }

    @Override
    public void dropCollection(String collection) {
        collection(collection).drop();
    }

    @Override
    public MongoCollection<Document> collection(String name) {
        return mongoTemplate.getCollection(name);
    }
}
