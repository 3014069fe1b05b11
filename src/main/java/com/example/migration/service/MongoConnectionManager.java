package com.example.migration.service;

import com.mongodb.ConnectionString;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;

@Slf4j
public class MongoConnectionManager implements ConnectionManager {

    static final String DEFAULT_DATABASE = "migration";

    private final ConnectionString connectionString;
    private final String databaseName;
    private final String checkpointCollection;

    private MongoClient client;
    private MigrationDatabase database;

    public MongoConnectionManager(String uri, String databaseName, String checkpointCollection) {
        this.connectionString = new ConnectionString(uri);
        this.databaseName = resolveDatabaseName(connectionString, databaseName);
        this.checkpointCollection = checkpointCollection;
    }

    @Override
    public void connect() {
        if (client != null) {
            return;
        }
        MongoClient created = MongoClients.create(connectionString);
        try {
            created.getDatabase(databaseName).runCommand(new Document("ping", 1));
        } catch (RuntimeException ex) {
            created.close();
            throw ex;
        }
        client = created;
        database = new MongoMigrationDatabase(new MongoTemplate(created, databaseName), checkpointCollection);
        log.info("Connected to MongoDB database={} hosts={}", databaseName, connectionString.getHosts());
    }

    @Override
    public void disconnect() {
        if (client == null) {
            return;
        }
        client.close();
        client = null;
        database = null;
        log.info("Disconnected from MongoDB database={}", databaseName);
    }

    @Override
    public boolean isConnected() {
        return client != null;
    }

    @Override
    public MigrationDatabase database() {
        if (database == null) {
            throw new IllegalStateException("Not connected to MongoDB; call connect() first");
        }
        return database;
    }

    public String databaseName() {
        return databaseName;
    }

    public static String resolveDatabaseName(ConnectionString connectionString, String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        String fromUri = connectionString.getDatabase();
        return fromUri != null && !fromUri.isBlank() ? fromUri : DEFAULT_DATABASE;
    }
}
