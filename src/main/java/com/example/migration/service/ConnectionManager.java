package com.example.migration.service;

public interface ConnectionManager extends AutoCloseable {

    void connect();

    void disconnect();

    boolean isConnected();

    /**
     * @throws IllegalStateException when not connected
     */
    MigrationDatabase database();

    @Override
    default void close() {
        disconnect();
    }
}
