package com.example.migration.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mongodb.ConnectionString;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MongoConnectionManagerTest {

    @Test
    @DisplayName("should prefer the configured database name")
    void shouldPreferConfiguredName() {
        assertThat(MongoConnectionManager.resolveDatabaseName(
                new ConnectionString("mongodb://localhost:27017/plantcare"), " legacy ")).isEqualTo("legacy");
    }

    @Test
    @DisplayName("should fall back to the database in the URI")
    void shouldUseUriDatabase() {
        assertThat(MongoConnectionManager.resolveDatabaseName(
                new ConnectionString("mongodb://localhost:27017/plantcare"), "")).isEqualTo("plantcare");
    }

    @Test
    @DisplayName("should use the default database when none is given")
    void shouldUseDefault() {
        MongoConnectionManager manager = new MongoConnectionManager("mongodb://localhost:27017", null, "_migrations");

        assertThat(manager.databaseName()).isEqualTo(MongoConnectionManager.DEFAULT_DATABASE);
        assertThat(manager.isConnected()).isFalse();
        assertThatThrownBy(manager::database).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should ignore a disconnect without a connection")
    void shouldIgnoreDisconnectWhenIdle() {
        MongoConnectionManager manager = new MongoConnectionManager("mongodb://localhost:27017", "db", "_migrations");

        manager.disconnect();

        assertThat(manager.isConnected()).isFalse();
    }
}
