package com.example.migration.config;

import com.example.migration.service.MigrationRunner;
import com.example.migration.service.MigrationRunnerFactory;
import com.example.migration.service.MongoConnectionManager;
import com.example.migration.step.DocumentMapper;
import com.example.migration.step.MigrationPlan;
import com.example.migration.step.MigrationStepFactory;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class MigrationConfiguration {

    @Bean
    public MigrationRunnerFactory migrationRunnerFactory(
            @Value("${app.migration.uri:mongodb://localhost:27017/migration}") String uri,
            @Value("${app.migration.database:}") String database,
            @Value("${app.migration.checkpoint-collection:_migrations}") String checkpointCollection) {
        log.info("Migration checkpoints are kept in collection={}", checkpointCollection);
        return () -> new MigrationRunner(new MongoConnectionManager(uri, database, checkpointCollection));
    }

    @Bean
    public DocumentMapper copy() {
        return DocumentMapper.COPY;
    }

    @Bean
    public MigrationStepFactory migrationStepFactory(Map<String, DocumentMapper> mappers) {
        return new MigrationStepFactory(mappers);
    }

    @Bean
    public MigrationPlan migrationPlan(MigrationStepFactory factory, MigrationStepProperties properties) {
        return new MigrationPlan(factory.createSteps(properties.steps()));
    }
}
