package com.example.airtime_backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Migration strategy for the segment schema. By default the schema history is repaired first so
 * edited migration files do not block startup with a checksum mismatch.
 */
@Configuration
public class FlywayMigrationConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    @Bean
    public FlywayMigrationStrategy segmentSchemaMigrationStrategy(
            @Value("${pipeline.flyway.repair-before-migrate:true}") boolean repairBeforeMigrate) {
        return flyway -> {
            if (repairBeforeMigrate) {
                flyway.repair();
            }
            var result = flyway.migrate();
            LOGGER.info("FLYWAY migrated executed={} target={} repaired={}",
                    result.migrationsExecuted, result.targetSchemaVersion, repairBeforeMigrate);
        };
    }
}
