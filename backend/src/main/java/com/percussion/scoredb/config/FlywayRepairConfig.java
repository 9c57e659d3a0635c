package com.percussion.scoredb.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlywayRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayRepairConfig.class);

    @Value("${scoredb.flyway.repair-on-start:false}")
    private boolean repairOnStart;

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> {
            if (repairOnStart) {
                log.info("[DB] Repairing Flyway history before migrating the score schema");
                try {
                    flyway.repair();
                } catch (Exception ex) {
                    log.warn("[DB] Flyway repair failed or not needed: {}", ex.getMessage());
                }
            }
            int applied = flyway.migrate().migrationsExecuted;
            log.info("[DB] Score schema up to date ({} migration(s) applied)", applied);
        };
    }
}
