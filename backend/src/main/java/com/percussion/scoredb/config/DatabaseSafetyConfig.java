package com.percussion.scoredb.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Startup guard for the score database.
 *
 * Logs the active profiles, ddl-auto, Flyway state and datasource URL. Refuses to start when
 * ddl-auto would drop or recreate the schema outside a "test" profile, or when neither Flyway
 * nor Hibernate is responsible for the schema. An in-memory URL only produces a warning.
 */
@Configuration
public class DatabaseSafetyConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseSafetyConfig.class);

    private final Environment environment;

    @Value("${spring.jpa.hibernate.ddl-auto:none}")
    private String ddlAuto;

    @Value("${spring.flyway.enabled:true}")
    private boolean flywayEnabled;

    @Value("${spring.datasource.url:}")
    private String datasourceUrl;

    public DatabaseSafetyConfig(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void verifySchemaSafety() {
        String activeProfiles = String.join(",", environment.getActiveProfiles());
        String profiles = safeLower(activeProfiles);
        String ddl = safeLower(ddlAuto).replace('_', '-');
        String dsUrl = datasourceUrl == null ? "" : datasourceUrl;

        log.info("[DB_SAFETY] Active profiles='{}', ddl-auto='{}', flyway={}, datasource='{}'",
                activeProfiles, ddlAuto, flywayEnabled, dsUrl);

        boolean isTestProfile = profiles.contains("test");
        boolean dangerous = "create".equals(ddl) || "create-drop".equals(ddl);
        if (dangerous && !isTestProfile) {
            throw new IllegalStateException("ddl-auto=" + ddlAuto + " outside a test profile would wipe ingested scores; aborting startup.");
        }
        boolean unmanaged = !flywayEnabled && ("none".equals(ddl) || "validate".equals(ddl) || ddl.isEmpty());
        if (unmanaged && !isTestProfile) {
            throw new IllegalStateException("Flyway is disabled and ddl-auto='" + ddlAuto + "'; nothing would create the score schema.");
        }

        if (dsUrl.toLowerCase().contains("mem:")) {
            log.warn("[DB_SAFETY] In-memory database detected: ingested score sheets will not survive a restart.");
        }
    }

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase();
    }
}
