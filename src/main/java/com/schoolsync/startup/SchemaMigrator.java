package com.schoolsync.startup;

import javax.sql.DataSource;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Brings the mirror schema up to date before any sync logic runs.
 */
@ApplicationScoped
public class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    private final DataSource dataSource;

    @Inject
    public SchemaMigrator(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public int migrate() {
        try {
            log.info("Running Flyway migrations");
            Flyway flyway = Flyway.configure()
                    .dataSource(dataSource)
                    .locations("classpath:db/migration")
                    .baselineOnMigrate(true)
                    .load();
            MigrateResult result = flyway.migrate();
            log.info("Flyway migrations complete ({} applied)", result.migrationsExecuted);
            return result.migrationsExecuted;
        } catch (FlywayException e) {
            log.error("Flyway migration failed", e);
            throw new IllegalStateException("Schema migration failed", e);
        }
    }
}
