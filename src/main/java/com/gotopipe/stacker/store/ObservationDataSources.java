package com.gotopipe.stacker.store;

import com.gotopipe.stacker.config.StackingConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Creates the pooled data source for the observation database.
 */
public final class ObservationDataSources {
    private static final Logger LOGGER = LoggerFactory.getLogger(ObservationDataSources.class);

    private ObservationDataSources() {
    }

    public static HikariDataSource create(StackingConfig config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.getJdbcUrl());
        hikariConfig.setMaximumPoolSize(config.getJdbcPoolSize());
        hikariConfig.setMinimumIdle(Math.min(1, config.getJdbcPoolSize()));
        hikariConfig.setPoolName("observations-" + sanitizeUrl(config.getJdbcUrl()).replaceAll("[^a-zA-Z0-9_]", "_"));
        // pool starts even if the database is not reachable yet; the first run reports the failure
        hikariConfig.setInitializationFailTimeout(-1);

        HikariDataSource dataSource = new HikariDataSource(hikariConfig);
        LOGGER.info("created observation data source: url={}, maxPoolSize={}", sanitizeUrl(config.getJdbcUrl()), config.getJdbcPoolSize());
        return dataSource;
    }

    /**
     * Creates the observations table if it does not exist yet and reports rows whose obsdate text is not canonical.
     */
    public static void ensureSchema(HikariDataSource dataSource) throws ObservationStoreException {
        try (Connection conn = dataSource.getConnection()) {
            ObservationSchema.createTable(conn);
            int nonCanonical = ObservationSchema.countNonCanonicalObsdates(conn);
            if (nonCanonical > 0) {
                LOGGER.warn("store_warning: {} observations have obsdate text not in 'yyyy-MM-dd HH:mm:ss[.SSSSSS]' form, " +
                    "they are never used as anchors and their partitions are rejected when read", nonCanonical);
            }
        } catch (SQLException e) {
            LOGGER.error("store_error: failed to create observations table", e);
            throw new ObservationStoreException("failed to create observations table: " + e.getMessage(), e);
        }
    }

    static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }
}
