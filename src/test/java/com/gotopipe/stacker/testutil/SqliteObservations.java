package com.gotopipe.stacker.testutil;

import com.gotopipe.stacker.config.StackingConfig;
import com.gotopipe.stacker.model.Observation;
import com.gotopipe.stacker.store.ObservationDataSources;
import com.gotopipe.stacker.store.ObservationSchema;
import com.zaxxer.hikari.HikariDataSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite-backed observation tables for store and end-to-end tests.
 */
public final class SqliteObservations {
    private static final String INSERT = "INSERT INTO " + ObservationSchema.TABLE +
        " (id, telescope, camera, instrument, filter, imagetype, target, exptime, obsdate, iobs, nobs, stage, status, \"set\")" +
        " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private SqliteObservations() {
    }

    public static StackingConfig config(Path dir) throws StackingConfig.MalformedStackingConfigException {
        return StackingConfig.builder()
            .jdbcUrl("jdbc:sqlite:" + dir.resolve("observations.db"))
            .jdbcPoolSize(2)
            .build();
    }

    public static HikariDataSource create(StackingConfig config) throws Exception {
        HikariDataSource dataSource = ObservationDataSources.create(config);
        ObservationDataSources.ensureSchema(dataSource);
        return dataSource;
    }

    public static void insert(HikariDataSource dataSource, List<Observation> observations) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT)) {
            for (Observation o : observations) {
                stmt.setLong(1, o.id());
                stmt.setString(2, o.telescope());
                stmt.setString(3, o.camera());
                stmt.setString(4, o.instrument());
                stmt.setString(5, o.filter());
                stmt.setString(6, o.imagetype());
                stmt.setString(7, o.target());
                stmt.setDouble(8, o.exptime());
                stmt.setString(9, o.obsdate() == null ? null : ObservationSchema.formatObsdate(o.obsdate()));
                stmt.setInt(10, o.iobs());
                stmt.setInt(11, o.nobs());
                stmt.setInt(12, o.stage());
                stmt.setString(13, o.status());
                stmt.setInt(14, o.set());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    public static void execute(HikariDataSource dataSource, String sql) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.executeUpdate();
        }
    }

    /**
     * Rows as {@code [id, stage, status, set]}, ordered by id.
     */
    public static List<Object[]> states(HikariDataSource dataSource, String where) throws SQLException {
        String sql = "SELECT id, stage, status, \"set\" FROM " + ObservationSchema.TABLE +
            (where == null ? "" : " WHERE " + where) + " ORDER BY id";
        List<Object[]> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                rows.add(new Object[]{rs.getLong(1), rs.getInt(2), rs.getString(3), rs.getInt(4)});
            }
        }
        return rows;
    }
}
