package com.gotopipe.stacker.store;

import com.gotopipe.stacker.model.GroupingKey;
import com.gotopipe.stacker.model.Observation;
import com.gotopipe.stacker.model.ObservationUpdate;
import com.gotopipe.stacker.model.StackGroupUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Observation store backed by a JDBC data source holding the {@code observations} table.
 */
public class JdbcObservationStore implements ObservationStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcObservationStore.class);

    private static final String SELECT_COLUMNS = "id, telescope, camera, instrument, imagetype, target, filter, exptime, " +
        "obsdate, iobs, nobs, stage, status, \"set\"";

    private static final String ANCHOR_EARLIEST = "SELECT obsdate FROM " + ObservationSchema.TABLE +
        " WHERE status = 'completed' AND stage = 3 AND obsdate >= ? AND " + ObservationSchema.CANONICAL_OBSDATE +
        " ORDER BY obsdate ASC LIMIT 1";
    private static final String ANCHOR_LATEST = "SELECT obsdate FROM " + ObservationSchema.TABLE +
        " WHERE status = 'completed' AND stage = 3 AND obsdate <= ? AND " + ObservationSchema.CANONICAL_OBSDATE +
        " ORDER BY obsdate DESC LIMIT 1";

    private static final String UPDATE_OBSERVATION = "UPDATE " + ObservationSchema.TABLE +
        " SET stage = ?, status = ?, \"set\" = ? WHERE id = ? AND stage = ?";

    private final DataSource dataSource;

    public JdbcObservationStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<GroupingKey> listGroupingKeys(List<String> columns) throws ObservationStoreException {
        validateColumns(columns);
        String columnList = String.join(", ", columns);
        String sql = "SELECT DISTINCT " + columnList + " FROM " + ObservationSchema.TABLE + " ORDER BY " + columnList;

        List<GroupingKey> keys = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                List<String> values = new ArrayList<>(columns.size());
                for (int i = 1; i <= columns.size(); i++) {
                    values.add(rs.getString(i));
                }
                keys.add(new GroupingKey(columns, values));
            }
        } catch (SQLException e) {
            LOGGER.error("store_error: failed to list grouping keys for columns={}", columns, e);
            throw new ObservationStoreException("failed to list grouping keys: " + e.getMessage(), e);
        }
        LOGGER.debug("found {} partitions for columns={}", keys.size(), columns);
        return keys;
    }

    @Override
    public List<Observation> query(GroupingKey key, LocalDateTime from, LocalDateTime to) throws ObservationStoreException {
        validateColumns(key.getColumns());
        StringBuilder sql = new StringBuilder("SELECT ").append(SELECT_COLUMNS)
            .append(" FROM ").append(ObservationSchema.TABLE).append(" WHERE ");
        List<Object> args = new ArrayList<>();
        appendKeyPredicate(sql, args, key);
        if (from != null) {
            sql.append(" AND obsdate >= ?");
            args.add(ObservationSchema.formatObsdate(from));
        }
        if (to != null) {
            sql.append(" AND obsdate <= ?");
            args.add(ObservationSchema.formatObsdate(to));
        }
        sql.append(" ORDER BY obsdate, id");

        List<Observation> observations = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            bind(stmt, args);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    observations.add(readObservation(rs));
                }
            }
        } catch (SQLException e) {
            LOGGER.error("store_error: failed to query partition={}", key, e);
            throw new ObservationStoreException("failed to query partition " + key + ": " + e.getMessage(), e);
        }
        return observations;
    }

    @Override
    public Optional<LocalDateTime> resolveAnchor(AnchorDirection direction, LocalDateTime bound) throws ObservationStoreException {
        String sql = direction == AnchorDirection.EARLIEST ? ANCHOR_EARLIEST : ANCHOR_LATEST;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, ObservationSchema.formatObsdate(bound));
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    String anchor = rs.getString(1);
                    try {
                        return Optional.of(ObservationSchema.parseObsdate(anchor));
                    } catch (DateTimeParseException e) {
                        throw new ObservationStoreException("undecodable " + direction + " anchor obsdate '" + anchor + "'", e);
                    }
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            LOGGER.error("store_error: failed to resolve {} anchor for bound={}", direction, bound, e);
            throw new ObservationStoreException("failed to resolve anchor: " + e.getMessage(), e);
        }
    }

    @Override
    public int maxSetId(GroupingKey key) throws ObservationStoreException {
        validateColumns(key.getColumns());
        StringBuilder sql = new StringBuilder("SELECT COALESCE(MAX(\"set\"), 0) FROM ")
            .append(ObservationSchema.TABLE).append(" WHERE ");
        List<Object> args = new ArrayList<>();
        appendKeyPredicate(sql, args, key);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            bind(stmt, args);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            LOGGER.error("store_error: failed to read max set for partition={}", key, e);
            throw new ObservationStoreException("failed to read max set for " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void applyUpdates(StackGroupUpdate group) throws ObservationStoreException {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_OBSERVATION)) {
                for (ObservationUpdate update : group.getUpdates()) {
                    stmt.setInt(1, update.stage());
                    stmt.setString(2, update.status());
                    stmt.setInt(3, update.set());
                    stmt.setLong(4, update.id());
                    stmt.setInt(5, update.expectedStage());
                    if (stmt.executeUpdate() != 1) {
                        conn.rollback();
                        LOGGER.warn("store_conflict: rolled back {}, observation {} left stage {}", group, update.id(), update.expectedStage());
                        throw new ConcurrentObservationUpdateException(update.id(), update.expectedStage());
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            LOGGER.error("store_error: failed to apply {}", group, e);
            throw new ObservationStoreException("failed to apply " + group + ": " + e.getMessage(), e);
        }
        LOGGER.debug("applied {}", group);
    }

    private static void appendKeyPredicate(StringBuilder sql, List<Object> args, GroupingKey key) {
        List<String> columns = key.getColumns();
        List<String> values = key.getValues();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sql.append(" AND ");
            }
            if (values.get(i) == null) {
                sql.append(columns.get(i)).append(" IS NULL");
            } else {
                sql.append(columns.get(i)).append(" = ?");
                args.add(values.get(i));
            }
        }
    }

    private static void bind(PreparedStatement stmt, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            stmt.setObject(i + 1, args.get(i));
        }
    }

    private static Observation readObservation(ResultSet rs) throws SQLException, MalformedObservationException {
        long id = rs.getLong("id");
        String obsdateText = rs.getString("obsdate");
        LocalDateTime obsdate = null;
        if (obsdateText != null) {
            try {
                obsdate = ObservationSchema.parseObsdate(obsdateText);
            } catch (DateTimeParseException e) {
                throw new MalformedObservationException(id, "obsdate '" + obsdateText + "' is not in canonical form", e);
            }
        }
        return new Observation(
            id,
            rs.getString("telescope"),
            rs.getString("camera"),
            rs.getString("instrument"),
            rs.getString("imagetype"),
            rs.getString("target"),
            rs.getString("filter"),
            rs.getDouble("exptime"),
            obsdate,
            rs.getInt("iobs"),
            rs.getInt("nobs"),
            rs.getInt("stage"),
            rs.getString("status"),
            rs.getInt("set"));
    }

    // column names are interpolated into SQL, so only known columns are accepted
    private static void validateColumns(List<String> columns) throws ObservationStoreException {
        if (columns == null || columns.isEmpty()) {
            throw new ObservationStoreException("no grouping columns given");
        }
        for (String column : columns) {
            if (!ObservationSchema.GROUPING_COLUMNS.contains(column)) {
                throw new ObservationStoreException("unsupported grouping column: " + column);
            }
        }
    }
}
