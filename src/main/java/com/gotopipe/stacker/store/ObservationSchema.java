package com.gotopipe.stacker.store;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Set;

/**
 * Layout of the {@code observations} table and the text encoding of its timestamps.
 */
public final class ObservationSchema {
    public static final String TABLE = "observations";

    /** Columns that may be used as independent (grouping) columns. */
    public static final Set<String> GROUPING_COLUMNS = Set.of("telescope", "camera", "instrument", "imagetype", "target", "filter");

    /** Default independent columns. */
    public static final List<String> DEFAULT_INDEPENDENT_COLUMNS = List.of("telescope", "camera", "instrument");

    /**
     * SQL predicate holding for obsdate text in canonical form: {@code yyyy-MM-dd HH:mm:ss}, or with a non-zero
     * six digit fraction. Only canonical text orders the same as the timestamps it encodes.
     */
    public static final String CANONICAL_OBSDATE = "(substr(obsdate, 11, 1) = ' ' AND (length(obsdate) = 19 OR " +
        "(length(obsdate) = 26 AND substr(obsdate, 20, 1) = '.' AND substr(obsdate, 21, 6) <> '000000')))";

    private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS " + TABLE + " (\n" +
        "  id INTEGER PRIMARY KEY,\n" +
        "  telescope TEXT,\n" +
        "  camera TEXT,\n" +
        "  instrument TEXT,\n" +
        "  filter TEXT,\n" +
        "  imagetype TEXT,\n" +
        "  target TEXT,\n" +
        "  exptime REAL,\n" +
        "  obsdate TEXT CHECK (obsdate IS NULL OR " + CANONICAL_OBSDATE + "),\n" +
        "  iobs INT,\n" +
        "  nobs INT,\n" +
        "  stage INT DEFAULT 0,\n" +
        "  status TEXT DEFAULT 'unknown',\n" +
        "  \"set\" INT DEFAULT 0\n" +
        ")";

    private static final String CREATE_INDEX = "CREATE INDEX IF NOT EXISTS idx_" + TABLE + "_obsdate ON " + TABLE + " (obsdate)";

    private static final String COUNT_NON_CANONICAL = "SELECT COUNT(*) FROM " + TABLE +
        " WHERE obsdate IS NOT NULL AND NOT " + CANONICAL_OBSDATE;

    // timestamps are stored as "2018-09-09 19:35:30", or "2018-09-09 19:35:30.500000" when there is a fraction
    private static final DateTimeFormatter OBSDATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter OBSDATE_FORMAT_MICROS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    private ObservationSchema() {
    }

    public static void createTable(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate(CREATE_TABLE);
            statement.executeUpdate(CREATE_INDEX);
        }
    }

    public static int countNonCanonicalObsdates(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(COUNT_NON_CANONICAL)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /**
     * Parses stored obsdate text. Only the forms written by {@link #formatObsdate} are accepted.
     *
     * @throws DateTimeParseException if the text is not in canonical form
     */
    public static LocalDateTime parseObsdate(String text) {
        LocalDateTime obsdate = LocalDateTime.parse(text, text.length() == 19 ? OBSDATE_FORMAT : OBSDATE_FORMAT_MICROS);
        if (!formatObsdate(obsdate).equals(text)) {
            throw new DateTimeParseException("obsdate is not in canonical form: " + text, text, 0);
        }
        return obsdate;
    }

    public static String formatObsdate(LocalDateTime obsdate) {
        return obsdate.getNano() == 0 ? OBSDATE_FORMAT.format(obsdate) : OBSDATE_FORMAT_MICROS.format(obsdate);
    }
}
