package com.gotopipe.stacker.tool;

import com.gotopipe.stacker.Const;
import com.gotopipe.stacker.config.StackingConfig;
import com.gotopipe.stacker.model.Observation;
import com.gotopipe.stacker.model.Stage;
import com.gotopipe.stacker.testutil.SqliteObservations;
import com.zaxxer.hikari.HikariDataSource;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.gotopipe.stacker.testutil.ObservationFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class StackingToolTest {
    @TempDir
    Path tempDir;

    private HikariDataSource dataSource;
    private JsonObject config;
    private ByteArrayOutputStream output;
    private StackingTool tool;

    @BeforeEach
    public void setup() throws Exception {
        String jdbcUrl = "jdbc:sqlite:" + tempDir.resolve("observations.db");
        config = new JsonObject()
            .put(Const.Config.IndependentColumnsProp, new JsonArray().add("telescope").add("camera").add("instrument"))
            .put(Const.Config.JdbcUrlProp, jdbcUrl)
            .put(Const.Config.JdbcPoolSizeProp, 1)
            .put(Const.Config.FromDateProp, "2018-09-09 00:00:00")
            .put(Const.Config.ToDateProp, "2018-09-10 12:00:00");

        dataSource = SqliteObservations.create(StackingConfig.fromJson(config));
        List<Observation> night = new ArrayList<>(sequence(1, START, "Field23", "L", 60, 6));
        night.add(observation().id(7).target("Field24").obsdate(START.plusHours(1)).build());
        SqliteObservations.insert(dataSource, night);

        output = new ByteArrayOutputStream();
        tool = new StackingTool(config, new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    public void teardown() {
        dataSource.close();
    }

    @Test
    public void testRun_promotesStacksAndLeavesFinalBurst() throws Exception {
        assertEquals(0, tool.run(new String[]{"run"}));

        JsonObject result = new JsonObject(printed());
        assertEquals(2, result.getInteger("stacks_promoted"));
        assertEquals(6, result.getInteger("observations_promoted"));
        assertNull(result.getJsonArray("partitions"));

        List<Object[]> rows = SqliteObservations.states(dataSource, null);
        assertEquals(1, rows.get(0)[3]);
        assertEquals(1, rows.get(3)[3]);
        assertEquals(2, rows.get(4)[3]);
        assertEquals(Stage.STACKING, rows.get(5)[1]);
        assertEquals(Stage.REDUCTION_3, rows.get(6)[1]);
    }

    @Test
    public void testRun_streamClosedPassesFinalExposureThrough() throws Exception {
        assertEquals(0, tool.run(new String[]{"run", "--stream-closed", "--verbose"}));

        JsonObject result = new JsonObject(printed());
        assertEquals(1, result.getInteger("observations_passed_through"));
        assertEquals(1, result.getJsonArray("partitions").size());

        Object[] last = SqliteObservations.states(dataSource, "id = 7").get(0);
        assertEquals(Stage.STACKING, last[1]);
        assertEquals(Stage.STATUS_NOT_PROCESSED, last[2]);
    }

    @Test
    public void testRun_windowOverrideExcludesEverything() throws Exception {
        assertEquals(0, tool.run(new String[]{"run", "--from", "2019-01-01 00:00:00", "--to", "2019-01-02 00:00:00"}));

        assertEquals(0, new JsonObject(printed()).getInteger("stacks_promoted"));
        assertTrue(SqliteObservations.states(dataSource, "stage = 4").isEmpty());
    }

    @Test
    public void testRun_rejectedPartitionFailsExitCode() throws Exception {
        SqliteObservations.execute(dataSource, "UPDATE observations SET iobs = 9 WHERE id = 2");

        assertEquals(1, tool.run(new String[]{"run"}));
        assertEquals(1, new JsonObject(printed()).getInteger("partitions_failed"));
        assertTrue(SqliteObservations.states(dataSource, "stage = 4").isEmpty());
    }

    @Test
    public void testDump_listsBurstsWithoutChangingAnything() throws Exception {
        assertEquals(0, tool.run(new String[]{"dump", "-v"}));

        String printed = printed();
        assertTrue(printed.contains("7 records, 2 bursts, max set 0"), printed);
        assertTrue(printed.contains("burst 0: 6 x SCIENCE Field23 L 60.0s from 2018-09-09 19:35:30"), printed);
        assertTrue(printed.contains("id=7 obsdate=2018-09-09 20:35:30"), printed);
        assertTrue(SqliteObservations.states(dataSource, "stage = 4").isEmpty());
    }

    @Test
    public void testUnknownCommand() throws Exception {
        assertEquals(2, tool.run(new String[]{"stack-everything"}));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
