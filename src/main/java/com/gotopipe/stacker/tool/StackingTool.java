package com.gotopipe.stacker.tool;

import com.gotopipe.stacker.Const;
import com.gotopipe.stacker.Main;
import com.gotopipe.stacker.batch.RunOptions;
import com.gotopipe.stacker.batch.StackingOrchestrator;
import com.gotopipe.stacker.batch.StackingResult;
import com.gotopipe.stacker.config.StackingConfig;
import com.gotopipe.stacker.model.GroupingKey;
import com.gotopipe.stacker.model.Observation;
import com.gotopipe.stacker.reader.DateWindow;
import com.gotopipe.stacker.reader.PartitionIntegrityException;
import com.gotopipe.stacker.reader.WindowReadResult;
import com.gotopipe.stacker.reader.WindowReader;
import com.gotopipe.stacker.segment.Burst;
import com.gotopipe.stacker.segment.SequenceSegmenter;
import com.gotopipe.stacker.store.JdbcObservationStore;
import com.gotopipe.stacker.store.ObservationDataSources;
import com.gotopipe.stacker.store.ObservationSchema;
import com.gotopipe.stacker.store.ObservationStore;
import com.zaxxer.hikari.HikariDataSource;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.cli.Argument;
import io.vertx.core.cli.CLI;
import io.vertx.core.cli.CommandLine;
import io.vertx.core.cli.Option;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Command-line access to the stacker without starting the HTTP service.
 *
 * <ul>
 *   <li>{@code run} performs one stacking run and prints the result</li>
 *   <li>{@code dump} prints every partition's bursts in the window without changing anything</li>
 * </ul>
 */
public class StackingTool {
    private static final Logger LOGGER = LoggerFactory.getLogger(StackingTool.class);

    private static final Set<String> SUPPORTED_COMMANDS = Set.of("run", "dump");

    private final JsonObject config;
    private final PrintStream out;
    private boolean isVerbose = false;

    StackingTool(JsonObject config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        VertxOptions options = new VertxOptions()
            .setBlockedThreadCheckInterval(60 * 60 * 1000);
        Vertx vertx = Vertx.vertx(options);
        final String vertxConfigPath = System.getProperty(Const.Config.VERTX_CONFIG_PATH_PROP);
        if (vertxConfigPath != null) {
            System.out.format("Running CUSTOM CONFIG mode, config: %s\n", vertxConfigPath);
        } else {
            System.out.format("Running LOCAL mode, config: %s\n", Const.Config.LOCAL_CONFIG_PATH);
            System.setProperty(Const.Config.VERTX_CONFIG_PATH_PROP, Const.Config.LOCAL_CONFIG_PATH);
        }

        Main.createConfigRetriever(vertx).getConfig(ar -> {
            if (ar.failed()) {
                System.err.println("Unable to read config: " + ar.cause().getMessage());
                vertx.close();
                System.exit(1);
                return;
            }
            StackingTool tool = new StackingTool(ar.result(), System.out);
            int exitCode = 0;
            try {
                exitCode = tool.run(args);
            } catch (Exception e) {
                LOGGER.error("stacking tool failed: {}", e.getMessage(), e);
                exitCode = 1;
            } finally {
                vertx.close();
            }
            System.exit(exitCode);
        });
    }

    /**
     * @return process exit code
     */
    int run(String[] args) throws Exception {
        CommandLine cli = parseArgs(args);
        this.isVerbose = cli.isFlagEnabled("verbose");
        if (this.isVerbose) {
            LOGGER.info("VERBOSE on");
        }

        String command = cli.getArgumentValue("command");
        if (!SUPPORTED_COMMANDS.contains(command)) {
            System.err.println("Unknown command: " + command);
            return 2;
        }

        StackingConfig stackingConfig = StackingConfig.fromJson(withBoundOverrides(cli));
        try (HikariDataSource dataSource = ObservationDataSources.create(stackingConfig)) {
            ObservationDataSources.ensureSchema(dataSource);
            ObservationStore store = new JdbcObservationStore(dataSource);
            if ("run".equals(command)) {
                return runStacking(stackingConfig, store, cli.isFlagEnabled("stream-closed"));
            }
            runDump(stackingConfig, store);
            return 0;
        }
    }

    JsonObject withBoundOverrides(CommandLine cli) {
        JsonObject effective = this.config.copy();
        String from = cli.getOptionValue("from");
        if (from != null) {
            effective.put(Const.Config.FromDateProp, from);
        }
        String to = cli.getOptionValue("to");
        if (to != null) {
            effective.put(Const.Config.ToDateProp, to);
        }
        return effective;
    }

    private int runStacking(StackingConfig stackingConfig, ObservationStore store, boolean streamClosed) throws Exception {
        StackingOrchestrator orchestrator = Main.createOrchestrator(stackingConfig, store, Clock.systemUTC());
        StackingResult result = orchestrator.run(new RunOptions(streamClosed));
        JsonObject json = this.isVerbose ? result.toJsonWithPartitions() : result.toJson();
        out.println(json.encodePrettily());
        return result.getPartitionsFailed() > 0 ? 1 : 0;
    }

    private void runDump(StackingConfig stackingConfig, ObservationStore store) throws Exception {
        WindowReader reader = new WindowReader(store, stackingConfig, Clock.systemUTC());
        SequenceSegmenter segmenter = new SequenceSegmenter(stackingConfig);
        DateWindow window = reader.resolveWindow();
        out.format("window: [%s, %s]\n", window.from(), window.to());

        List<GroupingKey> keys = store.listGroupingKeys(stackingConfig.getIndependentColumns());
        for (GroupingKey key : keys) {
            WindowReadResult read;
            try {
                read = reader.read(key, window);
            } catch (PartitionIntegrityException e) {
                out.format("%s: REJECTED %s\n", key, e.getMessage());
                continue;
            }
            List<Burst> bursts = segmenter.segment(read.getObservations());
            out.format("%s: %d records, %d bursts, max set %d\n",
                key, read.getObservations().size(), bursts.size(), store.maxSetId(key));
            for (Burst burst : bursts) {
                Observation first = burst.first();
                out.format("  burst %d: %d x %s %s %s %.1fs from %s\n", burst.getId(), burst.size(),
                    first.imagetype(), first.target(), first.filter(), first.exptime(),
                    ObservationSchema.formatObsdate(first.obsdate()));
                if (this.isVerbose) {
                    for (Observation o : burst.getMembers()) {
                        out.format("    id=%d obsdate=%s iobs=%d/%d stage=%d status=%s set=%d\n", o.id(),
                            ObservationSchema.formatObsdate(o.obsdate()), o.iobs(), o.nobs(), o.stage(), o.status(), o.set());
                    }
                }
            }
        }
    }

    private CommandLine parseArgs(String[] args) {
        final CLI cli = CLI.create("stacking-tool")
            .setSummary("A tool for running the stacker and inspecting bursts")
            .addArgument(new Argument()
                .setArgName("command")
                .setDescription("command to run, can be one of: run, dump")
                .setRequired(true))
            .addOption(new Option()
                .setLongName("from")
                .setShortName("f")
                .setDescription("lower date bound, yyyy-MM-dd HH:mm:ss or ISO duration (e.g. -P2D)")
                .setRequired(false))
            .addOption(new Option()
                .setLongName("to")
                .setShortName("t")
                .setDescription("upper date bound, yyyy-MM-dd HH:mm:ss or ISO duration")
                .setRequired(false))
            .addOption(new Option()
                .setLongName("stream-closed")
                .setShortName("c")
                .setDescription("no more records will arrive, the final burst may be finalized")
                .setFlag(true)
                .setRequired(false))
            .addOption(new Option()
                .setLongName("verbose")
                .setShortName("v")
                .setDescription("print per-partition and per-record detail")
                .setFlag(true)
                .setRequired(false));
        return cli.parse(Arrays.asList(args));
    }
}
