package com.gotopipe.stacker;

import com.gotopipe.stacker.batch.StackBatcher;
import com.gotopipe.stacker.batch.StackingMetrics;
import com.gotopipe.stacker.batch.StackingOrchestrator;
import com.gotopipe.stacker.config.StackingConfig;
import com.gotopipe.stacker.config.StackingConfig.MalformedStackingConfigException;
import com.gotopipe.stacker.reader.WindowReader;
import com.gotopipe.stacker.segment.SequenceSegmenter;
import com.gotopipe.stacker.store.JdbcObservationStore;
import com.gotopipe.stacker.store.ObservationDataSources;
import com.gotopipe.stacker.store.ObservationStore;
import com.gotopipe.stacker.store.ObservationStoreException;
import com.gotopipe.stacker.vertx.Endpoints;
import com.gotopipe.stacker.vertx.StackBatchVerticle;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.prometheus.PrometheusRenameFilter;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.*;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.micrometer.Label;
import io.vertx.micrometer.MetricsDomain;
import io.vertx.micrometer.MicrometerMetricsOptions;
import io.vertx.micrometer.VertxPrometheusOptions;
import io.vertx.micrometer.backends.BackendRegistries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

//
// produces events:
//   - stacking.run       (timer-based, when stacking_run_interval_seconds > 0)
//   - stacking.completed (after each successful run, from StackBatchVerticle)
//
public class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    private final Vertx vertx;
    private final JsonObject config;
    private final StackingConfig stackingConfig;
    private final HikariDataSource dataSource;

    public Main(Vertx vertx, JsonObject config) throws MalformedStackingConfigException, ObservationStoreException {
        this.vertx = vertx;
        this.config = config;
        // fail fast, before touching the database
        this.stackingConfig = StackingConfig.fromJson(config);
        LOGGER.info("loaded {}", this.stackingConfig);

        this.dataSource = ObservationDataSources.create(this.stackingConfig);
        ObservationDataSources.ensureSchema(this.dataSource);
    }

    public static void main(String[] args) {
        final String vertxConfigPath = System.getProperty(Const.Config.VERTX_CONFIG_PATH_PROP);
        if (vertxConfigPath != null) {
            LOGGER.info("Running CUSTOM CONFIG mode, config: {}", vertxConfigPath);
        } else {
            LOGGER.info("Running LOCAL mode, config: {}", Const.Config.LOCAL_CONFIG_PATH);
            System.setProperty(Const.Config.VERTX_CONFIG_PATH_PROP, Const.Config.LOCAL_CONFIG_PATH);
        }

        VertxPrometheusOptions prometheusOptions = new VertxPrometheusOptions()
            .setStartEmbeddedServer(true)
            .setEmbeddedServerOptions(new HttpServerOptions().setPort(Const.Port.PrometheusPortForStacker))
            .setEnabled(true);

        MicrometerMetricsOptions metricOptions = new MicrometerMetricsOptions()
            .setPrometheusOptions(prometheusOptions)
            .setLabels(EnumSet.of(Label.HTTP_METHOD, Label.HTTP_CODE, Label.HTTP_PATH))
            .setJvmMetricsEnabled(true)
            .setEnabled(true);
        setupMetrics(metricOptions);

        VertxOptions vertxOptions = new VertxOptions()
            .setMetricsOptions(metricOptions)
            .setBlockedThreadCheckInterval(60 * 1000);

        Vertx vertx = Vertx.vertx(vertxOptions);

        ConfigRetriever retriever = createConfigRetriever(vertx);
        retriever.getConfig(ar -> {
            if (ar.failed()) {
                LOGGER.error("Unable to read config: " + ar.cause().getMessage(), ar.cause());
                vertx.close();
                System.exit(1);
                return;
            }
            try {
                Main app = new Main(vertx, ar.result());
                app.run();
            } catch (Exception e) {
                LOGGER.error("Unable to create/run application: " + e.getMessage(), e);
                vertx.close();
                System.exit(1);
            }
        });
    }

    /**
     * Reads the JSON file named by {@code vertx-config-path}, overlaid with environment variables.
     */
    public static ConfigRetriever createConfigRetriever(Vertx vertx) {
        String path = System.getProperty(Const.Config.VERTX_CONFIG_PATH_PROP, Const.Config.LOCAL_CONFIG_PATH);

        ConfigStoreOptions fileStore = new ConfigStoreOptions()
            .setType("file")
            .setFormat("json")
            .setConfig(new JsonObject().put("path", path));

        ConfigStoreOptions envStore = new ConfigStoreOptions()
            .setType("env")
            .setOptional(true);

        ConfigRetrieverOptions options = new ConfigRetrieverOptions()
            .setScanPeriod(0)
            .addStore(fileStore)
            .addStore(envStore);

        return ConfigRetriever.create(vertx, options);
    }

    /**
     * Wires reader, segmenter, batcher and orchestrator from one validated config.
     */
    public static StackingOrchestrator createOrchestrator(StackingConfig config, ObservationStore store, Clock clock) {
        return new StackingOrchestrator(
            store,
            config.getIndependentColumns(),
            new WindowReader(store, config, clock),
            new SequenceSegmenter(config),
            new StackBatcher(config),
            new StackingMetrics(),
            config.getPartitionParallelism());
    }

    private static void setupMetrics(MicrometerMetricsOptions metricOptions) {
        BackendRegistries.setupBackend(metricOptions, null);

        if (BackendRegistries.getDefaultNow() instanceof PrometheusMeterRegistry) {
            PrometheusMeterRegistry prometheusRegistry = (PrometheusMeterRegistry) BackendRegistries.getDefaultNow();
            Set<String> knownPaths = Endpoints.pathSet();

            prometheusRegistry.config()
                // "hello.world" -> "hello_world"
                .meterFilter(new PrometheusRenameFilter())
                // keep the path label bounded
                .meterFilter(MeterFilter.replaceTagValues(Label.HTTP_PATH.toString(),
                    actualPath -> knownPaths.contains(actualPath) ? actualPath : "unknown"))
                // Don't record metrics for 404s.
                .meterFilter(MeterFilter.deny(id ->
                    id.getName().startsWith(MetricsDomain.HTTP_SERVER.getPrefix()) &&
                    Objects.equals(id.getTag(Label.HTTP_CODE.toString()), "404")))
                .commonTags("application", "goto-stacker");

            Metrics.addRegistry(prometheusRegistry);
        }
    }

    public void run() {
        this.createAppStatusMetric();

        ObservationStore store = new JdbcObservationStore(this.dataSource);
        StackingOrchestrator orchestrator = createOrchestrator(this.stackingConfig, store, Clock.systemUTC());

        String apiToken = this.config.getString(Const.Config.InternalApiTokenProp);
        if (apiToken == null || apiToken.isBlank()) {
            LOGGER.warn("{} is not set, HTTP run endpoints will reject every request", Const.Config.InternalApiTokenProp);
        }
        int port = this.config.getInteger(Const.Config.HttpPortProp, Const.Port.ServicePortForStacker);

        Supplier<Verticle> verticleSupplier = () -> new StackBatchVerticle(orchestrator, apiToken, port);

        LOGGER.info("Deploying stacker verticle...");
        this.deploy(verticleSupplier, 1)
            .compose(v -> {
                LOGGER.info("Stacker verticle deployed, setting up timers...");
                return setupTimerEvents();
            })
            .onSuccess(v -> LOGGER.info("Stacker service fully started..."))
            .onFailure(t -> {
                LOGGER.error("Unable to bootstrap stacker service and its dependencies");
                LOGGER.error(t.getMessage(), new Exception(t));
                this.dataSource.close();
                vertx.close();
                System.exit(1);
            });
    }

    private void createAppStatusMetric() {
        String version = Optional.ofNullable(System.getenv("IMAGE_VERSION")).orElse("unknown");
        Gauge.builder("app_status", () -> 1)
            .description("application version and status")
            .tag("version", version)
            .register(Metrics.globalRegistry);
    }

    private Future<String> deploy(Supplier<Verticle> verticleSupplier, int numInstances) {
        Promise<String> promise = Promise.promise();

        DeploymentOptions options = new DeploymentOptions();
        options.setInstances(numInstances);

        vertx.deployVerticle(verticleSupplier, options, ar -> promise.handle(ar));
        return promise.future();
    }

    private Future<Void> setupTimerEvents() {
        int runInterval = this.stackingConfig.getRunIntervalSeconds();
        if (runInterval == 0) {
            LOGGER.info("{} is 0, runs are only started over HTTP", Const.Config.RunIntervalSecondsProp);
            return Future.succeededFuture();
        }

        LOGGER.info("sending {} every {}s", Const.Event.StackingRun, runInterval);
        vertx.setPeriodic(1000L * runInterval, id -> {
            LOGGER.trace("sending " + Const.Event.StackingRun);
            vertx.eventBus().send(Const.Event.StackingRun, id);
        });
        return Future.succeededFuture();
    }
}
