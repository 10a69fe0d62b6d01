package com.gotopipe.stacker.vertx;

import com.gotopipe.stacker.Const;
import com.gotopipe.stacker.auth.InternalAuthMiddleware;
import com.gotopipe.stacker.batch.RunOptions;
import com.gotopipe.stacker.batch.StackingOrchestrator;
import com.gotopipe.stacker.batch.StackingResult;
import com.gotopipe.stacker.batch.StopReason;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

import static com.gotopipe.stacker.util.HttpResponseHelper.*;

/**
 * Runs the stacker asynchronously, triggered over HTTP or by the {@code stacking.run} event.
 *
 * <h2>Async Job Processing</h2>
 * A run executes on a worker thread via {@link io.vertx.core.Vertx#executeBlocking(java.util.concurrent.Callable)}.
 * {@code POST /stacking/run} returns 202 immediately; clients poll {@code GET /stacking/run/status}.
 *
 * <h2>Mutual Exclusion</h2>
 * Only one run is active per process, enforced with {@link AtomicReference#compareAndSet}. A second POST while
 * a run is active returns 409; a timer event arriving while a run is active is dropped.
 * Completed or failed runs are replaced by the next request.
 *
 * <h2>API Endpoints</h2>
 * <ul>
 *   <li><code>POST /stacking/run[?stream_closed=true]</code> - start a run (202 Accepted or 409 Conflict)</li>
 *   <li><code>GET /stacking/run/status</code> - state of the current or most recent run</li>
 *   <li><code>GET /ops/healthcheck</code> - liveness</li>
 * </ul>
 */
public class StackBatchVerticle extends AbstractVerticle {
    private static final Logger LOGGER = LoggerFactory.getLogger(StackBatchVerticle.class);

    private final StackingOrchestrator orchestrator;
    private final InternalAuthMiddleware internalAuth;
    private final int listenPort;

    private final AtomicReference<StackingJobStatus> currentJob = new AtomicReference<>(null);
    private MessageConsumer<Object> runConsumer;

    private volatile boolean shutdownInProgress = false;

    public StackBatchVerticle(StackingOrchestrator orchestrator, String internalApiToken, int listenPort) {
        this.orchestrator = orchestrator;
        this.internalAuth = new InternalAuthMiddleware(internalApiToken, "stacker");
        this.listenPort = listenPort;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        LOGGER.info("Attempting to start stacker HTTP server on port: {}", listenPort);

        this.runConsumer = vertx.eventBus().consumer(Const.Event.StackingRun, msg -> this.handleRunEvent());

        try {
            vertx.createHttpServer()
                    .requestHandler(createRouter())
                    .listen(listenPort, result -> {
                        if (result.succeeded()) {
                            LOGGER.info("Stacker HTTP server started on port: {}", listenPort);
                            startPromise.complete();
                        } else {
                            LOGGER.error("Failed to start stacker HTTP server", result.cause());
                            startPromise.fail(result.cause());
                        }
                    });
        } catch (Exception e) {
            LOGGER.error("Failed to start stacker HTTP server", e);
            startPromise.fail(e);
        }
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        LOGGER.info("Stopping stacker...");
        this.shutdownInProgress = true;
        if (this.runConsumer != null) {
            this.runConsumer.unregister();
        }
        stopPromise.complete();
        LOGGER.info("Stacker stopped");
    }

    private Router createRouter() {
        Router router = Router.router(vertx);

        router.get(Endpoints.OPS_HEALTHCHECK.toString()).handler(rc -> rc.response().end("OK"));

        router.post(Endpoints.STACKING_RUN.toString())
                .handler(internalAuth.handleWithAudit(this::handleRunStart));

        router.get(Endpoints.STACKING_RUN_STATUS.toString())
                .handler(internalAuth.handleWithAudit(this::handleRunStatus));

        router.route().failureHandler(new GenericFailureHandler());
        return router;
    }

    /**
     * Handler for GET /stacking/run/status
     */
    private void handleRunStatus(RoutingContext routingContext) {
        HttpServerResponse resp = routingContext.response();

        StackingJobStatus job = currentJob.get();
        if (job == null) {
            sendIdle(resp, "No stacking run in this process");
            return;
        }

        sendSuccess(resp, job.toJson());
    }

    /**
     * Handler for POST /stacking/run
     */
    private void handleRunStart(RoutingContext routingContext) {
        HttpServerResponse resp = routingContext.response();

        String streamClosedParam = routingContext.request().getParam("stream_closed");
        if (streamClosedParam != null && !"true".equalsIgnoreCase(streamClosedParam) && !"false".equalsIgnoreCase(streamClosedParam)) {
            sendBadRequest(resp, "stream_closed must be true or false");
            return;
        }
        boolean streamClosed = Boolean.parseBoolean(streamClosedParam);

        LOGGER.info("Stacking run requested via {} (streamClosed={})", Endpoints.STACKING_RUN, streamClosed);

        StackingJobStatus newJob = tryStartJob(streamClosed);
        if (newJob == null) {
            sendConflict(resp, "A stacking run is already running in this process");
            return;
        }

        sendAccepted(resp, "Stacking run started");
    }

    private void handleRunEvent() {
        if (tryStartJob(false) == null) {
            LOGGER.info("Skipping timer-triggered stacking run, previous run still active");
        }
    }

    /**
     * @return the started job, or null when a run is already active
     */
    private StackingJobStatus tryStartJob(boolean streamClosed) {
        StackingJobStatus existingJob = currentJob.get();
        if (existingJob != null && existingJob.getState() == StackingJobStatus.JobState.RUNNING) {
            LOGGER.warn("Stacking run already running in this process");
            return null;
        }
        if (existingJob != null) {
            LOGGER.info("Auto-clearing previous {} run to start new one", existingJob.getState());
        }

        StackingJobStatus newJob = new StackingJobStatus(streamClosed);
        if (!currentJob.compareAndSet(existingJob, newJob)) {
            return null;
        }
        startJob(newJob);
        return newJob;
    }

    private void startJob(StackingJobStatus job) {
        vertx.executeBlocking(() -> {
            LOGGER.info("Stacking run starting on worker thread");
            return runBlocking(new RunOptions(job.isStreamClosed()));
        }).onComplete(ar -> {
            if (ar.succeeded()) {
                JsonObject result = ar.result();
                job.complete(result);
                vertx.eventBus().publish(Const.Event.StackingCompleted, result);
                LOGGER.info("Stacking run succeeded: {}", result.encode());
            } else {
                String errorMsg = ar.cause().getMessage();
                job.fail(errorMsg);
                LOGGER.error("Stacking run failed: {}", errorMsg, ar.cause());
            }
        });
    }

    private JsonObject runBlocking(RunOptions options) throws Exception {
        if (this.shutdownInProgress) {
            throw new Exception("Stacker is shutting down");
        }

        StackingResult result = orchestrator.run(options);

        // "success" = every partition processed
        // "skipped" = no partitions in the store
        // "partial" = some partitions rejected or hit conflicting updates
        return result.toJsonWithStatus(statusOf(result.getStopReason()));
    }

    static String statusOf(StopReason stopReason) {
        switch (stopReason) {
            case NO_PARTITIONS:
                return "skipped";
            case PARTITION_ERRORS:
                return "partial";
            default:
                return "success";
        }
    }
}
