package com.gotopipe.stacker.vertx;

import io.vertx.core.json.JsonObject;
import java.time.Instant;

/**
 * Status and result of an async stacking run in this process.
 */
public class StackingJobStatus {
    private final Instant startTime;
    private final boolean streamClosed;
    private volatile JobState state;
    private volatile JsonObject result;
    private volatile String errorMessage;
    private volatile Instant endTime;

    public enum JobState {
        RUNNING,
        COMPLETED,
        FAILED
    }

    public StackingJobStatus(boolean streamClosed) {
        this.startTime = Instant.now();
        this.streamClosed = streamClosed;
        this.state = JobState.RUNNING;
    }

    /**
     * Mark the job as completed with the given result.
     */
    public void complete(JsonObject result) {
        this.result = result;
        this.state = JobState.COMPLETED;
        this.endTime = Instant.now();
    }

    /**
     * Mark the job as failed with the given error message.
     */
    public void fail(String errorMessage) {
        this.errorMessage = errorMessage;
        this.state = JobState.FAILED;
        this.endTime = Instant.now();
    }

    public JobState getState() {
        return state;
    }

    public boolean isStreamClosed() {
        return streamClosed;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("state", state.name().toLowerCase())
                .put("stream_closed", streamClosed)
                .put("start_time", startTime.toString());

        if (endTime != null) {
            json.put("end_time", endTime.toString());
            long durationSeconds = endTime.getEpochSecond() - startTime.getEpochSecond();
            json.put("duration_seconds", durationSeconds);
        }

        if (state == JobState.COMPLETED && result != null) {
            json.put("result", result);
        }

        if (state == JobState.FAILED && errorMessage != null) {
            json.put("error", errorMessage);
        }

        return json;
    }
}
