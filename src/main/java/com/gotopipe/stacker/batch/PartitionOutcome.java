package com.gotopipe.stacker.batch;

import com.gotopipe.stacker.model.GroupingKey;
import io.vertx.core.json.JsonObject;

/**
 * What a run did with one partition.
 */
public class PartitionOutcome {
    public enum Status {
        PROCESSED,
        EMPTY,
        REJECTED,
        CONFLICT
    }

    private final GroupingKey key;
    private final Status status;
    private final int observationsRead;
    private final int bursts;
    private final int stacksPromoted;
    private final int observationsPromoted;
    private final int observationsPassedThrough;
    private final int chunksDeferred;
    private final String error;

    private PartitionOutcome(GroupingKey key, Status status, int observationsRead, int bursts, int stacksPromoted,
                             int observationsPromoted, int observationsPassedThrough, int chunksDeferred, String error) {
        this.key = key;
        this.status = status;
        this.observationsRead = observationsRead;
        this.bursts = bursts;
        this.stacksPromoted = stacksPromoted;
        this.observationsPromoted = observationsPromoted;
        this.observationsPassedThrough = observationsPassedThrough;
        this.chunksDeferred = chunksDeferred;
        this.error = error;
    }

    public static PartitionOutcome empty(GroupingKey key) {
        return new PartitionOutcome(key, Status.EMPTY, 0, 0, 0, 0, 0, 0, null);
    }

    public static PartitionOutcome processed(GroupingKey key, int observationsRead, BatchPlan plan) {
        return new PartitionOutcome(key, Status.PROCESSED, observationsRead, plan.getBurstsSeen(), plan.getStacksPromoted(),
            plan.getObservationsPromoted(), plan.getObservationsPassedThrough(), plan.getChunksDeferred(), null);
    }

    public static PartitionOutcome rejected(GroupingKey key, String error) {
        return new PartitionOutcome(key, Status.REJECTED, 0, 0, 0, 0, 0, 0, error);
    }

    /**
     * Some groups may have been applied before the conflicting one; the counts cover only those.
     */
    public static PartitionOutcome conflict(GroupingKey key, int observationsRead, int bursts, int stacksPromoted,
                                            int observationsPromoted, int observationsPassedThrough, String error) {
        return new PartitionOutcome(key, Status.CONFLICT, observationsRead, bursts, stacksPromoted,
            observationsPromoted, observationsPassedThrough, 0, error);
    }

    public GroupingKey getKey() { return key; }
    public Status getStatus() { return status; }
    public boolean isFailed() { return status == Status.REJECTED || status == Status.CONFLICT; }
    public int getObservationsRead() { return observationsRead; }
    public int getBursts() { return bursts; }
    public int getStacksPromoted() { return stacksPromoted; }
    public int getObservationsPromoted() { return observationsPromoted; }
    public int getObservationsPassedThrough() { return observationsPassedThrough; }
    public int getChunksDeferred() { return chunksDeferred; }
    public String getError() { return error; }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("partition", key.toString())
            .put("status", status.name().toLowerCase())
            .put("observations_read", observationsRead)
            .put("bursts", bursts)
            .put("stacks_promoted", stacksPromoted)
            .put("observations_promoted", observationsPromoted)
            .put("observations_passed_through", observationsPassedThrough)
            .put("chunks_deferred", chunksDeferred);
        if (error != null) {
            json.put("error", error);
        }
        return json;
    }
}
