package com.gotopipe.stacker.batch;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Statistics of one stacking run over all partitions.
 */
public class StackingResult {
    private final List<PartitionOutcome> partitions;
    private final StopReason stopReason;

    private StackingResult(List<PartitionOutcome> partitions, StopReason stopReason) {
        this.partitions = List.copyOf(partitions);
        this.stopReason = stopReason;
    }

    public static StackingResult empty(StopReason stopReason) {
        return new StackingResult(List.of(), stopReason);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<PartitionOutcome> getPartitions() {
        return partitions;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public int getPartitionsProcessed() {
        return (int) partitions.stream().filter(p -> !p.isFailed()).count();
    }

    public int getPartitionsFailed() {
        return (int) partitions.stream().filter(PartitionOutcome::isFailed).count();
    }

    public int getStacksPromoted() {
        return partitions.stream().mapToInt(PartitionOutcome::getStacksPromoted).sum();
    }

    public int getObservationsPromoted() {
        return partitions.stream().mapToInt(PartitionOutcome::getObservationsPromoted).sum();
    }

    public int getObservationsPassedThrough() {
        return partitions.stream().mapToInt(PartitionOutcome::getObservationsPassedThrough).sum();
    }

    public int getChunksDeferred() {
        return partitions.stream().mapToInt(PartitionOutcome::getChunksDeferred).sum();
    }

    /**
     * Convert to JSON with the run totals.
     */
    public JsonObject toJson() {
        return new JsonObject()
            .put("partitions_processed", getPartitionsProcessed())
            .put("partitions_failed", getPartitionsFailed())
            .put("stacks_promoted", getStacksPromoted())
            .put("observations_promoted", getObservationsPromoted())
            .put("observations_passed_through", getObservationsPassedThrough())
            .put("chunks_deferred", getChunksDeferred())
            .put("stop_reason", stopReason.name());
    }

    /**
     * Convert to JSON with the run totals and one entry per partition.
     */
    public JsonObject toJsonWithPartitions() {
        JsonArray outcomes = new JsonArray();
        partitions.forEach(p -> outcomes.add(p.toJson()));
        return toJson().put("partitions", outcomes);
    }

    /**
     * Convert to JSON with status and totals.
     */
    public JsonObject toJsonWithStatus(String status) {
        return toJsonWithPartitions().put("status", status);
    }

    public static class Builder {
        private final List<PartitionOutcome> partitions = new ArrayList<>();

        public Builder add(PartitionOutcome outcome) {
            partitions.add(outcome);
            return this;
        }

        public StackingResult build() {
            if (partitions.isEmpty()) {
                return StackingResult.empty(StopReason.NO_PARTITIONS);
            }
            boolean failed = partitions.stream().anyMatch(PartitionOutcome::isFailed);
            return new StackingResult(partitions, failed ? StopReason.PARTITION_ERRORS : StopReason.NONE);
        }
    }
}
