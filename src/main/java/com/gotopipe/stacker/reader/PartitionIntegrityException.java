package com.gotopipe.stacker.reader;

import com.gotopipe.stacker.model.GroupingKey;

/**
 * A partition holds a record that violates the observation invariants; the whole partition is skipped.
 */
public class PartitionIntegrityException extends Exception {
    private final GroupingKey key;
    private final long observationId;

    public PartitionIntegrityException(GroupingKey key, long observationId, String message) {
        super("partition " + key + ", observation " + observationId + ": " + message);
        this.key = key;
        this.observationId = observationId;
    }

    public GroupingKey getKey() {
        return key;
    }

    public long getObservationId() {
        return observationId;
    }
}
