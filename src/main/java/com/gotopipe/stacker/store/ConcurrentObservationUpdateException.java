package com.gotopipe.stacker.store;

/**
 * A group update found a member that no longer has the expected stage; nothing of the group was written.
 */
public class ConcurrentObservationUpdateException extends ObservationStoreException {
    private final long observationId;

    public ConcurrentObservationUpdateException(long observationId, int expectedStage) {
        super("observation " + observationId + " is no longer at stage " + expectedStage);
        this.observationId = observationId;
    }

    public long getObservationId() {
        return observationId;
    }
}
