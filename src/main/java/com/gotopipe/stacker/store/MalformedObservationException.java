package com.gotopipe.stacker.store;

/**
 * A stored record cannot be decoded, e.g. its obsdate text is not in canonical form.
 */
public class MalformedObservationException extends ObservationStoreException {
    private final long observationId;

    public MalformedObservationException(long observationId, String message, Throwable cause) {
        super("observation " + observationId + ": " + message, cause);
        this.observationId = observationId;
    }

    public long getObservationId() {
        return observationId;
    }
}
