package com.gotopipe.stacker.store;

public class ObservationStoreException extends Exception {
    public ObservationStoreException(String message) {
        super(message);
    }

    public ObservationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
