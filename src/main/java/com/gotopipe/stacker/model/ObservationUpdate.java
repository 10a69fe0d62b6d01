package com.gotopipe.stacker.model;

/**
 * Intent to move one record to a new stage/status/set.
 * The write only applies if the record is still at {@code expectedStage}.
 */
public record ObservationUpdate(
    long id,
    int expectedStage,
    int stage,
    String status,
    int set
) {}
