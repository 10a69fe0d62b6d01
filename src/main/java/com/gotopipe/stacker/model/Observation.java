package com.gotopipe.stacker.model;

import java.time.LocalDateTime;

/**
 * One exposure record as read from the observation store.
 *
 * <p>{@code set} is the stack group id; it is only unique within a grouping-key partition.</p>
 */
public record Observation(
    long id,
    String telescope,
    String camera,
    String instrument,
    String imagetype,
    String target,
    String filter,
    double exptime,
    LocalDateTime obsdate,
    int iobs,
    int nobs,
    int stage,
    String status,
    int set
) {
    /**
     * Value of a grouping column for this record.
     *
     * @throws IllegalArgumentException if the column cannot be used for grouping
     */
    public String attribute(String column) {
        switch (column) {
            case "telescope":
                return telescope;
            case "camera":
                return camera;
            case "instrument":
                return instrument;
            case "imagetype":
                return imagetype;
            case "target":
                return target;
            case "filter":
                return filter;
            default:
                throw new IllegalArgumentException("not a grouping column: " + column);
        }
    }
}
