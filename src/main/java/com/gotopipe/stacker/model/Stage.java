package com.gotopipe.stacker.model;

import java.util.Set;

/**
 * Reduction stages and the status vocabulary valid within each.
 *
 * <p>Stages 1-3 are owned by the external reduction pipeline and move
 * {@code unknown -> processing -> completed}. Stage 4 is owned by the stacker:
 * {@code notprocessed} means no stack was formed, {@code starting} means the
 * record was handed to a stacking worker as part of a new group.</p>
 */
public final class Stage {
    public static final int RAW = 0;
    public static final int REDUCTION_1 = 1;
    public static final int REDUCTION_2 = 2;
    public static final int REDUCTION_3 = 3;
    public static final int STACKING = 4;

    public static final String STATUS_UNKNOWN = "unknown";
    public static final String STATUS_PROCESSING = "processing";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_NOT_PROCESSED = "notprocessed";
    public static final String STATUS_STARTING = "starting";

    private static final Set<String> REDUCTION_STATUSES = Set.of(STATUS_UNKNOWN, STATUS_PROCESSING, STATUS_COMPLETED);
    private static final Set<String> STACKING_STATUSES = Set.of(STATUS_NOT_PROCESSED, STATUS_STARTING);
    private static final Set<String> READY_STATUSES = Set.of(STATUS_COMPLETED, STATUS_NOT_PROCESSED);

    private Stage() {
    }

    public static boolean isValid(int stage) {
        return stage >= RAW && stage <= STACKING;
    }

    /**
     * Whether the status belongs to the vocabulary of the given stage.
     * Statuses outside the vocabulary are tolerated in stored data but never count as ready.
     */
    public static boolean isKnownStatus(int stage, String status) {
        if (status == null) {
            return false;
        }
        switch (stage) {
            case RAW:
                return STATUS_UNKNOWN.equals(status);
            case REDUCTION_1:
            case REDUCTION_2:
            case REDUCTION_3:
                return REDUCTION_STATUSES.contains(status);
            case STACKING:
                return STACKING_STATUSES.contains(status);
            default:
                return false;
        }
    }

    /**
     * A record may join a stack (or be passed through) once the last reduction stage has finished with it.
     */
    public static boolean isReadyForStacking(Observation observation) {
        return observation.stage() == REDUCTION_3 && READY_STATUSES.contains(observation.status());
    }
}
