package com.gotopipe.stacker.batch;

/**
 * Represents how a stacking run ended.
 */
public enum StopReason {

    /**
     * Every partition was processed.
     */
    NONE,

    /**
     * The store holds no partitions for the configured independent columns.
     */
    NO_PARTITIONS,

    /**
     * At least one partition was rejected or hit a conflicting update; the others were processed.
     */
    PARTITION_ERRORS
}
