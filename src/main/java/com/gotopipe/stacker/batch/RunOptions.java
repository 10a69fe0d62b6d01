package com.gotopipe.stacker.batch;

/**
 * Per-run switches.
 *
 * @param streamClosed no more exposures will arrive, so the final burst of each partition may be finalized as well
 */
public record RunOptions(boolean streamClosed) {
    public static final RunOptions DEFAULT = new RunOptions(false);
}
