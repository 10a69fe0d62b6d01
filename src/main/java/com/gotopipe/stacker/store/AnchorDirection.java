package com.gotopipe.stacker.store;

/**
 * Which side of a date bound an anchor record is searched on.
 */
public enum AnchorDirection {
    /** Earliest fully-reduced record at or after the bound; used for the lower bound. */
    EARLIEST,

    /** Latest fully-reduced record at or before the bound; used for the upper bound. */
    LATEST
}
