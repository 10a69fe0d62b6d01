package com.gotopipe.stacker.reader;

import java.time.LocalDateTime;

/**
 * Resolved query window; a null side is unbounded.
 */
public record DateWindow(LocalDateTime from, LocalDateTime to) {
    public static final DateWindow UNBOUNDED = new DateWindow(null, null);
}
