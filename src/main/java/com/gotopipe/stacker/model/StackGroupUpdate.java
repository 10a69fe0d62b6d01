package com.gotopipe.stacker.model;

import java.util.List;

/**
 * The updates for one promoted stack group, or for one passed-through burst.
 * A group update is applied all-or-nothing.
 */
public final class StackGroupUpdate {
    public enum Kind {
        /** Chunk promoted to a new stack group: stage 4, status starting. */
        STACK,
        /** Single exposure or over-long burst finalized without stacking: stage 4, status notprocessed. */
        PASS_THROUGH
    }

    private final Kind kind;
    private final int burstId;
    private final int set;
    private final List<ObservationUpdate> updates;

    public StackGroupUpdate(Kind kind, int burstId, int set, List<ObservationUpdate> updates) {
        if (updates.isEmpty()) {
            throw new IllegalArgumentException("group update without members");
        }
        this.kind = kind;
        this.burstId = burstId;
        this.set = set;
        this.updates = List.copyOf(updates);
    }

    public Kind getKind() {
        return kind;
    }

    public int getBurstId() {
        return burstId;
    }

    /** New group id for {@link Kind#STACK}; for {@link Kind#PASS_THROUGH} members keep their own set. */
    public int getSet() {
        return set;
    }

    public List<ObservationUpdate> getUpdates() {
        return updates;
    }

    public int size() {
        return updates.size();
    }

    @Override
    public String toString() {
        return kind + "[burst=" + burstId + ", set=" + set + ", members=" + updates.size() + "]";
    }
}
