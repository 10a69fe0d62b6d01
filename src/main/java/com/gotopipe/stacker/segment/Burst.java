package com.gotopipe.stacker.segment;

import com.gotopipe.stacker.model.Observation;

import java.util.List;

/**
 * Maximal run of exposures with the same imaging settings, from one requested sequence,
 * without an interruption longer than the configured gap.
 */
public final class Burst {
    private final int id;
    private final List<Observation> members;

    public Burst(int id, List<Observation> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("empty burst " + id);
        }
        this.id = id;
        this.members = List.copyOf(members);
    }

    public int getId() {
        return id;
    }

    /** Members in obsdate order. */
    public List<Observation> getMembers() {
        return members;
    }

    public int size() {
        return members.size();
    }

    public Observation first() {
        return members.get(0);
    }

    @Override
    public String toString() {
        Observation first = first();
        return "Burst{id=" + id + ", size=" + members.size() + ", target=" + first.target() +
            ", filter=" + first.filter() + ", exptime=" + first.exptime() + ", start=" + first.obsdate() + "}";
    }
}
