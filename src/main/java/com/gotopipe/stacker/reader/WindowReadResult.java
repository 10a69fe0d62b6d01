package com.gotopipe.stacker.reader;

import com.gotopipe.stacker.model.GroupingKey;
import com.gotopipe.stacker.model.Observation;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Records of one partition within the resolved date window.
 */
public class WindowReadResult {
    private final GroupingKey key;
    private final List<Observation> observations;
    private final LocalDateTime from;
    private final LocalDateTime to;

    private WindowReadResult(GroupingKey key, List<Observation> observations, LocalDateTime from, LocalDateTime to) {
        this.key = key;
        this.observations = observations;
        this.from = from;
        this.to = to;
    }

    public static WindowReadResult withObservations(GroupingKey key, List<Observation> observations, LocalDateTime from, LocalDateTime to) {
        return new WindowReadResult(key, List.copyOf(observations), from, to);
    }

    public static WindowReadResult noRecords(GroupingKey key, LocalDateTime from, LocalDateTime to) {
        return new WindowReadResult(key, List.of(), from, to);
    }

    public GroupingKey getKey() { return key; }
    public List<Observation> getObservations() { return observations; }
    public boolean isEmpty() { return observations.isEmpty(); }
    /** Resolved lower bound, null when unbounded. */
    public LocalDateTime getFrom() { return from; }
    /** Resolved upper bound, null when unbounded. */
    public LocalDateTime getTo() { return to; }
}
