package com.gotopipe.stacker.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Values of the independent columns identifying one partition of the observation stream,
 * e.g. {@code (GOTO1, UT1, CCD1)} for {@code (telescope, camera, instrument)}.
 */
public final class GroupingKey implements Comparable<GroupingKey> {
    private final List<String> columns;
    private final List<String> values;

    public GroupingKey(List<String> columns, List<String> values) {
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException("grouping key has " + columns.size() + " columns but " + values.size() + " values");
        }
        this.columns = List.copyOf(columns);
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static GroupingKey of(List<String> columns, Observation observation) {
        List<String> values = new ArrayList<>(columns.size());
        for (String column : columns) {
            values.add(observation.attribute(column));
        }
        return new GroupingKey(columns, values);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<String> getValues() {
        return values;
    }

    @Override
    public int compareTo(GroupingKey other) {
        for (int i = 0; i < Math.min(values.size(), other.values.size()); i++) {
            int cmp = compareNullable(values.get(i), other.values.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }

    private static int compareNullable(String a, String b) {
        if (a == null) {
            return b == null ? 0 : -1;
        }
        return b == null ? 1 : a.compareTo(b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupingKey)) return false;
        GroupingKey that = (GroupingKey) o;
        return columns.equals(that.columns) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, values);
    }

    @Override
    public String toString() {
        return "(" + String.join(", ", values.stream().map(String::valueOf).toArray(String[]::new)) + ")";
    }
}
