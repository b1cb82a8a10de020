package com.tablediff.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One result row, keyed by the label of each selected expression.
 */
public final class ResultRow {

    private final Map<String, Object> values;

    /**
     * Creates a row.
     *
     * @param values label to value, in select-list order; values may be null
     */
    public ResultRow(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns the value for a label.
     *
     * @param label the result column label
     * @return the value, or null if the value is NULL or the label is absent
     */
    public Object get(String label) {
        return values.get(label);
    }

    public boolean hasLabel(String label) {
        return values.containsKey(label);
    }

    public Set<String> labels() {
        return values.keySet();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ResultRow)) return false;
        return values.equals(((ResultRow) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
