package com.tablediff.diff;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One reported row: its key, the differing column values, and the status.
 *
 * <p>Each diff entry maps a column to a two-element list {@code [value1, value2]}
 * where either element may be null. For rows present in only one table the
 * other side's values are null.
 */
public final class DiffRecord {

    private final Map<String, Object> primaryKey;
    private final Map<String, List<Object>> diffs;
    private final DiffStatus status;

    /**
     * Creates a record.
     *
     * @param primaryKey key column to value, in key order
     * @param diffs column to {@code [value1, value2]}, in comparison order
     * @param status the status
     */
    public DiffRecord(Map<String, ?> primaryKey, Map<String, List<Object>> diffs, DiffStatus status) {
        Objects.requireNonNull(primaryKey, "primaryKey must not be null");
        Objects.requireNonNull(diffs, "diffs must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.primaryKey = Collections.unmodifiableMap(new LinkedHashMap<>(primaryKey));

        Map<String, List<Object>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : diffs.entrySet()) {
            List<Object> pair = entry.getValue();
            if (pair == null || pair.size() != 2) {
                throw new IllegalArgumentException("diff for column " + entry.getKey() + " must have two values");
            }
            copy.put(entry.getKey(), Collections.unmodifiableList(Arrays.asList(pair.get(0), pair.get(1))));
        }
        this.diffs = Collections.unmodifiableMap(copy);
    }

    public Map<String, Object> primaryKey() {
        return primaryKey;
    }

    public Map<String, List<Object>> diffs() {
        return diffs;
    }

    public DiffStatus status() {
        return status;
    }

    /**
     * Returns the value pair for one column.
     *
     * @param column the column name
     * @return {@code [value1, value2]}, or null if the column did not differ
     */
    public List<Object> diff(String column) {
        return diffs.get(column);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DiffRecord)) return false;
        DiffRecord that = (DiffRecord) obj;
        return primaryKey.equals(that.primaryKey) &&
               diffs.equals(that.diffs) &&
               status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(primaryKey, diffs, status);
    }

    @Override
    public String toString() {
        return "DiffRecord{" + primaryKey + ", diffs=" + diffs + ", status=" + status + '}';
    }
}
