package com.tablediff.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The ordered columns of one table, as fetched once from the engine.
 *
 * <p>Declaration order is preserved so that the generated SQL is reproducible.
 * Instances are read-only snapshots.
 */
public final class ColumnSchema {

    private final TableRef table;
    private final List<SchemaColumn> columns;
    private final Map<String, SchemaColumn> byName;

    /**
     * Creates a schema snapshot.
     *
     * @param table the table the columns belong to
     * @param columns the columns in declaration order
     * @throws IllegalArgumentException if a column name occurs twice
     */
    public ColumnSchema(TableRef table, List<SchemaColumn> columns) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));

        Map<String, SchemaColumn> index = new LinkedHashMap<>();
        for (SchemaColumn column : columns) {
            if (index.put(column.name(), column) != null) {
                throw new IllegalArgumentException(
                    "Duplicate column '" + column.name() + "' in table " + table);
            }
        }
        this.byName = Collections.unmodifiableMap(index);
    }

    public TableRef table() {
        return table;
    }

    /**
     * Returns the columns in declaration order.
     *
     * @return unmodifiable column list
     */
    public List<SchemaColumn> columns() {
        return columns;
    }

    /**
     * Returns the column names in declaration order.
     *
     * @return the column names
     */
    public List<String> columnNames() {
        return new ArrayList<>(byName.keySet());
    }

    public boolean contains(String columnName) {
        return byName.containsKey(columnName);
    }

    public Optional<SchemaColumn> column(String columnName) {
        return Optional.ofNullable(byName.get(columnName));
    }

    public int size() {
        return columns.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(table.name()).append('(');
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sb.append(", ");
            SchemaColumn column = columns.get(i);
            sb.append(column.name()).append(' ').append(column.declaredType());
        }
        return sb.append(')').toString();
    }
}
