package com.tablediff.schema;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identifies a table by its engine-specific, dot-separated qualified name.
 *
 * <p>Examples:
 * <pre>
 *   orders                     -- DuckDB, default schema
 *   main.orders                -- DuckDB, explicit schema
 *   my-project.sales.orders    -- BigQuery, fully qualified
 * </pre>
 *
 * <p>Instances are immutable. Engine-specific qualification (such as adding a
 * default BigQuery project) produces a new reference through
 * {@link com.tablediff.generator.SQLDialect#qualify(TableRef)}.
 */
public final class TableRef {

    private final String name;
    private final List<String> parts;

    private TableRef(String name, List<String> parts) {
        this.name = name;
        this.parts = parts;
    }

    /**
     * Creates a table reference from a qualified name.
     *
     * @param name the table name, optionally qualified with dots
     * @return the table reference
     * @throws IllegalArgumentException if the name is blank or has an empty part
     */
    public static TableRef of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        String trimmed = name.trim();
        String[] split = trimmed.split("\\.", -1);
        for (String part : split) {
            if (part.isBlank()) {
                throw new IllegalArgumentException("Invalid table name (empty part): " + name);
            }
        }
        return new TableRef(trimmed, Collections.unmodifiableList(Arrays.asList(split)));
    }

    /**
     * Creates a table reference from already separated name parts.
     *
     * @param parts the name parts, outermost first
     * @return the table reference
     */
    public static TableRef of(List<String> parts) {
        Objects.requireNonNull(parts, "parts must not be null");
        return of(String.join(".", parts));
    }

    /**
     * Returns the full dot-separated name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Returns the dot-separated parts of the name, outermost first.
     *
     * @return unmodifiable list of parts
     */
    public List<String> parts() {
        return parts;
    }

    /**
     * Returns the last name part, i.e. the bare table name.
     *
     * @return the table name without qualifiers
     */
    public String tableName() {
        return parts.get(parts.size() - 1);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableRef)) return false;
        TableRef that = (TableRef) obj;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
