package com.tablediff.generator;

import com.tablediff.exception.InvalidTableReferenceException;
import com.tablediff.schema.TableRef;
import com.tablediff.types.ScalarType;

import java.util.List;

/**
 * BigQuery standard SQL dialect.
 *
 * <p>Identifiers and fully qualified table names are quoted with backticks.
 * Table names must be {@code project.dataset.table}, or {@code dataset.table}
 * when a default project is configured.
 */
public final class BigQueryDialect implements SQLDialect {

    private final String defaultProject;

    /**
     * Creates a dialect without a default project; every table must be fully qualified.
     */
    public BigQueryDialect() {
        this(null);
    }

    /**
     * Creates a dialect that qualifies {@code dataset.table} names with a project.
     *
     * @param defaultProject the project ID, or null
     */
    public BigQueryDialect(String defaultProject) {
        this.defaultProject = defaultProject == null || defaultProject.isBlank() ? null : defaultProject;
    }

    public String defaultProject() {
        return defaultProject;
    }

    @Override
    public String name() {
        return "bigquery";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return SQLQuoting.quoteBacktickIdentifier(identifier);
    }

    @Override
    public String quoteTableName(TableRef table) {
        return SQLQuoting.quoteBacktickIdentifier(table.name());
    }

    @Override
    public TableRef qualify(TableRef table) {
        List<String> parts = table.parts();
        if (parts.size() == 3) {
            return table;
        }
        if (parts.size() == 2) {
            if (defaultProject == null) {
                throw new InvalidTableReferenceException(
                    "Table name '" + table + "' is missing project ID, and no default project is set. " +
                    "Provide the full name as 'project.dataset.table'.");
            }
            return TableRef.of(List.of(defaultProject, parts.get(0), parts.get(1)));
        }
        throw new InvalidTableReferenceException(
            "Invalid BigQuery table name format: '" + table + "'. " +
            "Expected [project.]dataset.table");
    }

    @Override
    public String castTypeName(ScalarType type) {
        // BigQuery spells every supported type the canonical way
        return type.name();
    }

    @Override
    public String nullSafeDistinct(String left, String right) {
        return left + " IS DISTINCT FROM " + right;
    }

    @Override
    public String fullOuterJoin() {
        return "FULL OUTER JOIN";
    }

    @Override
    public String limitClause(int limit) {
        return "LIMIT " + limit;
    }

    @Override
    public String toString() {
        return defaultProject == null ? name() : name() + "(" + defaultProject + ")";
    }
}
