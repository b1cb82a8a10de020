package com.tablediff.expression;

import com.tablediff.generator.SQLDialect;
import java.util.Objects;

/**
 * Expression representing a reference to a column, optionally qualified by a
 * table alias.
 *
 * <p>Examples:
 * <pre>
 *   t1."amount"
 *   "t2_amount"
 * </pre>
 *
 * <p>The column name is always quoted by the dialect; the qualifier is a
 * generated alias and is written as is.
 */
public final class ColumnReference implements Expression {

    private final String columnName;
    private final String qualifier; // Optional table alias

    /**
     * Creates a column reference with a qualifier.
     *
     * @param qualifier the table alias (may be null)
     * @param columnName the column name
     */
    public ColumnReference(String qualifier, String columnName) {
        this.qualifier = qualifier;
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
    }

    @Override
    public String toSQL(SQLDialect dialect) {
        if (qualifier != null) {
            return qualifier + "." + dialect.quoteIdentifier(columnName);
        }
        return dialect.quoteIdentifier(columnName);
    }

    @Override
    public String toString() {
        return qualifier != null ? qualifier + "." + columnName : columnName;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return Objects.equals(columnName, that.columnName) &&
               Objects.equals(qualifier, that.qualifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, qualifier);
    }

    // ==================== Factory Methods ====================

    public static ColumnReference of(String columnName) {
        return new ColumnReference(null, columnName);
    }

    public static ColumnReference qualified(String qualifier, String columnName) {
        return new ColumnReference(qualifier, columnName);
    }
}
