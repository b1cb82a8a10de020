package com.tablediff.generator;

import com.tablediff.schema.TableRef;
import com.tablediff.types.ScalarType;

/**
 * The engine-specific parts of SQL generation.
 *
 * <p>{@link ComparisonQueryBuilder} and the expression fragments are
 * engine-agnostic and ask the dialect for every spelling that differs
 * between engines. A dialect is chosen once, when a comparator is
 * constructed.
 *
 * @see DuckDBDialect
 * @see BigQueryDialect
 */
public interface SQLDialect {

    /**
     * Returns the dialect's display name.
     *
     * @return the name, e.g. "duckdb"
     */
    String name();

    /**
     * Quotes a column name or output alias.
     *
     * @param identifier the identifier
     * @return the quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Renders a table reference for a FROM clause.
     *
     * @param table the table, already qualified by {@link #qualify(TableRef)}
     * @return the quoted table name
     */
    String quoteTableName(TableRef table);

    /**
     * Completes a user-supplied table reference, e.g. by adding a default project.
     *
     * @param table the reference as given
     * @return the qualified reference
     * @throws com.tablediff.exception.InvalidTableReferenceException if the name
     *         does not have a shape this engine accepts
     */
    default TableRef qualify(TableRef table) {
        return table;
    }

    /**
     * Returns this engine's name for a scalar cast target.
     *
     * @param type the scalar type
     * @return the type name to use inside {@code CAST(... AS ...)}
     */
    String castTypeName(ScalarType type);

    /**
     * Renders a NULL-safe inequality of two already rendered operands.
     *
     * @param left the left operand SQL
     * @param right the right operand SQL
     * @return SQL that is true when the operands differ, treating NULLs as equal
     */
    String nullSafeDistinct(String left, String right);

    /**
     * Returns the keyword sequence for a full outer join.
     *
     * @return e.g. "FULL OUTER JOIN"
     */
    String fullOuterJoin();

    /**
     * Renders the clause that caps the number of result rows; it is appended
     * after WHERE and ORDER BY.
     *
     * @param limit the maximum row count
     * @return the clause
     */
    String limitClause(int limit);
}
