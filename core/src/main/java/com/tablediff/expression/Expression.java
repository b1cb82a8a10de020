package com.tablediff.expression;

import com.tablediff.generator.SQLDialect;

/**
 * Base interface for the typed SQL fragments a reconciliation query is built from.
 *
 * <p>Fragments are immutable and engine-agnostic: every engine-specific
 * spelling (identifier quoting, cast type names, the NULL-safe distinct
 * operator) is delegated to the {@link SQLDialect} passed to {@link #toSQL}.
 *
 * <p>All concrete implementations in this package are {@code final}.
 */
public interface Expression {

    /**
     * Converts this expression to SQL text in the given dialect.
     *
     * @param dialect the target dialect
     * @return the SQL string representation
     */
    String toSQL(SQLDialect dialect);
}
