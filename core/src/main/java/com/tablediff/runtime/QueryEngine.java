package com.tablediff.runtime;

/**
 * Capability that executes SQL text on an engine.
 *
 * <p>Implementations never retry: a rejected or failed query is reported as a
 * {@link com.tablediff.exception.QueryExecutionException} carrying the SQL.
 *
 * @see DuckDBQueryEngine
 * @see BigQueryQueryEngine
 */
@FunctionalInterface
public interface QueryEngine {

    /**
     * Executes a query.
     *
     * @param sql the SQL text
     * @return a cursor over the result rows; the caller must close it
     * @throws com.tablediff.exception.QueryExecutionException if execution fails
     */
    ResultCursor execute(String sql);
}
