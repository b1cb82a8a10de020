package com.tablediff.exception;

/**
 * Categories of failures reported by a table comparison.
 *
 * <p>Every kind except {@link #QUERY_EXECUTION_FAILURE} is detected while
 * planning, before any query reaches the engine.
 */
public enum ErrorKind {
    SCHEMA_NOT_FOUND,
    INVALID_TABLE_REFERENCE,
    MISSING_PRIMARY_KEY,
    EMPTY_COMPARISON_SET,
    COLUMN_NAME_CONFLICT,
    UNKNOWN_CAST_TYPE,
    CAST_COLUMN_NOT_COMPARABLE,
    QUERY_EXECUTION_FAILURE;

    /**
     * Returns whether this kind is raised before the reconciliation query is sent.
     *
     * @return true for planning-time failures
     */
    public boolean isPlanningFailure() {
        return this != QUERY_EXECUTION_FAILURE;
    }
}
