package com.tablediff.plan;

/**
 * What to do when no column is left to value-compare, because every column
 * shared by both tables is part of the primary key or ignored.
 */
public enum EmptyComparisonPolicy {
    /** Fail planning with {@link com.tablediff.exception.EmptyComparisonSetException}. */
    FAIL,
    /** Only report rows present in one table. */
    PRESENCE_ONLY
}
