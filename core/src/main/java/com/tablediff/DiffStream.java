package com.tablediff;

import com.tablediff.diff.DiffRecord;
import com.tablediff.plan.ComparisonPlan;
import com.tablediff.runtime.ResultCursor;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * The records of one executed comparison.
 *
 * <p>Records are produced while iterating; closing the stream releases the
 * engine cursor, also when iteration stopped early.
 */
public final class DiffStream implements Iterator<DiffRecord>, AutoCloseable {

    private final String sql;
    private final ComparisonPlan plan;
    private final ResultCursor cursor;
    private final Iterator<DiffRecord> records;
    private boolean closed = false;

    DiffStream(String sql, ComparisonPlan plan, ResultCursor cursor, Iterator<DiffRecord> records) {
        this.sql = sql;
        this.plan = plan;
        this.cursor = cursor;
        this.records = records;
    }

    /**
     * Returns the executed reconciliation query.
     *
     * @return the SQL text
     */
    public String sql() {
        return sql;
    }

    public ComparisonPlan plan() {
        return plan;
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        boolean more = records.hasNext();
        if (!more) {
            close();
        }
        return more;
    }

    @Override
    public DiffRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return records.next();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            cursor.close();
        }
    }
}
