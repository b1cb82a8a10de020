package com.tablediff.runtime;

import java.util.Iterator;

/**
 * Lazy, single-pass iteration over the rows of one executed query.
 *
 * <p>Rows are fetched from the engine as the cursor advances. Closing the
 * cursor early releases the engine resources; the query cannot be resumed
 * and has to be executed again to see the rows a second time.
 *
 * <p>Failures while fetching are reported as
 * {@link com.tablediff.exception.QueryExecutionException}.
 */
public interface ResultCursor extends Iterator<ResultRow>, AutoCloseable {

    /**
     * Releases the underlying result set. Idempotent.
     */
    @Override
    void close();
}
