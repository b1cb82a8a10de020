package com.tablediff.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when the engine rejects or fails the reconciliation query.
 *
 * <p>The engine's message is kept verbatim and the generated SQL is attached
 * for diagnosis. Failed queries are never retried; a failure yields no diff
 * records at all.
 *
 * <p>Example usage:
 * <pre>
 *   try (DiffStream diffs = comparator.compare(table1, table2, options)) {
 *       diffs.forEachRemaining(writer::write);
 *   } catch (QueryExecutionException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed SQL: " + e.getFailedSQL());
 *   }
 * </pre>
 *
 * @see com.tablediff.runtime.QueryEngine
 */
public class QueryExecutionException extends TableDiffException {

    private static final Pattern COLUMN_NOT_FOUND =
        Pattern.compile("column \"([^\"]+)\" not found", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONVERSION =
        Pattern.compile("Could not convert string '([^']*)' to ([A-Z0-9_]+)");

    private final String failedSQL;

    /**
     * Creates a query execution exception.
     *
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, String sql) {
        super(ErrorKind.QUERY_EXECUTION_FAILURE, message);
        this.failedSQL = sql;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException or BigQueryException)
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(ErrorKind.QUERY_EXECUTION_FAILURE, message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Recognizes the engine errors a reconciliation query typically hits:
     * a cast that cannot convert the stored values, a column that vanished
     * between schema lookup and execution, or a missing table.
     *
     * @return user-friendly error message
     */
    @Override
    public String getUserMessage() {
        String message = getMessage();

        if (message == null) {
            return "Query execution failed.";
        }

        if (message.contains("Conversion Error") || message.contains("Bad ")) {
            Matcher matcher = CONVERSION.matcher(message);
            if (matcher.find()) {
                return "Cannot convert value '" + matcher.group(1) + "' to " + matcher.group(2) +
                       ". Check the --scalar-casts type for this column.";
            }
            return "A scalar cast could not convert the stored values: " + message;
        }

        if (message.contains("Binder Error")) {
            Matcher matcher = COLUMN_NOT_FOUND.matcher(message);
            if (matcher.find()) {
                return "Column '" + matcher.group(1) + "' not found. " +
                       "The table schema may have changed during the comparison.";
            }
            return "Query binding failed: " + message;
        }

        if (message.contains("Catalog Error") || message.contains("Not found: Table")) {
            return "Table not found while executing the comparison: " + message;
        }

        return "Query execution failed: " + message;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Execution Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
