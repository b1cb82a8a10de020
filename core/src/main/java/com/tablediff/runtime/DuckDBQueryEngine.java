package com.tablediff.runtime;

import com.tablediff.exception.QueryExecutionException;
import org.duckdb.DuckDBStruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Blob;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Struct;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Executes queries against DuckDB over JDBC.
 *
 * <p>Rows are read from the {@link ResultSet} as the returned cursor advances.
 * JDBC temporal values are converted to {@code java.time} types and BLOBs to
 * byte arrays. LIST values become {@link List}s and STRUCT and MAP values
 * ordered {@link Map}s, converted element by element, so nested values compare
 * by content. Everything else is returned as the driver produces it.
 *
 * <p>Example usage:
 * <pre>
 *   QueryEngine engine = new DuckDBQueryEngine(runtime.getConnection());
 *   try (ResultCursor cursor = engine.execute("SELECT 42 AS answer")) {
 *       cursor.next().get("answer");   // 42
 *   }
 * </pre>
 *
 * @see DuckDBRuntime
 */
public class DuckDBQueryEngine implements QueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBQueryEngine.class);

    private final Connection connection;

    /**
     * Creates an engine over a connection. The connection is not closed by
     * the engine.
     *
     * @param connection the DuckDB JDBC connection
     */
    public DuckDBQueryEngine(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
    }

    @Override
    public ResultCursor execute(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");

        Statement stmt = null;
        try {
            stmt = connection.createStatement();
            long start = System.nanoTime();
            ResultSet rs = stmt.executeQuery(sql);
            logger.debug("DuckDB query started in {} ms", (System.nanoTime() - start) / 1_000_000);
            return new JdbcResultCursor(stmt, rs, sql);
        } catch (SQLException e) {
            closeQuietly(stmt);
            throw new QueryExecutionException("Failed to execute query: " + e.getMessage(), e, sql);
        }
    }

    private static void closeQuietly(Statement stmt) {
        if (stmt == null) {
            return;
        }
        try {
            stmt.close();
        } catch (SQLException e) {
            logger.warn("Error closing Statement: {}", e.getMessage());
        }
    }

    /**
     * Converts a JDBC value to the representation used in diff records.
     */
    static Object toJavaValue(Object value, String sql) throws SQLException {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof Time) {
            return ((Time) value).toLocalTime();
        }
        if (value instanceof Blob) {
            Blob blob = (Blob) value;
            long length = blob.length();
            if (length > Integer.MAX_VALUE) {
                throw new QueryExecutionException("BLOB value too large: " + length + " bytes", sql);
            }
            return blob.getBytes(1, (int) length);
        }
        if (value instanceof Array) {
            Object[] elements = (Object[]) ((Array) value).getArray();
            List<Object> list = new ArrayList<>(elements.length);
            for (Object element : elements) {
                list.add(toJavaValue(element, sql));
            }
            return list;
        }
        if (value instanceof DuckDBStruct) {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (Map.Entry<String, Object> field : ((DuckDBStruct) value).getMap().entrySet()) {
                fields.put(field.getKey(), toJavaValue(field.getValue(), sql));
            }
            return fields;
        }
        if (value instanceof Struct) {
            // unnamed attributes, in declaration order
            List<Object> attributes = new ArrayList<>();
            for (Object attribute : ((Struct) value).getAttributes()) {
                attributes.add(toJavaValue(attribute, sql));
            }
            return attributes;
        }
        if (value instanceof Map) {
            Map<Object, Object> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                entries.put(toJavaValue(entry.getKey(), sql), toJavaValue(entry.getValue(), sql));
            }
            return entries;
        }
        return value;
    }

    private static final class JdbcResultCursor implements ResultCursor {

        private final Statement statement;
        private final ResultSet resultSet;
        private final String sql;
        private final String[] labels;

        private ResultRow nextRow;
        private boolean exhausted = false;
        private boolean closed = false;

        JdbcResultCursor(Statement statement, ResultSet resultSet, String sql) throws SQLException {
            this.statement = statement;
            this.resultSet = resultSet;
            this.sql = sql;

            ResultSetMetaData meta = resultSet.getMetaData();
            this.labels = new String[meta.getColumnCount()];
            for (int i = 0; i < labels.length; i++) {
                labels[i] = meta.getColumnLabel(i + 1);
            }
        }

        @Override
        public boolean hasNext() {
            if (nextRow != null) {
                return true;
            }
            if (exhausted || closed) {
                return false;
            }
            try {
                if (!resultSet.next()) {
                    exhausted = true;
                    close();
                    return false;
                }
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < labels.length; i++) {
                    values.put(labels[i], toJavaValue(resultSet.getObject(i + 1), sql));
                }
                nextRow = new ResultRow(values);
                return true;
            } catch (SQLException e) {
                close();
                throw new QueryExecutionException("Failed to read query results: " + e.getMessage(), e, sql);
            }
        }

        @Override
        public ResultRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ResultRow row = nextRow;
            nextRow = null;
            return row;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                resultSet.close();
            } catch (SQLException e) {
                logger.warn("Error closing ResultSet: {}", e.getMessage());
            }
            closeQuietly(statement);
        }
    }
}
