package com.tablediff.runtime;

import org.duckdb.DuckDBConnection;
import org.duckdb.DuckDBDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * DuckDB runtime - owns a single DuckDB connection.
 *
 * <p>Typical usage:
 * <pre>{@code
 * try (DuckDBRuntime runtime = DuckDBRuntime.createPersistent("/data/warehouse.duckdb")) {
 *     TableComparator comparator = TableComparator.duckdb(runtime.getConnection());
 *     ...
 * }
 * }</pre>
 *
 * <p>Test usage:
 * <pre>{@code
 * @BeforeEach
 * void setup() {
 *     runtime = DuckDBRuntime.create("jdbc:duckdb:");
 * }
 *
 * @AfterEach
 * void teardown() {
 *     runtime.close();
 * }
 * }</pre>
 */
public class DuckDBRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBRuntime.class);

    /** JDBC URL of a private in-memory database */
    public static final String IN_MEMORY_JDBC_URL = "jdbc:duckdb:";

    private final String jdbcUrl;
    private final DuckDBConnection connection;
    private volatile boolean closed = false;

    private DuckDBRuntime(String jdbcUrl) throws SQLException {
        this.jdbcUrl = jdbcUrl;

        logger.debug("Creating DuckDB runtime with URL: {}", jdbcUrl);

        // Stream results so the diff cursor does not materialize the whole result
        Properties props = new Properties();
        props.setProperty(DuckDBDriver.JDBC_STREAM_RESULTS, "true");

        Connection rawConn = DriverManager.getConnection(jdbcUrl, props);
        this.connection = rawConn.unwrap(DuckDBConnection.class);

        try (Statement stmt = connection.createStatement()) {
            stmt.execute("SET enable_progress_bar=false");
        }
    }

    /**
     * Create a new DuckDBRuntime over a private in-memory database.
     *
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if connection fails
     */
    public static DuckDBRuntime create() {
        return create(IN_MEMORY_JDBC_URL);
    }

    /**
     * Create a new DuckDBRuntime with a custom JDBC URL.
     *
     * @param jdbcUrl JDBC URL (e.g., "jdbc:duckdb:/tmp/db.duckdb")
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if connection fails
     */
    public static DuckDBRuntime create(String jdbcUrl) {
        try {
            return new DuckDBRuntime(jdbcUrl);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create DuckDB runtime: " + jdbcUrl, e);
        }
    }

    /**
     * Create a new DuckDBRuntime over an on-disk database file.
     *
     * @param dbPath path to the DuckDB database file
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if connection fails
     */
    public static DuckDBRuntime createPersistent(String dbPath) {
        logger.info("Opening DuckDB database at: {}", dbPath);
        return create("jdbc:duckdb:" + dbPath);
    }

    /**
     * Get the underlying DuckDB connection.
     *
     * <p>The connection is managed by the runtime - callers should NOT close it.
     *
     * @return the DuckDB connection
     * @throws IllegalStateException if runtime is closed
     */
    public DuckDBConnection getConnection() {
        if (closed) {
            throw new IllegalStateException("DuckDB runtime is closed");
        }
        return connection;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Close the runtime and release the connection.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        try {
            connection.close();
            logger.debug("DuckDB connection closed: {}", jdbcUrl);
        } catch (SQLException e) {
            logger.error("Error closing DuckDB connection", e);
        }
    }
}
